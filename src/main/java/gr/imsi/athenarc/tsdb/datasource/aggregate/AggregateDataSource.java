package gr.imsi.athenarc.tsdb.datasource.aggregate;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.tsdb.config.AggregateConfiguration;
import gr.imsi.athenarc.tsdb.datasource.DataSource;
import gr.imsi.athenarc.tsdb.datasource.TimeSeriesWriter;
import gr.imsi.athenarc.tsdb.domain.DataPoint;
import gr.imsi.athenarc.tsdb.exception.TimeseriesException;
import gr.imsi.athenarc.tsdb.query.CompiledQuery;
import gr.imsi.athenarc.tsdb.query.Query;
import gr.imsi.athenarc.tsdb.result.QueryResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Queries go to the read data source, writes go to every write data source
 * through an {@link AggregateWriter}.
 */
public class AggregateDataSource implements DataSource {

    private static final Logger LOG = LoggerFactory.getLogger(AggregateDataSource.class);

    private final List<DataSource> writeDataSources;
    private final DataSource readDataSource;
    private final AggregateWriter writer;

    /**
     * @param readDataSource answers queries; when null the first write data source does
     */
    public AggregateDataSource(List<DataSource> writeDataSources, DataSource readDataSource) {
        Preconditions.checkArgument(!writeDataSources.isEmpty(), "No write databases configured");
        this.writeDataSources = ImmutableList.copyOf(writeDataSources);
        this.readDataSource = readDataSource != null ? readDataSource : writeDataSources.get(0);
        List<TimeSeriesWriter> writers = new ArrayList<>();
        for (final DataSource dataSource : writeDataSources) {
            writers.add(new TimeSeriesWriter() {
                @Override
                public boolean write(DataPoint dataPoint) {
                    return dataSource.write(dataPoint);
                }

                @Override
                public boolean writeBatch(List<DataPoint> dataPoints) {
                    return dataSource.writeBatch(dataPoints);
                }
            });
        }
        this.writer = new AggregateWriter(writers);
        LOG.info("Aggregating writes over {} and reading from {}", names(this.writeDataSources),
            this.readDataSource.getDriverName());
    }

    @Override
    public String getDriverName() {
        return AggregateConfiguration.DRIVER_NAME;
    }

    public List<DataSource> getWriteDataSources() {
        return writeDataSources;
    }

    public DataSource getReadDataSource() {
        return readDataSource;
    }

    @Override
    public CompiledQuery compile(Query query) {
        return readDataSource.compile(query);
    }

    @Override
    public QueryResult execute(CompiledQuery compiledQuery) {
        return readDataSource.execute(compiledQuery);
    }

    @Override
    public QueryResult query(Query query) {
        return readDataSource.query(query);
    }

    @Override
    public boolean write(DataPoint dataPoint) {
        return writer.write(dataPoint);
    }

    @Override
    public boolean writeBatch(List<DataPoint> dataPoints) {
        return writer.writeBatch(dataPoints);
    }

    /**
     * Closes every distinct data source; the first failure is rethrown after
     * the others have been closed.
     */
    @Override
    public void closeConnection() {
        Set<DataSource> all = new LinkedHashSet<>(writeDataSources);
        all.add(readDataSource);
        TimeseriesException failure = null;
        for (DataSource dataSource : all) {
            try {
                dataSource.closeConnection();
            } catch (TimeseriesException e) {
                LOG.error("Failed to close {} data source: {}", dataSource.getDriverName(), e.getMessage());
                if (failure == null) {
                    failure = e;
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private static List<String> names(List<DataSource> dataSources) {
        List<String> names = new ArrayList<>();
        for (DataSource dataSource : dataSources) {
            names.add(dataSource.getDriverName());
        }
        return names;
    }
}
