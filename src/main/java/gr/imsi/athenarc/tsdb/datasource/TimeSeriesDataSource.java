package gr.imsi.athenarc.tsdb.datasource;

import com.google.common.base.Preconditions;

import gr.imsi.athenarc.tsdb.domain.DataPoint;
import gr.imsi.athenarc.tsdb.exception.QueryException;
import gr.imsi.athenarc.tsdb.exception.TimeseriesException;
import gr.imsi.athenarc.tsdb.query.CompiledQuery;
import gr.imsi.athenarc.tsdb.query.Query;
import gr.imsi.athenarc.tsdb.result.QueryResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * A {@link DataSource} assembled from a backend's compiler, executor and writer.
 *
 * @param <C> the compiled form shared by the compiler and the executor
 */
public class TimeSeriesDataSource<C extends CompiledQuery> implements DataSource {

    private static final Logger LOG = LoggerFactory.getLogger(TimeSeriesDataSource.class);

    private final String driverName;
    private final Class<C> compiledType;
    private final QueryCompiler<C> compiler;
    private final QueryExecutor<C> executor;
    private final TimeSeriesWriter writer;
    private final AutoCloseable resource;

    /**
     * @param resource released by {@link #closeConnection()}; may be null
     */
    public TimeSeriesDataSource(String driverName, Class<C> compiledType, QueryCompiler<C> compiler,
                                QueryExecutor<C> executor, TimeSeriesWriter writer, AutoCloseable resource) {
        this.driverName = Preconditions.checkNotNull(driverName, "driverName");
        this.compiledType = Preconditions.checkNotNull(compiledType, "compiledType");
        this.compiler = Preconditions.checkNotNull(compiler, "compiler");
        this.executor = Preconditions.checkNotNull(executor, "executor");
        this.writer = Preconditions.checkNotNull(writer, "writer");
        this.resource = resource;
    }

    @Override
    public String getDriverName() {
        return driverName;
    }

    @Override
    public C compile(Query query) {
        return compiler.compile(query);
    }

    @Override
    public QueryResult execute(CompiledQuery compiledQuery) {
        if (!compiledType.isInstance(compiledQuery)) {
            throw new QueryException("Driver " + driverName + " cannot execute a "
                + compiledQuery.getClass().getSimpleName(), compiledQuery.getRawQuery());
        }
        return executor.execute(compiledType.cast(compiledQuery));
    }

    @Override
    public QueryResult query(Query query) {
        return executor.execute(compile(query));
    }

    @Override
    public boolean write(DataPoint dataPoint) {
        return writer.write(dataPoint);
    }

    @Override
    public boolean writeBatch(List<DataPoint> dataPoints) {
        return writer.writeBatch(dataPoints);
    }

    public QueryCompiler<C> getCompiler() {
        return compiler;
    }

    public QueryExecutor<C> getExecutor() {
        return executor;
    }

    @Override
    public void closeConnection() {
        if (resource == null) {
            return;
        }
        try {
            resource.close();
            LOG.info("Closed {} data source", driverName);
        } catch (Exception e) {
            LOG.error("Failed to close {} data source: {}", driverName, e.getMessage());
            throw new TimeseriesException("Failed to close " + driverName + " data source", e);
        }
    }
}
