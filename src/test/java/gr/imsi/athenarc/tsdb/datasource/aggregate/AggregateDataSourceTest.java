package gr.imsi.athenarc.tsdb.datasource.aggregate;

import gr.imsi.athenarc.tsdb.config.AggregateConfiguration;
import gr.imsi.athenarc.tsdb.config.NullConfiguration;
import gr.imsi.athenarc.tsdb.config.PrometheusConfiguration;
import gr.imsi.athenarc.tsdb.datasource.DataSource;
import gr.imsi.athenarc.tsdb.datasource.DataSourceFactory;
import gr.imsi.athenarc.tsdb.datasource.TimeSeriesDataSource;
import gr.imsi.athenarc.tsdb.datasource.nulldriver.NullCompiler;
import gr.imsi.athenarc.tsdb.datasource.nulldriver.NullQuery;
import gr.imsi.athenarc.tsdb.datasource.nulldriver.NullQueryExecutor;
import gr.imsi.athenarc.tsdb.datasource.prometheus.PrometheusQuery;
import gr.imsi.athenarc.tsdb.domain.DataPoint;
import gr.imsi.athenarc.tsdb.exception.ConfigurationException;
import gr.imsi.athenarc.tsdb.query.Query;
import gr.imsi.athenarc.tsdb.result.TimeSeriesResult;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AggregateDataSourceTest {

    private static final DataPoint POINT = new DataPoint("cpu", Collections.singletonMap("value", 1), Instant.EPOCH);

    private static DataSource recording(String name, List<String> log) {
        return new TimeSeriesDataSource<>(name, NullQuery.class, new NullCompiler(), new NullQueryExecutor(),
            p -> log.add(name + ":" + p.getMeasurement()), () -> log.add(name + ":closed"));
    }

    @Test
    void writesEverywhereAndReadsFromFirstByDefault() {
        List<String> log = new ArrayList<>();
        DataSource first = recording("first", log);
        AggregateDataSource aggregate = new AggregateDataSource(Arrays.asList(first, recording("second", log)), null);

        assertEquals("aggregate", aggregate.getDriverName());
        assertSame(first, aggregate.getReadDataSource());
        assertTrue(aggregate.write(POINT));
        assertTrue(aggregate.writeBatch(Arrays.asList(POINT)));
        assertEquals(Arrays.asList("first:cpu", "second:cpu", "first:cpu", "second:cpu"), log);
        assertTrue(((TimeSeriesResult) aggregate.query(new Query("cpu"))).isEmpty());

        aggregate.closeConnection();
        assertEquals(Arrays.asList("first:closed", "second:closed"), log.subList(4, 6));
    }

    @Test
    void factoryBuildsMembersThroughTheRegistry() {
        DataSource dataSource = DataSourceFactory.createDataSource(new AggregateConfiguration.Builder()
            .write(new NullConfiguration())
            .write(new PrometheusConfiguration.Builder().build())
            .read(new PrometheusConfiguration.Builder().build())
            .build());

        assertTrue(dataSource instanceof AggregateDataSource);
        assertTrue(dataSource.compile(new Query("up")) instanceof PrometheusQuery);
        // prometheus rejects writes, the null driver accepts them
        assertFalse(dataSource.write(POINT));
        dataSource.closeConnection();
    }

    @Test
    void configurationNeedsWritesAndNoNesting() {
        assertThrows(ConfigurationException.class, () -> new AggregateConfiguration.Builder().build());
        AggregateConfiguration inner = new AggregateConfiguration.Builder().write(new NullConfiguration()).build();
        assertThrows(ConfigurationException.class,
            () -> new AggregateConfiguration.Builder().write(inner).build());
    }
}
