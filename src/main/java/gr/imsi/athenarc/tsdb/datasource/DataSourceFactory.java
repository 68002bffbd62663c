package gr.imsi.athenarc.tsdb.datasource;

import gr.imsi.athenarc.tsdb.config.AggregateConfiguration;
import gr.imsi.athenarc.tsdb.config.DriverConfiguration;
import gr.imsi.athenarc.tsdb.config.GraphiteConfiguration;
import gr.imsi.athenarc.tsdb.config.InfluxDBConfiguration;
import gr.imsi.athenarc.tsdb.config.NullConfiguration;
import gr.imsi.athenarc.tsdb.config.PrometheusConfiguration;
import gr.imsi.athenarc.tsdb.config.RrdConfiguration;
import gr.imsi.athenarc.tsdb.datasource.aggregate.AggregateDataSource;
import gr.imsi.athenarc.tsdb.datasource.graphite.CarbonConnection;
import gr.imsi.athenarc.tsdb.datasource.graphite.GraphiteCompiler;
import gr.imsi.athenarc.tsdb.datasource.graphite.GraphiteQuery;
import gr.imsi.athenarc.tsdb.datasource.graphite.GraphiteQueryExecutor;
import gr.imsi.athenarc.tsdb.datasource.graphite.GraphiteWriter;
import gr.imsi.athenarc.tsdb.datasource.influx.FluxCompiler;
import gr.imsi.athenarc.tsdb.datasource.influx.FluxQuery;
import gr.imsi.athenarc.tsdb.datasource.influx.InfluxDBConnection;
import gr.imsi.athenarc.tsdb.datasource.influx.InfluxDBQueryExecutor;
import gr.imsi.athenarc.tsdb.datasource.influx.InfluxDBWriter;
import gr.imsi.athenarc.tsdb.datasource.influx.LineProtocolFormatter;
import gr.imsi.athenarc.tsdb.datasource.nulldriver.NullCompiler;
import gr.imsi.athenarc.tsdb.datasource.nulldriver.NullQuery;
import gr.imsi.athenarc.tsdb.datasource.nulldriver.NullQueryExecutor;
import gr.imsi.athenarc.tsdb.datasource.nulldriver.NullWriter;
import gr.imsi.athenarc.tsdb.datasource.prometheus.PromQLCompiler;
import gr.imsi.athenarc.tsdb.datasource.prometheus.PrometheusQuery;
import gr.imsi.athenarc.tsdb.datasource.prometheus.PrometheusQueryExecutor;
import gr.imsi.athenarc.tsdb.datasource.prometheus.PrometheusWriter;
import gr.imsi.athenarc.tsdb.datasource.rrd.RrdCommand;
import gr.imsi.athenarc.tsdb.datasource.rrd.RrdCompiler;
import gr.imsi.athenarc.tsdb.datasource.rrd.RrdInfoParser;
import gr.imsi.athenarc.tsdb.datasource.rrd.RrdProcess;
import gr.imsi.athenarc.tsdb.datasource.rrd.RrdQueryExecutor;
import gr.imsi.athenarc.tsdb.datasource.rrd.RrdWriter;
import gr.imsi.athenarc.tsdb.datasource.rrd.tag.TagStrategies;
import gr.imsi.athenarc.tsdb.datasource.rrd.tag.TagStrategy;
import gr.imsi.athenarc.tsdb.exception.ConfigurationException;
import gr.imsi.athenarc.tsdb.exception.ConnectionException;
import gr.imsi.athenarc.tsdb.exception.TimeseriesException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds data sources for the bundled backends and the registry that maps
 * their names to them.
 */
public class DataSourceFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DataSourceFactory.class);

    private DataSourceFactory() {
    }

    /**
     * A registry with {@code influxdb2}, {@code graphite}, {@code rrdtool},
     * {@code prometheus}, {@code null} and {@code aggregate} registered. The
     * aggregate driver builds its members through the same registry.
     */
    public static DriverRegistry defaultRegistry() {
        final DriverRegistry registry = new DriverRegistry();
        registry
            .register(InfluxDBConfiguration.DRIVER_NAME,
                config -> createInfluxDBDataSource(expect(config, InfluxDBConfiguration.class)))
            .register(GraphiteConfiguration.DRIVER_NAME,
                config -> createGraphiteDataSource(expect(config, GraphiteConfiguration.class)))
            .register(RrdConfiguration.DRIVER_NAME,
                config -> createRrdDataSource(expect(config, RrdConfiguration.class)))
            .register(PrometheusConfiguration.DRIVER_NAME,
                config -> createPrometheusDataSource(expect(config, PrometheusConfiguration.class)))
            .register(NullConfiguration.DRIVER_NAME, config -> createNullDataSource())
            .register(AggregateConfiguration.DRIVER_NAME,
                config -> createAggregateDataSource(expect(config, AggregateConfiguration.class), registry));
        return registry;
    }

    public static DataSource createDataSource(DriverConfiguration config) {
        return defaultRegistry().create(config);
    }

    static DataSource createInfluxDBDataSource(InfluxDBConfiguration config) {
        InfluxDBConnection connection = new InfluxDBConnection(config).connect();
        return new TimeSeriesDataSource<>(InfluxDBConfiguration.DRIVER_NAME, FluxQuery.class,
            new FluxCompiler(config.getBucket()),
            new InfluxDBQueryExecutor(connection),
            new InfluxDBWriter(connection, new LineProtocolFormatter()),
            connection);
    }

    static DataSource createGraphiteDataSource(GraphiteConfiguration config) {
        // carbon is connected on first write
        CarbonConnection connection = new CarbonConnection(config);
        return new TimeSeriesDataSource<>(GraphiteConfiguration.DRIVER_NAME, GraphiteQuery.class,
            new GraphiteCompiler(config.getPrefix()),
            new GraphiteQueryExecutor(config.getWebUrl(), config.getTimeout()),
            new GraphiteWriter(connection, config.getPrefix(), config.getBatchSize()),
            connection);
    }

    static DataSource createRrdDataSource(RrdConfiguration config) {
        TagStrategy tagStrategy = TagStrategies.forConfiguration(config);
        RrdProcess process = new RrdProcess(config);
        LOG.debug("Using {} RRD layout under {}", config.getTagStrategy(), config.getDir());
        return new TimeSeriesDataSource<>(RrdConfiguration.DRIVER_NAME, RrdCommand.class,
            new RrdCompiler(tagStrategy),
            new RrdQueryExecutor(process, tagStrategy),
            new RrdWriter(process, tagStrategy, new RrdInfoParser(), config.getDefaultStep()),
            process);
    }

    static DataSource createPrometheusDataSource(PrometheusConfiguration config) {
        return new TimeSeriesDataSource<>(PrometheusConfiguration.DRIVER_NAME, PrometheusQuery.class,
            new PromQLCompiler(),
            new PrometheusQueryExecutor(config.getUrl(), config.getTimeout(), config.getDefaultStep()),
            new PrometheusWriter(),
            null);
    }

    static DataSource createNullDataSource() {
        return new TimeSeriesDataSource<>(NullConfiguration.DRIVER_NAME, NullQuery.class,
            new NullCompiler(), new NullQueryExecutor(), new NullWriter(), null);
    }

    static DataSource createAggregateDataSource(AggregateConfiguration config, DriverRegistry registry) {
        List<DataSource> created = new ArrayList<>();
        try {
            for (DriverConfiguration member : config.getWriteConfigurations()) {
                created.add(registry.create(member));
            }
            DataSource read = null;
            if (config.getReadConfiguration() != null) {
                read = registry.create(config.getReadConfiguration());
                created.add(read);
            }
            List<DataSource> writes = created.subList(0, config.getWriteConfigurations().size());
            return new AggregateDataSource(new ArrayList<>(writes), read);
        } catch (TimeseriesException e) {
            LOG.error("Failed to create aggregate data source: {}", e.getMessage());
            for (DataSource dataSource : created) {
                try {
                    dataSource.closeConnection();
                } catch (TimeseriesException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
            }
            throw new ConnectionException("Failed to connect to aggregate member: " + e.getMessage(), e);
        }
    }

    private static <T extends DriverConfiguration> T expect(DriverConfiguration config, Class<T> type) {
        if (!type.isInstance(config)) {
            throw new ConfigurationException("Invalid configuration type. Expected " + type.getSimpleName()
                + " but got " + (config == null ? "null" : config.getClass().getSimpleName()));
        }
        return type.cast(config);
    }
}
