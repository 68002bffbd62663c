package gr.imsi.athenarc.tsdb.config;

import com.google.common.base.Splitter;

import gr.imsi.athenarc.tsdb.exception.ConfigurationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;

/**
 * Builds driver configurations from {@code <driver>.<key>} properties, by
 * default read from {@code application.properties} on the classpath.
 */
public class PropertiesConfigurationLoader {

    private static final Logger LOG = LoggerFactory.getLogger(PropertiesConfigurationLoader.class);

    public static final String DEFAULT_RESOURCE = "/application.properties";

    private final Properties properties;

    public PropertiesConfigurationLoader(Properties properties) {
        this.properties = properties;
    }

    public static PropertiesConfigurationLoader fromClasspath() {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    public static PropertiesConfigurationLoader fromClasspath(String resource) {
        Properties properties = new Properties();
        try (InputStream input = PropertiesConfigurationLoader.class.getResourceAsStream(resource)) {
            if (input == null) {
                throw new ConfigurationException("Unable to find " + resource + " on the classpath");
            }
            properties.load(input);
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read " + resource, e);
        }
        LOG.debug("Loaded {} properties from {}", properties.size(), resource);
        return new PropertiesConfigurationLoader(properties);
    }

    public Properties getProperties() {
        return properties;
    }

    /**
     * @param driver a registered driver name, e.g. "influxdb2"
     */
    public DriverConfiguration load(String driver) {
        switch (driver) {
            case InfluxDBConfiguration.DRIVER_NAME:
                return loadInfluxDB();
            case GraphiteConfiguration.DRIVER_NAME:
                return loadGraphite();
            case RrdConfiguration.DRIVER_NAME:
                return loadRrd();
            case PrometheusConfiguration.DRIVER_NAME:
                return loadPrometheus();
            case NullConfiguration.DRIVER_NAME:
                return new NullConfiguration();
            case AggregateConfiguration.DRIVER_NAME:
                return loadAggregate();
            default:
                throw new ConfigurationException("No configuration known for driver: " + driver);
        }
    }

    public InfluxDBConfiguration loadInfluxDB() {
        String p = InfluxDBConfiguration.DRIVER_NAME + ".";
        InfluxDBConfiguration.Builder builder = new InfluxDBConfiguration.Builder()
            .org(get(p + "org"))
            .token(get(p + "token"))
            .bucket(get(p + "bucket"));
        if (has(p + "url")) builder.url(get(p + "url"));
        if (has(p + "timeout")) builder.timeout(getSeconds(p + "timeout"));
        return builder.build();
    }

    public GraphiteConfiguration loadGraphite() {
        String p = GraphiteConfiguration.DRIVER_NAME + ".";
        GraphiteConfiguration.Builder builder = new GraphiteConfiguration.Builder();
        if (has(p + "host")) builder.host(get(p + "host"));
        if (has(p + "port")) builder.port(getInt(p + "port"));
        if (has(p + "protocol")) builder.protocol(get(p + "protocol"));
        if (has(p + "timeout")) builder.timeout(getSeconds(p + "timeout"));
        if (has(p + "prefix")) builder.prefix(get(p + "prefix"));
        if (has(p + "batch_size")) builder.batchSize(getInt(p + "batch_size"));
        if (has(p + "web_host")) builder.webHost(get(p + "web_host"));
        if (has(p + "web_port")) builder.webPort(getInt(p + "web_port"));
        if (has(p + "web_protocol")) builder.webProtocol(get(p + "web_protocol"));
        if (has(p + "web_path")) builder.webPath(get(p + "web_path"));
        return builder.build();
    }

    public RrdConfiguration loadRrd() {
        String p = RrdConfiguration.DRIVER_NAME + ".";
        RrdConfiguration.Builder builder = new RrdConfiguration.Builder();
        if (has(p + "dir")) builder.dir(get(p + "dir"));
        if (has(p + "rrdtool_exec")) builder.rrdtoolExec(get(p + "rrdtool_exec"));
        if (has(p + "rrdcached")) builder.rrdcachedAddress(get(p + "rrdcached"));
        if (has(p + "process_timeout")) builder.processTimeout(getSeconds(p + "process_timeout"));
        if (has(p + "tag_strategy")) builder.tagStrategy(get(p + "tag_strategy"));
        if (has(p + "folder_tags")) {
            builder.folderTags(Splitter.on(',').trimResults().omitEmptyStrings().splitToList(get(p + "folder_tags")));
        }
        if (has(p + "step")) builder.defaultStep(getInt(p + "step"));
        return builder.build();
    }

    public PrometheusConfiguration loadPrometheus() {
        String p = PrometheusConfiguration.DRIVER_NAME + ".";
        PrometheusConfiguration.Builder builder = new PrometheusConfiguration.Builder();
        if (has(p + "url")) builder.url(get(p + "url"));
        if (has(p + "timeout")) builder.timeout(getSeconds(p + "timeout"));
        if (has(p + "step")) builder.defaultStep(get(p + "step"));
        return builder.build();
    }

    /**
     * {@code aggregate.write} lists the member drivers, {@code aggregate.read}
     * optionally names the one that answers queries. Each member is loaded
     * from its own properties.
     */
    public AggregateConfiguration loadAggregate() {
        String p = AggregateConfiguration.DRIVER_NAME + ".";
        requireNonEmpty(get(p + "write"), p + "write");
        AggregateConfiguration.Builder builder = new AggregateConfiguration.Builder();
        for (String driver : Splitter.on(',').trimResults().omitEmptyStrings().split(get(p + "write"))) {
            builder.write(loadMember(driver));
        }
        if (has(p + "read")) builder.read(loadMember(get(p + "read")));
        return builder.build();
    }

    private DriverConfiguration loadMember(String driver) {
        if (AggregateConfiguration.DRIVER_NAME.equals(driver)) {
            throw new ConfigurationException("Aggregate drivers cannot be nested");
        }
        return load(driver);
    }

    private boolean has(String key) {
        String value = properties.getProperty(key);
        return value != null && !value.trim().isEmpty();
    }

    private String get(String key) {
        String value = properties.getProperty(key);
        return value == null ? null : value.trim();
    }

    private int getInt(String key) {
        try {
            return Integer.parseInt(get(key));
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Expected an integer for " + key + ": " + get(key), e);
        }
    }

    private Duration getSeconds(String key) {
        return Duration.ofSeconds(getInt(key));
    }

    static void requireNonEmpty(String value, String key) {
        if (value == null || value.trim().isEmpty()) {
            throw new ConfigurationException("Missing required configuration key: " + key);
        }
    }
}
