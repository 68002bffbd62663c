package gr.imsi.athenarc.tsdb.config;

import gr.imsi.athenarc.tsdb.exception.ConfigurationException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class PropertiesConfigurationLoaderTest {

    private final PropertiesConfigurationLoader loader = PropertiesConfigurationLoader.fromClasspath("/test.properties");

    @Test
    void loadsInfluxDB() {
        InfluxDBConfiguration config = (InfluxDBConfiguration) loader.load("influxdb2");
        assertEquals("http://influx.example:8086", config.getUrl());
        assertEquals("acme", config.getOrg());
        assertEquals("secret", config.getToken());
        assertEquals("telemetry", config.getBucket());
        assertEquals(Duration.ofSeconds(5), config.getTimeout());
    }

    @Test
    void loadsGraphiteWithDefaults() {
        GraphiteConfiguration config = loader.loadGraphite();
        assertEquals("carbon.example", config.getHost());
        assertEquals(2004, config.getPort());
        assertEquals(GraphiteConfiguration.Protocol.UDP, config.getProtocol());
        assertEquals("servers", config.getPrefix());
        assertEquals(50, config.getBatchSize());
        assertEquals("http://carbon.example:8080/render", config.getWebUrl());
    }

    @Test
    void loadsPrometheus() {
        PrometheusConfiguration config = loader.loadPrometheus();
        assertEquals("http://prom.example:9090", config.getUrl());
        assertEquals("15s", config.getDefaultStep());
        assertEquals(Duration.ofSeconds(30), config.getTimeout());
    }

    @Test
    void loadsRrd(@TempDir Path dir) {
        Properties properties = new Properties();
        properties.setProperty("rrdtool.dir", dir.toString());
        properties.setProperty("rrdtool.tag_strategy", "folder");
        properties.setProperty("rrdtool.folder_tags", "region, host,");
        properties.setProperty("rrdtool.step", "60");

        RrdConfiguration config = new PropertiesConfigurationLoader(properties).loadRrd();
        assertEquals(dir, config.getDir());
        assertEquals(Arrays.asList("region", "host"), config.getFolderTags());
        assertEquals(60, config.getDefaultStep());
        assertEquals("rrdtool", config.getRrdtoolExec());
        assertFalse(config.usesRrdcached());
    }

    @Test
    void rrdDirectoryMustExistWithoutRrdcached(@TempDir Path dir) {
        Properties properties = new Properties();
        properties.setProperty("rrdtool.dir", dir.resolve("missing").toString());
        assertThrows(ConfigurationException.class, () -> new PropertiesConfigurationLoader(properties).loadRrd());

        properties.setProperty("rrdtool.rrdcached", "unix:/var/run/rrdcached.sock");
        assertTrue(new PropertiesConfigurationLoader(properties).loadRrd().usesRrdcached());
    }

    @Test
    void loadsAggregateMembers() {
        AggregateConfiguration config = (AggregateConfiguration) loader.load("aggregate");
        assertEquals(2, config.getWriteConfigurations().size());
        assertTrue(config.getWriteConfigurations().get(0) instanceof NullConfiguration);
        assertTrue(config.getWriteConfigurations().get(1) instanceof PrometheusConfiguration);
        assertTrue(config.getReadConfiguration() instanceof PrometheusConfiguration);
    }

    @Test
    void aggregateNeedsWritesAndCannotNest() {
        ConfigurationException missing = assertThrows(ConfigurationException.class,
            () -> new PropertiesConfigurationLoader(new Properties()).loadAggregate());
        assertEquals("Missing required configuration key: aggregate.write", missing.getMessage());

        Properties properties = new Properties();
        properties.setProperty("aggregate.write", "null,aggregate");
        ConfigurationException nested = assertThrows(ConfigurationException.class,
            () -> new PropertiesConfigurationLoader(properties).loadAggregate());
        assertEquals("Aggregate drivers cannot be nested", nested.getMessage());
    }

    @Test
    void missingRequiredKey() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> new PropertiesConfigurationLoader(new Properties()).loadInfluxDB());
        assertEquals("Missing required configuration key: org", e.getMessage());
    }

    @Test
    void invalidValues() {
        Properties properties = new Properties();
        properties.setProperty("graphite.port", "twenty");
        assertThrows(ConfigurationException.class, () -> new PropertiesConfigurationLoader(properties).loadGraphite());

        properties.setProperty("graphite.port", "2003");
        properties.setProperty("graphite.protocol", "sctp");
        assertThrows(ConfigurationException.class, () -> new PropertiesConfigurationLoader(properties).loadGraphite());
    }

    @Test
    void unknownDriverAndResource() {
        assertTrue(loader.load("null") instanceof NullConfiguration);
        assertThrows(ConfigurationException.class, () -> loader.load("opentsdb"));
        assertThrows(ConfigurationException.class, () -> PropertiesConfigurationLoader.fromClasspath("/absent.properties"));
    }
}
