package gr.imsi.athenarc.tsdb.datasource.influx;

import com.influxdb.client.InfluxDBClient;
import com.influxdb.client.InfluxDBClientFactory;
import com.influxdb.client.InfluxDBClientOptions;
import com.influxdb.client.domain.WritePrecision;

import gr.imsi.athenarc.tsdb.config.InfluxDBConfiguration;
import gr.imsi.athenarc.tsdb.datasource.connection.DatabaseConnection;
import gr.imsi.athenarc.tsdb.exception.ConnectionException;

import okhttp3.OkHttpClient;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Owns the {@link InfluxDBClient} used for Flux queries and line-protocol writes.
 */
public class InfluxDBConnection implements DatabaseConnection {

    private static final Logger LOG = LoggerFactory.getLogger(InfluxDBConnection.class);

    private final InfluxDBConfiguration configuration;
    private InfluxDBClient client;

    public InfluxDBConnection(InfluxDBConfiguration configuration) {
        this.configuration = configuration;
    }

    @Override
    public InfluxDBConnection connect() {
        if (client != null) {
            return this;
        }
        long timeoutMillis = configuration.getTimeout().toMillis();
        OkHttpClient.Builder http = new OkHttpClient.Builder()
            .readTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
            .writeTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
            .connectTimeout(timeoutMillis, TimeUnit.MILLISECONDS);
        InfluxDBClientOptions options = InfluxDBClientOptions.builder()
            .url(configuration.getUrl())
            .authenticateToken(configuration.getToken().toCharArray())
            .org(configuration.getOrg())
            .bucket(configuration.getBucket())
            .okHttpClient(http)
            .build();
        try {
            client = InfluxDBClientFactory.create(options);
        } catch (RuntimeException e) {
            LOG.error("Failed to initialize InfluxDB client for {}: {}", configuration.getUrl(), e.getMessage());
            throw new ConnectionException("Failed to connect to InfluxDB2 at " + configuration.getUrl(), e);
        }
        LOG.info("Initialized InfluxDB connection {}", configuration.getUrl());
        return this;
    }

    @Override
    public boolean isConnected() {
        return client != null;
    }

    /**
     * Posts Flux to {@code /api/v2/query} and returns the annotated CSV body.
     */
    public String queryRaw(String flux) {
        return getClient().getQueryApi().queryRaw(flux, configuration.getOrg());
    }

    /**
     * Writes line-protocol records with second precision.
     */
    public void writeRecords(List<String> records) {
        getClient().getWriteApiBlocking()
            .writeRecords(configuration.getBucket(), configuration.getOrg(), WritePrecision.S, records);
    }

    public InfluxDBClient getClient() {
        if (client == null) {
            connect();
        }
        return client;
    }

    public InfluxDBConfiguration getConfiguration() {
        return configuration;
    }

    @Override
    public void closeConnection() {
        if (client != null) {
            client.close();
            client = null;
            LOG.info("Closed InfluxDB connection {}", configuration.getUrl());
        }
    }
}
