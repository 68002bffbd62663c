package gr.imsi.athenarc.tsdb.config;

import java.time.Duration;

public class InfluxDBConfiguration implements DriverConfiguration {

    public static final String DRIVER_NAME = "influxdb2";

    private final String url;
    private final String org;
    private final String token;
    private final String bucket;
    private final Duration timeout;

    private InfluxDBConfiguration(Builder builder) {
        this.url = builder.url;
        this.org = builder.org;
        this.token = builder.token;
        this.bucket = builder.bucket;
        this.timeout = builder.timeout;
    }

    public String getUrl() { return url; }
    public String getOrg() { return org; }
    public String getToken() { return token; }
    public String getBucket() { return bucket; }
    public Duration getTimeout() { return timeout; }
    @Override public String getDriverName() { return DRIVER_NAME; }

    public static class Builder {
        private String url = "http://localhost:8086";
        private String org, token, bucket;
        private Duration timeout = Duration.ofSeconds(30);

        public Builder url(String url) { this.url = url; return this; }
        public Builder org(String org) { this.org = org; return this; }
        public Builder token(String token) { this.token = token; return this; }
        public Builder bucket(String bucket) { this.bucket = bucket; return this; }
        public Builder timeout(Duration timeout) { this.timeout = timeout; return this; }

        public InfluxDBConfiguration build() {
            PropertiesConfigurationLoader.requireNonEmpty(url, "url");
            PropertiesConfigurationLoader.requireNonEmpty(org, "org");
            PropertiesConfigurationLoader.requireNonEmpty(token, "token");
            PropertiesConfigurationLoader.requireNonEmpty(bucket, "bucket");
            return new InfluxDBConfiguration(this);
        }
    }
}
