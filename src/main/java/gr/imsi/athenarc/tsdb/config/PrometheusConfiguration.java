package gr.imsi.athenarc.tsdb.config;

import java.time.Duration;

public class PrometheusConfiguration implements DriverConfiguration {

    public static final String DRIVER_NAME = "prometheus";

    private final String url;
    private final Duration timeout;
    private final String defaultStep;

    private PrometheusConfiguration(Builder builder) {
        this.url = builder.url;
        this.timeout = builder.timeout;
        this.defaultStep = builder.defaultStep;
    }

    public String getUrl() { return url; }
    public Duration getTimeout() { return timeout; }
    public String getDefaultStep() { return defaultStep; }
    @Override public String getDriverName() { return DRIVER_NAME; }

    public static class Builder {
        private String url = "http://localhost:9090";
        private Duration timeout = Duration.ofSeconds(30);
        private String defaultStep = "60s";

        public Builder url(String url) { this.url = url; return this; }
        public Builder timeout(Duration timeout) { this.timeout = timeout; return this; }
        public Builder defaultStep(String defaultStep) { this.defaultStep = defaultStep; return this; }

        public PrometheusConfiguration build() {
            PropertiesConfigurationLoader.requireNonEmpty(url, "url");
            return new PrometheusConfiguration(this);
        }
    }
}
