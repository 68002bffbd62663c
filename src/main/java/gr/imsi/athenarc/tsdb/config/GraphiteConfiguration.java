package gr.imsi.athenarc.tsdb.config;

import gr.imsi.athenarc.tsdb.exception.ConfigurationException;

import java.time.Duration;
import java.util.Locale;

/**
 * Graphite has two endpoints: the carbon receiver for plaintext writes and
 * the render API for queries.
 */
public class GraphiteConfiguration implements DriverConfiguration {

    public static final String DRIVER_NAME = "graphite";

    public enum Protocol { TCP, UDP }

    private final String host;
    private final int port;
    private final Protocol protocol;
    private final Duration timeout;
    private final String prefix;
    private final int batchSize;
    private final String webHost;
    private final int webPort;
    private final String webProtocol;
    private final String webPath;

    private GraphiteConfiguration(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.protocol = builder.protocol;
        this.timeout = builder.timeout;
        this.prefix = builder.prefix;
        this.batchSize = builder.batchSize;
        this.webHost = builder.webHost != null ? builder.webHost : builder.host;
        this.webPort = builder.webPort;
        this.webProtocol = builder.webProtocol;
        this.webPath = builder.webPath;
    }

    public String getHost() { return host; }
    public int getPort() { return port; }
    public Protocol getProtocol() { return protocol; }
    public Duration getTimeout() { return timeout; }
    public String getPrefix() { return prefix; }
    public int getBatchSize() { return batchSize; }
    public String getWebHost() { return webHost; }
    public int getWebPort() { return webPort; }
    public String getWebProtocol() { return webProtocol; }
    public String getWebPath() { return webPath; }
    @Override public String getDriverName() { return DRIVER_NAME; }

    /**
     * Render API endpoint, e.g. http://localhost:8080/render
     */
    public String getWebUrl() {
        String path = webPath.startsWith("/") ? webPath : "/" + webPath;
        return webProtocol + "://" + webHost + ":" + webPort + path;
    }

    public static class Builder {
        private String host = "localhost";
        private int port = 2003;
        private Protocol protocol = Protocol.TCP;
        private Duration timeout = Duration.ofSeconds(30);
        private String prefix = "";
        private int batchSize = 500;
        private String webHost;
        private int webPort = 8080;
        private String webProtocol = "http";
        private String webPath = "/render";

        public Builder host(String host) { this.host = host; return this; }
        public Builder port(int port) { this.port = port; return this; }
        public Builder protocol(Protocol protocol) { this.protocol = protocol; return this; }
        public Builder timeout(Duration timeout) { this.timeout = timeout; return this; }
        public Builder prefix(String prefix) { this.prefix = prefix == null ? "" : prefix; return this; }
        public Builder batchSize(int batchSize) { this.batchSize = batchSize; return this; }
        public Builder webHost(String webHost) { this.webHost = webHost; return this; }
        public Builder webPort(int webPort) { this.webPort = webPort; return this; }
        public Builder webProtocol(String webProtocol) { this.webProtocol = webProtocol; return this; }
        public Builder webPath(String webPath) { this.webPath = webPath; return this; }

        public Builder protocol(String protocol) {
            try {
                this.protocol = Protocol.valueOf(protocol.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unsupported Graphite protocol: " + protocol, e);
            }
            return this;
        }

        public GraphiteConfiguration build() {
            PropertiesConfigurationLoader.requireNonEmpty(host, "host");
            if (port <= 0 || port > 65535) {
                throw new ConfigurationException("Invalid Graphite port: " + port);
            }
            if (batchSize <= 0) {
                throw new ConfigurationException("Batch size must be positive: " + batchSize);
            }
            if (!"http".equals(webProtocol) && !"https".equals(webProtocol)) {
                throw new ConfigurationException("Unsupported Graphite web protocol: " + webProtocol);
            }
            return new GraphiteConfiguration(this);
        }
    }
}
