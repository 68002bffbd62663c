package gr.imsi.athenarc.tsdb.config;

import gr.imsi.athenarc.tsdb.exception.ConfigurationException;

import org.jetbrains.annotations.Nullable;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class RrdConfiguration implements DriverConfiguration {

    public static final String DRIVER_NAME = "rrdtool";

    private final Path dir;
    private final String rrdtoolExec;
    @Nullable
    private final String rrdcachedAddress;
    private final Duration processTimeout;
    private final String tagStrategy;
    private final List<String> folderTags;
    private final int defaultStep;

    private RrdConfiguration(Builder builder) {
        this.dir = builder.dir;
        this.rrdtoolExec = builder.rrdtoolExec;
        this.rrdcachedAddress = builder.rrdcachedAddress;
        this.processTimeout = builder.processTimeout;
        this.tagStrategy = builder.tagStrategy;
        this.folderTags = Collections.unmodifiableList(new ArrayList<>(builder.folderTags));
        this.defaultStep = builder.defaultStep;
    }

    public Path getDir() { return dir; }
    public String getRrdtoolExec() { return rrdtoolExec; }
    @Nullable public String getRrdcachedAddress() { return rrdcachedAddress; }
    public Duration getProcessTimeout() { return processTimeout; }
    public String getTagStrategy() { return tagStrategy; }
    public List<String> getFolderTags() { return folderTags; }
    public int getDefaultStep() { return defaultStep; }
    @Override public String getDriverName() { return DRIVER_NAME; }

    public boolean usesRrdcached() {
        return rrdcachedAddress != null && !rrdcachedAddress.isEmpty();
    }

    public static class Builder {
        private Path dir;
        private String rrdtoolExec = "rrdtool";
        private String rrdcachedAddress;
        private Duration processTimeout = Duration.ofSeconds(300);
        private String tagStrategy = "filename";
        private List<String> folderTags = Collections.emptyList();
        private int defaultStep = 300;

        public Builder dir(Path dir) { this.dir = dir; return this; }
        public Builder dir(String dir) { this.dir = Paths.get(dir); return this; }
        public Builder rrdtoolExec(String rrdtoolExec) { this.rrdtoolExec = rrdtoolExec; return this; }
        public Builder rrdcachedAddress(String rrdcachedAddress) { this.rrdcachedAddress = rrdcachedAddress; return this; }
        public Builder processTimeout(Duration processTimeout) { this.processTimeout = processTimeout; return this; }
        public Builder tagStrategy(String tagStrategy) { this.tagStrategy = tagStrategy; return this; }
        public Builder folderTags(List<String> folderTags) { this.folderTags = folderTags; return this; }
        public Builder defaultStep(int defaultStep) { this.defaultStep = defaultStep; return this; }

        public RrdConfiguration build() {
            if (dir == null) {
                throw new ConfigurationException("Missing required configuration key: dir");
            }
            PropertiesConfigurationLoader.requireNonEmpty(rrdtoolExec, "rrdtool_exec");
            boolean cached = rrdcachedAddress != null && !rrdcachedAddress.isEmpty();
            if (!cached && !Files.isDirectory(dir)) {
                throw new ConfigurationException("RRD directory does not exist: " + dir);
            }
            if (defaultStep <= 0) {
                throw new ConfigurationException("RRD step must be positive: " + defaultStep);
            }
            return new RrdConfiguration(this);
        }
    }
}
