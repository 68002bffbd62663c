package gr.imsi.athenarc.tsdb.datasource.rrd;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * The parts of {@code rrdtool info} the driver uses.
 */
public class RrdInfo {

    private final String filename;
    private final String rrdVersion;
    private final long step;
    private final long lastUpdate;
    private final Map<String, DataSource> dataSources;
    private final List<Archive> archives;

    public RrdInfo(String filename, String rrdVersion, long step, long lastUpdate,
                   Map<String, DataSource> dataSources, List<Archive> archives) {
        this.filename = filename;
        this.rrdVersion = rrdVersion;
        this.step = step;
        this.lastUpdate = lastUpdate;
        this.dataSources = ImmutableMap.copyOf(dataSources);
        this.archives = ImmutableList.copyOf(archives);
    }

    public String getFilename() { return filename; }
    public String getRrdVersion() { return rrdVersion; }
    public long getStep() { return step; }
    public long getLastUpdate() { return lastUpdate; }
    public Map<String, DataSource> getDataSources() { return dataSources; }
    public List<Archive> getArchives() { return archives; }

    /**
     * Data source names in file order, which is the order update values are read in.
     */
    public List<String> getDataSourceNames() {
        return ImmutableList.copyOf(dataSources.keySet());
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("filename", filename)
            .add("step", step)
            .add("lastUpdate", lastUpdate)
            .add("dataSources", dataSources.keySet())
            .add("archives", archives.size())
            .toString();
    }

    public static class DataSource {
        private final String name;
        private final String type;
        private final long heartbeat;
        @Nullable private final Double min;
        @Nullable private final Double max;
        @Nullable private final String lastValue;

        public DataSource(String name, String type, long heartbeat, @Nullable Double min,
                          @Nullable Double max, @Nullable String lastValue) {
            this.name = name;
            this.type = type;
            this.heartbeat = heartbeat;
            this.min = min;
            this.max = max;
            this.lastValue = lastValue;
        }

        public String getName() { return name; }
        public String getType() { return type; }
        public long getHeartbeat() { return heartbeat; }
        @Nullable public Double getMin() { return min; }
        @Nullable public Double getMax() { return max; }
        @Nullable public String getLastValue() { return lastValue; }
    }

    public static class Archive {
        private final String consolidationFunction;
        private final long rows;
        private final long pdpPerRow;
        private final double xff;

        public Archive(String consolidationFunction, long rows, long pdpPerRow, double xff) {
            this.consolidationFunction = consolidationFunction;
            this.rows = rows;
            this.pdpPerRow = pdpPerRow;
            this.xff = xff;
        }

        public String getConsolidationFunction() { return consolidationFunction; }
        public long getRows() { return rows; }
        public long getPdpPerRow() { return pdpPerRow; }
        public double getXff() { return xff; }
    }
}
