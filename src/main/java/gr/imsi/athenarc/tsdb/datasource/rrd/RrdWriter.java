package gr.imsi.athenarc.tsdb.datasource.rrd;

import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.tsdb.datasource.TimeSeriesWriter;
import gr.imsi.athenarc.tsdb.datasource.rrd.tag.TagStrategy;
import gr.imsi.athenarc.tsdb.domain.DataPoint;
import gr.imsi.athenarc.tsdb.exception.WriteException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes a point with {@code rrdtool update}, creating the file on first use.
 * <p>
 * New files get one GAUGE data source per field of the first point and
 * AVERAGE, MAX and MIN archives covering a week, two months and a year.
 */
public class RrdWriter implements TimeSeriesWriter {

    private static final Logger LOG = LoggerFactory.getLogger(RrdWriter.class);

    static final List<String> DEFAULT_ARCHIVES = ImmutableList.of(
        "RRA:AVERAGE:0.5:1:2016",
        "RRA:AVERAGE:0.5:12:1488",
        "RRA:AVERAGE:0.5:288:366",
        "RRA:MAX:0.5:1:2016",
        "RRA:MAX:0.5:12:1488",
        "RRA:MIN:0.5:1:2016",
        "RRA:MIN:0.5:12:1488");

    private static final String UNKNOWN = "U";
    private static final int MAX_DS_NAME = 19;

    private final RrdCommandRunner runner;
    private final TagStrategy tagStrategy;
    private final RrdInfoParser infoParser;
    private final int step;

    public RrdWriter(RrdCommandRunner runner, TagStrategy tagStrategy, RrdInfoParser infoParser, int step) {
        this.runner = runner;
        this.tagStrategy = tagStrategy;
        this.infoParser = infoParser;
        this.step = step;
    }

    @Override
    public boolean write(DataPoint dataPoint) {
        Path path = tagStrategy.getFilePath(dataPoint.getMeasurement(), dataPoint.getTags());
        RrdInfo info = info(path, dataPoint);
        List<String> values = new ArrayList<>();
        values.add(String.valueOf(dataPoint.getTimestamp().getEpochSecond()));
        Map<String, Object> fields = dataPoint.getFields();
        for (String dsName : info.getDataSourceNames()) {
            values.add(formatValue(findField(fields, dsName)));
        }
        RrdCommand update = new RrdCommand("update", ImmutableList.of(path.toString()),
            ImmutableList.of(String.join(":", values)));
        try {
            runner.run(update);
        } catch (RrdException e) {
            if (e.getMessage() != null && e.getMessage().contains("illegal attempt to update using time")) {
                throw new RrdPrematureUpdateException(e.getMessage(), e);
            }
            LOG.error("RRD update of {} failed: {}", path, e.getMessage());
            throw new WriteException("Failed to update RRD: " + e.getMessage(), e);
        }
        return true;
    }

    private RrdInfo info(Path path, DataPoint dataPoint) {
        RrdCommand info = new RrdCommand("info", ImmutableList.of(path.toString()), ImmutableList.of());
        try {
            return infoParser.parse(runner.run(info));
        } catch (RrdNotFoundException e) {
            create(path, dataPoint);
        } catch (RrdException e) {
            throw new WriteException("Failed to read RRD info: " + e.getMessage(), e);
        }
        try {
            return infoParser.parse(runner.run(info));
        } catch (RrdException e) {
            throw new WriteException("Failed to read RRD info: " + e.getMessage(), e);
        }
    }

    void create(Path path, DataPoint dataPoint) {
        Path parent = path.getParent();
        if (parent != null && Files.isDirectory(tagStrategy.getBaseDir())) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new WriteException("Cannot create RRD directory " + parent + ": " + e.getMessage(), e);
            }
        }
        List<String> arguments = new ArrayList<>();
        for (String field : dataPoint.getFields().keySet()) {
            arguments.add("DS:" + dsName(field) + ":GAUGE:" + (2 * step) + ":U:U");
        }
        arguments.addAll(DEFAULT_ARCHIVES);
        RrdCommand create = new RrdCommand("create",
            ImmutableList.of(path.toString(), "--step", String.valueOf(step)), arguments);
        LOG.info("Creating RRD file {}", path);
        try {
            runner.run(create);
        } catch (RrdException e) {
            throw new WriteException("Failed to create RRD: " + e.getMessage(), e);
        }
    }

    /**
     * rrdtool accepts 1 to 19 characters from [a-zA-Z0-9_].
     */
    static String dsName(String field) {
        String name = field.replaceAll("[^a-zA-Z0-9_]", "_");
        return name.length() > MAX_DS_NAME ? name.substring(0, MAX_DS_NAME) : name;
    }

    private static Object findField(Map<String, Object> fields, String dsName) {
        if (fields.containsKey(dsName)) {
            return fields.get(dsName);
        }
        for (Map.Entry<String, Object> field : fields.entrySet()) {
            if (dsName(field.getKey()).equals(dsName)) {
                return field.getValue();
            }
        }
        return null;
    }

    static String formatValue(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isNaN(d) || Double.isInfinite(d) ? UNKNOWN : BigDecimal.valueOf(d).toPlainString();
        }
        if (value instanceof Number) {
            return value.toString();
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? "1" : "0";
        }
        return UNKNOWN;
    }
}
