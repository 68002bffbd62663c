package gr.imsi.athenarc.tsdb.datasource.graphite;

import com.google.common.collect.Lists;

import gr.imsi.athenarc.tsdb.datasource.TimeSeriesWriter;
import gr.imsi.athenarc.tsdb.domain.DataPoint;
import gr.imsi.athenarc.tsdb.exception.ConnectionException;
import gr.imsi.athenarc.tsdb.exception.WriteException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes points as carbon plaintext, one line per field:
 * {@code prefix.measurement.tagKey.tagValue.field value timestamp}.
 * Tags become path segments in insertion order.
 */
public class GraphiteWriter implements TimeSeriesWriter {

    private static final Logger LOG = LoggerFactory.getLogger(GraphiteWriter.class);

    private final CarbonConnection connection;
    private final String prefix;
    private final int batchSize;

    public GraphiteWriter(CarbonConnection connection, String prefix, int batchSize) {
        this.connection = connection;
        this.prefix = prefix == null ? "" : prefix;
        this.batchSize = batchSize;
    }

    /**
     * @return false when a field was skipped for not being numeric
     */
    @Override
    public boolean write(DataPoint dataPoint) {
        List<String> lines = new ArrayList<>();
        boolean complete = toLines(dataPoint, lines);
        send(lines, "Failed to write data to Graphite: ");
        return complete;
    }

    @Override
    public boolean writeBatch(List<DataPoint> dataPoints) {
        List<String> lines = new ArrayList<>();
        boolean complete = true;
        for (DataPoint dataPoint : dataPoints) {
            complete &= toLines(dataPoint, lines);
        }
        for (List<String> chunk : Lists.partition(lines, batchSize)) {
            send(chunk, "Failed to write batch data to Graphite: ");
        }
        return complete;
    }

    boolean toLines(DataPoint dataPoint, List<String> lines) {
        StringBuilder path = new StringBuilder();
        if (!prefix.isEmpty()) {
            path.append(prefix).append('.');
        }
        path.append(dataPoint.getMeasurement());
        for (Map.Entry<String, String> tag : dataPoint.getTags().entrySet()) {
            path.append('.').append(tag.getKey()).append('.').append(tag.getValue());
        }
        long timestamp = dataPoint.getTimestamp().getEpochSecond();
        boolean complete = true;
        for (Map.Entry<String, Object> field : dataPoint.getFields().entrySet()) {
            String value = numeric(field.getValue());
            if (value == null) {
                LOG.debug("Skipping non-numeric field {} of {}", field.getKey(), dataPoint.getMeasurement());
                complete = false;
                continue;
            }
            lines.add(path + "." + field.getKey() + " " + value + " " + timestamp + "\n");
        }
        return complete;
    }

    static String numeric(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).stripTrailingZeros().toPlainString();
        }
        if (value instanceof Number) {
            return value.toString();
        }
        if (value instanceof CharSequence) {
            try {
                return new BigDecimal(value.toString().trim()).stripTrailingZeros().toPlainString();
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private void send(List<String> lines, String failureMessage) {
        if (lines.isEmpty()) {
            return;
        }
        try {
            connection.send(lines);
        } catch (IOException | ConnectionException e) {
            LOG.error("Graphite write failed: {}", e.getMessage());
            connection.closeConnection();
            throw new WriteException(failureMessage + e.getMessage(), e);
        }
    }
}
