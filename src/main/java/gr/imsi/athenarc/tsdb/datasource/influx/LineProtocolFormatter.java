package gr.imsi.athenarc.tsdb.datasource.influx;

import gr.imsi.athenarc.tsdb.domain.DataPoint;
import gr.imsi.athenarc.tsdb.exception.WriteException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders points as InfluxDB line protocol with second precision:
 * {@code measurement,tag=v field=1.000000,count=3i 1698408000}.
 * <p>
 * Spaces, commas and equals signs in names and tag values are prefixed with a
 * backslash. Escaping is not idempotent: escaping an escaped string escapes
 * it again.
 */
public class LineProtocolFormatter {

    public String format(DataPoint dataPoint) {
        StringBuilder line = new StringBuilder(escape(dataPoint.getMeasurement()));
        for (Map.Entry<String, String> tag : dataPoint.getTags().entrySet()) {
            if (tag.getValue() == null || tag.getValue().isEmpty()) {
                continue;
            }
            line.append(',').append(escape(tag.getKey())).append('=').append(escape(tag.getValue()));
        }
        List<String> fields = new ArrayList<>();
        for (Map.Entry<String, Object> field : dataPoint.getFields().entrySet()) {
            if (field.getValue() == null) {
                continue;
            }
            fields.add(escape(field.getKey()) + "=" + formatValue(field.getValue()));
        }
        if (fields.isEmpty()) {
            throw new WriteException("Data point for " + dataPoint.getMeasurement() + " has no fields");
        }
        line.append(' ').append(String.join(",", fields));
        line.append(' ').append(dataPoint.getTimestamp().getEpochSecond());
        return line.toString();
    }

    public List<String> format(List<DataPoint> dataPoints) {
        List<String> lines = new ArrayList<>(dataPoints.size());
        for (DataPoint dataPoint : dataPoints) {
            lines.add(format(dataPoint));
        }
        return lines;
    }

    public static String escape(String s) {
        return s.replace(" ", "\\ ").replace(",", "\\,").replace("=", "\\=");
    }

    static String formatValue(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short
            || value instanceof Byte || value instanceof BigInteger) {
            return value + "i";
        }
        if (value instanceof Number) {
            return String.format(Locale.ROOT, "%f", ((Number) value).doubleValue());
        }
        if (value instanceof Boolean) {
            return value.toString();
        }
        return "\"" + value.toString().replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
