package gr.imsi.athenarc.tsdb.datasource.rrd;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the {@code key = value} lines of {@code rrdtool info}. String values
 * come quoted, unknown numbers as {@code NaN}.
 */
public class RrdInfoParser {

    private static final Pattern LINE = Pattern.compile("^([^=]+?)\\s*=\\s*(.+)$");
    private static final Pattern DS_KEY = Pattern.compile("^ds\\[([^\\]]+)\\]\\.([a-z_]+)$");
    private static final Pattern RRA_KEY = Pattern.compile("^rra\\[(\\d+)\\]\\.([a-z_]+)$");

    public RrdInfo parse(String output) {
        Map<String, String> values = parseLines(output);
        Map<String, Map<String, String>> dataSources = new LinkedHashMap<>();
        Map<Integer, Map<String, String>> archives = new TreeMap<>();
        for (Map.Entry<String, String> entry : values.entrySet()) {
            Matcher ds = DS_KEY.matcher(entry.getKey());
            if (ds.matches()) {
                dataSources.computeIfAbsent(ds.group(1), k -> new LinkedHashMap<>()).put(ds.group(2), entry.getValue());
                continue;
            }
            Matcher rra = RRA_KEY.matcher(entry.getKey());
            if (rra.matches()) {
                archives.computeIfAbsent(Integer.parseInt(rra.group(1)), k -> new LinkedHashMap<>())
                    .put(rra.group(2), entry.getValue());
            }
        }

        Map<String, RrdInfo.DataSource> sources = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, String>> ds : dataSources.entrySet()) {
            Map<String, String> props = ds.getValue();
            sources.put(ds.getKey(), new RrdInfo.DataSource(ds.getKey(),
                props.getOrDefault("type", ""),
                toLong(props.get("minimal_heartbeat")),
                toDouble(props.get("min")),
                toDouble(props.get("max")),
                props.get("last_ds")));
        }
        List<RrdInfo.Archive> rras = new ArrayList<>();
        for (Map<String, String> props : archives.values()) {
            Double xff = toDouble(props.get("xff"));
            rras.add(new RrdInfo.Archive(props.getOrDefault("cf", ""),
                toLong(props.get("rows")), toLong(props.get("pdp_per_row")), xff == null ? 0.0 : xff));
        }
        return new RrdInfo(values.getOrDefault("filename", ""), values.getOrDefault("rrd_version", ""),
            toLong(values.get("step")), toLong(values.get("last_update")), sources, rras);
    }

    /**
     * Keys in output order, values with surrounding quotes removed.
     */
    static Map<String, String> parseLines(String output) {
        Map<String, String> values = new LinkedHashMap<>();
        if (output == null) {
            return values;
        }
        for (String line : output.split("\\R")) {
            Matcher matcher = LINE.matcher(line.trim());
            if (matcher.matches()) {
                values.put(matcher.group(1).trim(), unquote(matcher.group(2).trim()));
            }
        }
        return values;
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    private static long toLong(@Nullable String value) {
        if (value == null) {
            return 0L;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            Double d = toDouble(value);
            return d == null ? 0L : d.longValue();
        }
    }

    @Nullable
    private static Double toDouble(@Nullable String value) {
        if (value == null || "NaN".equalsIgnoreCase(value)) {
            return null;
        }
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
