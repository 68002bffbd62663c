package gr.imsi.athenarc.tsdb.datasource.rrd;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import gr.imsi.athenarc.tsdb.exception.QueryException;
import gr.imsi.athenarc.tsdb.query.Query;
import gr.imsi.athenarc.tsdb.result.Series;
import gr.imsi.athenarc.tsdb.result.TimeSeriesResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads {@code rrdtool xport --json} output:
 * <pre>
 * {"meta": {"start": 1685314800, "step": 300, "end": ..., "legend": ["value"]},
 *  "data": [[1.0], [null], ...]}
 * </pre>
 * Row {@code i} is stamped {@code start + i * step}. Older rrdtool releases
 * emit unquoted keys and bare NaN, which the reader accepts.
 */
public class RrdXportParser {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
        .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
        .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
        .build();

    /**
     * @param requestedFields legend entries to keep; when none of them appear
     *                        in the legend every column is kept
     */
    public TimeSeriesResult parse(String json, List<String> requestedFields) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new QueryException("Failed to parse RRD JSON output: " + e.getOriginalMessage(), null, e);
        }
        if (root == null || !root.isObject()) {
            throw new QueryException("Failed to parse RRD JSON output");
        }
        JsonNode meta = root.path("meta");
        long start = meta.path("start").asLong();
        long step = meta.path("step").asLong();
        List<String> legend = new ArrayList<>();
        for (JsonNode entry : meta.path("legend")) {
            legend.add(entry.asText());
        }

        List<Integer> columns = selectColumns(legend, requestedFields);
        List<Series.Builder> builders = new ArrayList<>();
        for (int column : columns) {
            String entry = legend.get(column);
            builders.add(Series.builder(metricOf(entry)).labels(labelsOf(entry)));
        }
        int rowIndex = 0;
        for (JsonNode row : root.path("data")) {
            long timestamp = start + rowIndex * step;
            for (int i = 0; i < columns.size(); i++) {
                builders.get(i).point(timestamp, value(row.get(columns.get(i))));
            }
            rowIndex++;
        }

        List<Series> series = new ArrayList<>();
        for (Series.Builder builder : builders) {
            series.add(builder.build());
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("start", start);
        metadata.put("end", meta.path("end").asLong());
        metadata.put("step", step);
        return new TimeSeriesResult(series, metadata);
    }

    private static List<Integer> selectColumns(List<String> legend, List<String> requestedFields) {
        List<Integer> all = new ArrayList<>();
        List<Integer> requested = new ArrayList<>();
        boolean filter = !requestedFields.isEmpty() && !requestedFields.contains(Query.WILDCARD);
        for (int i = 0; i < legend.size(); i++) {
            all.add(i);
            if (filter && requestedFields.contains(metricOf(legend.get(i)))) {
                requested.add(i);
            }
        }
        return requested.isEmpty() ? all : requested;
    }

    /**
     * "value{host=server1}" names the metric "value".
     */
    static String metricOf(String legend) {
        int brace = legend.indexOf('{');
        return brace < 0 ? legend : legend.substring(0, brace);
    }

    static Map<String, String> labelsOf(String legend) {
        Map<String, String> labels = new LinkedHashMap<>();
        int open = legend.indexOf('{');
        int close = legend.lastIndexOf('}');
        if (open < 0 || close < open) {
            return labels;
        }
        for (String pair : legend.substring(open + 1, close).split(",")) {
            int eq = pair.indexOf('=');
            if (eq > 0) {
                labels.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
            }
        }
        return labels;
    }

    private static Double value(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else {
            try {
                value = Double.parseDouble(node.asText());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return Double.isNaN(value) ? null : value;
    }
}
