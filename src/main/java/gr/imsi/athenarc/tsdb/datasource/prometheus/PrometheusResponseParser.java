package gr.imsi.athenarc.tsdb.datasource.prometheus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import gr.imsi.athenarc.tsdb.exception.QueryException;
import gr.imsi.athenarc.tsdb.result.Series;
import gr.imsi.athenarc.tsdb.result.TimeSeriesResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads the HTTP API envelope {@code {"status": ..., "data": {"resultType": ..., "result": ...}}}
 * for matrix, vector and scalar results. Sample values arrive as strings.
 */
public class PrometheusResponseParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String NAME_LABEL = "__name__";

    public TimeSeriesResult parse(String body, String measurement) {
        JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new QueryException("Failed to parse Prometheus response: " + e.getOriginalMessage(), null, e);
        }
        if (root == null || !root.isObject()) {
            throw new QueryException("Failed to parse Prometheus response: not a JSON object");
        }
        if (!"success".equals(root.path("status").asText())) {
            throw new QueryException("Prometheus query failed: " + root.path("errorType").asText("")
                + " " + root.path("error").asText(""));
        }
        JsonNode data = root.path("data");
        String resultType = data.path("resultType").asText();
        JsonNode result = data.path("result");
        List<Series> series = new ArrayList<>();
        switch (resultType) {
            case "matrix":
                for (JsonNode entry : result) {
                    Series.Builder builder = builder(entry.path("metric"), measurement);
                    for (JsonNode sample : entry.path("values")) {
                        addSample(builder, sample);
                    }
                    series.add(builder.build());
                }
                break;
            case "vector":
                for (JsonNode entry : result) {
                    Series.Builder builder = builder(entry.path("metric"), measurement);
                    addSample(builder, entry.path("value"));
                    series.add(builder.build());
                }
                break;
            case "scalar":
                Series.Builder builder = Series.builder(measurement);
                addSample(builder, result);
                series.add(builder.build());
                break;
            default:
                return TimeSeriesResult.empty(Collections.singletonMap("resultType", resultType));
        }
        return new TimeSeriesResult(series, Collections.singletonMap("resultType", resultType));
    }

    private static Series.Builder builder(JsonNode metric, String measurement) {
        Series.Builder builder = Series.builder(metric.path(NAME_LABEL).asText(measurement));
        Iterator<Map.Entry<String, JsonNode>> labels = metric.fields();
        while (labels.hasNext()) {
            Map.Entry<String, JsonNode> label = labels.next();
            if (!NAME_LABEL.equals(label.getKey())) {
                builder.label(label.getKey(), label.getValue().asText());
            }
        }
        return builder;
    }

    private static void addSample(Series.Builder builder, JsonNode sample) {
        if (!sample.isArray() || sample.size() < 2) {
            return;
        }
        long timestamp = (long) sample.get(0).asDouble();
        Double value;
        try {
            double parsed = Double.parseDouble(sample.get(1).asText());
            value = Double.isNaN(parsed) ? null : parsed;
        } catch (NumberFormatException e) {
            value = null;
        }
        builder.point(timestamp, value);
    }
}
