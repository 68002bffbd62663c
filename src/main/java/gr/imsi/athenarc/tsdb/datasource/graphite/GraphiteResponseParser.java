package gr.imsi.athenarc.tsdb.datasource.graphite;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import gr.imsi.athenarc.tsdb.result.Series;
import gr.imsi.athenarc.tsdb.result.TimeSeriesResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads render API JSON: {@code [{"target": "...", "datapoints": [[value, ts], ...]}]}.
 * Graphite answers misconfigured requests with HTML, so a body that is empty
 * or not a JSON array yields an empty result and a warning.
 */
public class GraphiteResponseParser {

    private static final Logger LOG = LoggerFactory.getLogger(GraphiteResponseParser.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public TimeSeriesResult parse(String body) {
        if (body == null || body.trim().isEmpty()) {
            LOG.warn("Empty response from Graphite");
            return TimeSeriesResult.empty();
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            LOG.warn("Graphite response is not JSON: {}", abbreviate(body));
            return TimeSeriesResult.empty();
        }
        if (root == null || !root.isArray()) {
            LOG.warn("Graphite response is not a JSON array: {}", abbreviate(body));
            return TimeSeriesResult.empty();
        }
        List<Series> series = new ArrayList<>();
        for (JsonNode entry : root) {
            Series.Builder builder = Series.builder(entry.path("target").asText(""));
            for (JsonNode point : entry.path("datapoints")) {
                JsonNode value = point.get(0);
                JsonNode timestamp = point.get(1);
                if (timestamp == null || timestamp.isNull()) {
                    continue;
                }
                builder.point(timestamp.asLong(), value == null || value.isNull() ? null : value.asDouble());
            }
            series.add(builder.build());
        }
        return new TimeSeriesResult(series);
    }

    private static String abbreviate(String body) {
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
