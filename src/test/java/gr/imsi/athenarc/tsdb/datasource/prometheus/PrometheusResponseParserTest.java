package gr.imsi.athenarc.tsdb.datasource.prometheus;

import gr.imsi.athenarc.tsdb.exception.QueryException;
import gr.imsi.athenarc.tsdb.result.Series;
import gr.imsi.athenarc.tsdb.result.TimeSeriesResult;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class PrometheusResponseParserTest {

    private final PrometheusResponseParser parser = new PrometheusResponseParser();

    @Test
    void parsesMatrix() {
        String body = "{\"status\":\"success\",\"data\":{\"resultType\":\"matrix\",\"result\":["
            + "{\"metric\":{\"__name__\":\"up\",\"job\":\"api\"},\"values\":[[1685314800,\"1\"],[1685314860.5,\"NaN\"]]}]}}";

        TimeSeriesResult result = parser.parse(body, "fallback");
        Series series = result.getSeries().get(0);
        assertEquals("up", series.getMetric());
        assertEquals(Collections.singletonMap("job", "api"), series.getLabels());
        assertEquals(Arrays.asList(1.0, null), series.getValues());
        assertEquals(1685314860L, series.getPoints().get(1).getTimestamp());
        assertEquals("matrix", result.getMetadata().get("resultType"));
    }

    @Test
    void vectorFallsBackToMeasurementName() {
        String body = "{\"status\":\"success\",\"data\":{\"resultType\":\"vector\",\"result\":["
            + "{\"metric\":{\"host\":\"a\"},\"value\":[1685314800,\"0.25\"]}]}}";

        Series series = parser.parse(body, "cpu").getSeries().get(0);
        assertEquals("cpu", series.getMetric());
        assertEquals(Collections.singletonList(0.25), series.getValues());
    }

    @Test
    void parsesScalar() {
        String body = "{\"status\":\"success\",\"data\":{\"resultType\":\"scalar\",\"result\":[1685314800,\"42\"]}}";
        assertEquals(Collections.singletonList(42.0), parser.parse(body, "one").getSeries().get(0).getValues());
    }

    @Test
    void unknownResultTypeIsEmpty() {
        String body = "{\"status\":\"success\",\"data\":{\"resultType\":\"string\",\"result\":[0,\"x\"]}}";
        TimeSeriesResult result = parser.parse(body, "s");
        assertTrue(result.isEmpty());
        assertEquals("string", result.getMetadata().get("resultType"));
    }

    @Test
    void errorEnvelopeFails() {
        String body = "{\"status\":\"error\",\"errorType\":\"bad_data\",\"error\":\"parse error at char 4\"}";
        QueryException e = assertThrows(QueryException.class, () -> parser.parse(body, "cpu"));
        assertEquals("Prometheus query failed: bad_data parse error at char 4", e.getMessage());
    }

    @Test
    void malformedBodyFails() {
        assertThrows(QueryException.class, () -> parser.parse("<html>", "cpu"));
    }
}
