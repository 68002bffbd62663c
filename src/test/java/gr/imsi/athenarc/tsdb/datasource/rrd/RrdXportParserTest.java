package gr.imsi.athenarc.tsdb.datasource.rrd;

import gr.imsi.athenarc.tsdb.exception.QueryException;
import gr.imsi.athenarc.tsdb.result.Series;
import gr.imsi.athenarc.tsdb.result.TimeSeriesResult;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class RrdXportParserTest {

    private final RrdXportParser parser = new RrdXportParser();

    @Test
    void stampsRowsFromStartAndStep() {
        String json = "{\"meta\": {\"start\": 1685314800, \"step\": 300, \"end\": 1685315400,"
            + " \"legend\": [\"value{host=a}\", \"value{host=b}\"]},"
            + " \"data\": [[1.0, 2.0], [null, \"NaN\"]]}";

        TimeSeriesResult result = parser.parse(json, Collections.singletonList("value"));

        assertEquals(2, result.getSeries().size());
        Series a = result.getSeries().get(0);
        assertEquals("value", a.getMetric());
        assertEquals("a", a.getLabels().get("host"));
        assertEquals(Arrays.asList(1.0, null), a.getValues());
        assertEquals(1685315100L, a.getPoints().get(1).getTimestamp());
        assertEquals(Arrays.asList(2.0, null), result.getSeries().get(1).getValues());
        assertEquals(300L, result.getMetadata().get("step"));
        assertEquals(1685315400L, result.getMetadata().get("end"));
    }

    @Test
    void acceptsOlderRrdtoolSyntax() {
        String json = "{meta: {start: 10, step: 5, legend: ['value']}, data: [[NaN], [3]]}";

        Series series = parser.parse(json, Collections.emptyList()).getSeries().get(0);
        assertEquals(Arrays.asList(null, 3.0), series.getValues());
        assertEquals(15L, series.getPoints().get(1).getTimestamp());
    }

    @Test
    void keepsOnlyRequestedColumns() {
        String json = "{\"meta\": {\"start\": 0, \"step\": 1, \"legend\": [\"in\", \"out\"]}, \"data\": [[1, 2]]}";

        TimeSeriesResult only = parser.parse(json, Collections.singletonList("out"));
        assertEquals(1, only.getSeries().size());
        assertEquals("out", only.getSeries().get(0).getMetric());
        assertEquals(Arrays.asList(2.0), only.getSeries().get(0).getValues());

        assertEquals(2, parser.parse(json, Collections.singletonList("value")).getSeries().size());
    }

    @Test
    void legendLabels() {
        assertEquals("value", RrdXportParser.metricOf("value{host=a,dc=eu}"));
        assertEquals("eu", RrdXportParser.labelsOf("value{host=a,dc=eu}").get("dc"));
        assertTrue(RrdXportParser.labelsOf("value").isEmpty());
    }

    @Test
    void malformedOutputFails() {
        assertThrows(QueryException.class, () -> parser.parse("not json", Collections.emptyList()));
        assertThrows(QueryException.class, () -> parser.parse("[1, 2]", Collections.emptyList()));
    }
}
