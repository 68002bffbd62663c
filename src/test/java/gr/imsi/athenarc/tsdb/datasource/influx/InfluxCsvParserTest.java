package gr.imsi.athenarc.tsdb.datasource.influx;

import gr.imsi.athenarc.tsdb.query.QueryType;
import gr.imsi.athenarc.tsdb.result.LabelResult;
import gr.imsi.athenarc.tsdb.result.QueryResult;
import gr.imsi.athenarc.tsdb.result.Series;
import gr.imsi.athenarc.tsdb.result.TimeSeriesResult;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class InfluxCsvParserTest {

    private final InfluxCsvParser parser = new InfluxCsvParser();

    private static String fixture(String name) throws IOException {
        try (InputStream input = InfluxCsvParserTest.class.getResourceAsStream("/fixtures/" + name)) {
            assertNotNull(input, name);
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void groupsRowsPerTable() throws IOException {
        TimeSeriesResult result = parser.parseTimeSeries(fixture("influx-cpu.csv"));

        assertEquals(2, result.getSeries().size());
        Series first = result.getSeries().get(0);
        assertEquals("cpu", first.getMetric());
        assertEquals("server1", first.getLabels().get("host"));
        assertFalse(first.getLabels().containsKey("_field"));
        assertEquals(2, first.size());
        assertEquals(1685315100L, first.getPoints().get(0).getTimestamp());
        assertEquals(Arrays.asList(12.5, 13.5), first.getValues());

        Series second = result.getSeries().get(1);
        assertEquals("server2", second.getLabels().get("host"));
        assertEquals(Arrays.asList(7.0), second.getValues());
    }

    @Test
    void namedResultNamesTheSeries() {
        String csv = ",result,table,_start,_stop,_time,_value,_field,_measurement\n"
            + ",p95,0,2023-05-28T23:00:00Z,2023-05-29T00:00:00Z,2023-05-28T23:05:00Z,1.5,latency,http\n";

        Series series = parser.parseTimeSeries(csv).getSeries().get(0);
        assertEquals("p95", series.getMetric());
        assertEquals("p95", series.getAlias());
    }

    @Test
    void aggregatedRowsFallBackToStop() {
        String csv = ",result,table,_start,_stop,_value,_measurement\n"
            + ",_result,0,2023-05-28T23:00:00Z,2023-05-29T00:00:00Z,,cpu\n";

        Series series = parser.parseTimeSeries(csv).getSeries().get(0);
        assertEquals(1685318400L, series.getPoints().get(0).getTimestamp());
        assertNull(series.getPoints().get(0).getValue());
    }

    @Test
    void emptyBodyIsEmptyResult() {
        assertTrue(parser.parseTimeSeries("").isEmpty());
        assertTrue(parser.parseLabels("\r\n").isEmpty());
    }

    @Test
    void labelQueriesReturnDistinctValues() {
        String csv = "#datatype,string,long,string\n"
            + ",result,table,_value\n"
            + ",_result,0,cpu\n"
            + ",_result,0,mem\n"
            + ",_result,1,cpu\n";

        QueryResult result = parser.parse(csv, QueryType.LABEL);
        assertTrue(result instanceof LabelResult);
        assertEquals(Arrays.asList("cpu", "mem"), ((LabelResult) result).getValues());
    }
}
