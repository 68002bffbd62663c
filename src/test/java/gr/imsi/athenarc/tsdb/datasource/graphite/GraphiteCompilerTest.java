package gr.imsi.athenarc.tsdb.datasource.graphite;

import gr.imsi.athenarc.tsdb.exception.QueryException;
import gr.imsi.athenarc.tsdb.query.Query;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class GraphiteCompilerTest {

    private final GraphiteCompiler compiler = new GraphiteCompiler();

    @Test
    void singleFieldPath() {
        GraphiteQuery query = compiler.compile(new Query("servers.web01").select("cpu").latest("1h"));
        assertEquals("servers.web01.cpu", query.getTarget());
        assertEquals("-1h", query.getFrom());
        assertEquals("now", query.getUntil());
    }

    @Test
    void prefixAndSeveralFields() {
        GraphiteQuery query = new GraphiteCompiler("stats").compile(new Query("cpu").select("user", "system"));
        assertEquals("group(\"stats.cpu.user\", \"stats.cpu.system\")", query.getTarget());
    }

    @Test
    void aggregationIsSummarizedOverInterval() {
        Query query = new Query("cpu").latest("1h").groupByTime("5m").avg("value", null);
        assertEquals("summarize(averageSeries(cpu.*), \"5minute\", \"avg\")", compiler.compile(query).getTarget());
    }

    @Test
    void singleAggregationWithAlias() {
        Query query = new Query("cpu").max("value", "peak");
        assertEquals("alias(maxSeries(cpu.*), \"peak\")", compiler.compile(query).getTarget());
    }

    @Test
    void severalAggregationsAreGrouped() {
        Query query = new Query("cpu").groupByTime("1h")
            .aggregate("mean", "value", "avg")
            .percentile("value", 95, "p95");

        assertEquals("group(alias(summarize(averageSeries(cpu.*), \"1hour\", \"avg\"), \"avg\"),"
                + "alias(summarize(percentileOfSeries(cpu.*, 95), \"1hour\", \"percentile_95\"), \"p95\"))",
            compiler.compile(query).getTarget());
    }

    @Test
    void intervalWithoutAggregationSummarizesAverage() {
        assertEquals("summarize(cpu.*, \"30second\", \"avg\")",
            compiler.compile(new Query("cpu").groupByTime("30s")).getTarget());
    }

    @Test
    void equalitySubstitutesWildcard() {
        Query query = new Query("servers").where("host", "=", "web01");
        assertEquals("servers.web01", compiler.compile(query).getTarget());
    }

    @Test
    void inequalityAndRegexWrapTarget() {
        Query query = new Query("servers")
            .where("host", "!=", "web02")
            .whereRegex("host", "^web");
        assertEquals("grep(exclude(servers.*, \"web02\"), \"^web\")", compiler.compile(query).getTarget());
    }

    @Test
    void unsupportedOperatorsAreIgnored() {
        Query query = new Query("servers")
            .whereIn("host", Arrays.asList("a", "b"))
            .where("load", ">", 3)
            .whereBetween("load", 1, 2);
        assertEquals("servers.*", compiler.compile(query).getTarget());
    }

    @Test
    void limitThenSort() {
        Query query = new Query("cpu").limit(5).orderBy("value", "DESC");
        assertEquals("sortByMaxima(limit(cpu.*, 5))", compiler.compile(query).getTarget());
    }

    @Test
    void absoluteWindowUsesEpochSeconds() {
        Query query = new Query("cpu").timeRange(Instant.ofEpochSecond(1685314800L), Instant.ofEpochSecond(1685318400L));
        GraphiteQuery compiled = compiler.compile(query);
        assertEquals("1685314800", compiled.getFrom());
        assertEquals("1685318400", compiled.getUntil());
    }

    @Test
    void relativeWindowUsesGraphiteUnits() {
        assertEquals("-15min", compiler.compile(new Query("cpu").latest("15m")).getFrom());
        assertEquals("-7d", compiler.compile(new Query("cpu").latest("1w")).getFrom());
    }

    @Test
    void rawQueryKeepsWildcardsReadable() {
        GraphiteQuery query = compiler.compile(new Query("cpu").latest("1h"));
        assertEquals("target=cpu.*&from=-1h&until=now&format=json", query.getRawQuery());
    }

    @Test
    void rawQueryEncodesFunctionSyntax() {
        GraphiteQuery query = new GraphiteQuery("sumSeries(a.b)", "-1h", "now");
        assertEquals("target=sumSeries%28a.b%29&from=-1h&until=now&format=json", query.getRawQuery());
    }

    @Test
    void intervalsOutsideGrammarPassThrough() {
        assertEquals("1minute", GraphiteCompiler.toGraphiteInterval("1m"));
        assertEquals("90sec", GraphiteCompiler.toGraphiteInterval("90sec"));
    }

    @Test
    void measurementIsRequired() {
        assertThrows(QueryException.class, () -> compiler.compile(new Query(null)));
    }
}
