package gr.imsi.athenarc.tsdb.domain;

import gr.imsi.athenarc.tsdb.exception.QueryException;

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class DomainTest {

    @Test
    void parsesCompactIntervals() {
        AggregateInterval fiveMinutes = AggregateInterval.parse(" 5m ");
        assertEquals(5, fiveMinutes.getMultiplier());
        assertEquals(ChronoUnit.MINUTES, fiveMinutes.getChronoUnit());
        assertEquals(300L, fiveMinutes.toSeconds());
        assertEquals(1209600L, AggregateInterval.parse("2w").toSeconds());
        assertNull(AggregateInterval.parse("5 minutes"));
        assertNull(AggregateInterval.parse(null));
        assertTrue(AggregateInterval.parse("1h").compareTo(AggregateInterval.parse("59m")) > 0);
    }

    @Test
    void graphiteSpelling() {
        assertEquals("5minute", AggregateInterval.parse("5m").toGraphiteInterval());
        assertEquals("1day", AggregateInterval.parse("1d").toGraphiteInterval());
        assertEquals("30second", AggregateInterval.of(30, ChronoUnit.SECONDS).toGraphiteInterval());
    }

    @Test
    void dataPointBuildsUpFieldsAndTags() {
        Instant ts = Instant.ofEpochSecond(1698408000L);
        DataPoint point = new DataPoint("cpu", Collections.singletonMap("user", 1.5), ts)
            .addField("system", 0.5)
            .addTag("host", "a");

        assertEquals(ImmutableMap.of("user", 1.5, "system", 0.5), point.getFields());
        assertEquals(Collections.singletonMap("host", "a"), point.getTags());
        assertThrows(UnsupportedOperationException.class, () -> point.getTags().put("dc", "eu"));
        assertThrows(IllegalArgumentException.class, () -> new DataPoint("", Collections.emptyMap(), ts));
        assertNotNull(new DataPoint("cpu", Collections.emptyMap(), null).getTimestamp());
    }

    @Test
    void metricIdentifierNamesMeasurement() {
        DataPoint point = DataPoint.of(new MetricIdentifier("system", "load"), Collections.emptyMap(), 0.7, Instant.EPOCH);
        assertEquals("system_load", point.getMeasurement());
        assertEquals(0.7, point.getFields().get("value"));
        assertEquals("load", new MetricIdentifier(null, "load").toMeasurement());
    }

    @Test
    void isoTimestamps() {
        assertEquals("2023-05-28T23:00:00+00:00", DateTimeUtil.formatIso(Instant.ofEpochSecond(1685314800L)));
        assertEquals(Instant.ofEpochSecond(1685314800L), DateTimeUtil.parseRfc3339("2023-05-29T02:00:00+03:00"));
        assertEquals(Instant.ofEpochSecond(1685314800L), DateTimeUtil.parseRfc3339("2023-05-28T23:00:00Z"));
        assertThrows(QueryException.class, () -> DateTimeUtil.parseRfc3339("yesterday"));
    }
}
