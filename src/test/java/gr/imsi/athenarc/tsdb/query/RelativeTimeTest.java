package gr.imsi.athenarc.tsdb.query;

import gr.imsi.athenarc.tsdb.exception.QueryException;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RelativeTimeTest {

    @Test
    void parsesEveryUnit() {
        assertEquals(30L, RelativeTime.parse("30s").toSeconds());
        assertEquals(300L, RelativeTime.parse("5m").toSeconds());
        assertEquals(3600L, RelativeTime.parse("1h").toSeconds());
        assertEquals(7 * 86400L, RelativeTime.parse("7d").toSeconds());
        assertEquals(14 * 86400L, RelativeTime.parse("2w").toSeconds());
        assertEquals(365 * 86400L, RelativeTime.parse("1y").toSeconds());
    }

    @Test
    void weeksAreStoredAsDays() {
        RelativeTime time = RelativeTime.parse("2w");
        assertEquals(14, time.getDays());
        assertEquals("14d", time.toString());
    }

    @Test
    void formatsWithBackendUnits() {
        assertEquals("5min", RelativeTime.parse("5m").format("y", "d", "h", "min", "s"));
        assertEquals("0s", RelativeTime.parse("0h").format("y", "d", "h", "m", "s"));
    }

    @Test
    void rejectsOtherText() {
        assertThrows(QueryException.class, () -> RelativeTime.parse("1 hour"));
        assertThrows(QueryException.class, () -> RelativeTime.parse("h"));
        assertThrows(QueryException.class, () -> RelativeTime.parse(null));
    }
}
