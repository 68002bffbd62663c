package gr.imsi.athenarc.tsdb.datasource;

import gr.imsi.athenarc.tsdb.domain.DataPoint;
import gr.imsi.athenarc.tsdb.exception.WriteException;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchWritesTest {

    private static DataPoint point(String measurement) {
        return new DataPoint(measurement, Collections.singletonMap("value", 1), Instant.EPOCH);
    }

    private static final List<DataPoint> POINTS = Arrays.asList(point("cpu"), point("mem"), point("disk"));

    @Test
    void emptyBatchSucceeds() {
        assertTrue(BatchWrites.writeAll(p -> {
            throw new AssertionError("nothing to write");
        }, Collections.emptyList()));
    }

    @Test
    void allWritten() {
        assertTrue(BatchWrites.writeAll(p -> true, POINTS));
    }

    @Test
    void partialFailureIsReported() {
        TimeSeriesWriter writer = p -> {
            if ("mem".equals(p.getMeasurement())) {
                throw new WriteException("mem rejected");
            }
            return true;
        };
        assertFalse(BatchWrites.writeAll(writer, POINTS));
    }

    @Test
    void systemicFailureIsThrownOnce() {
        WriteException e = assertThrows(WriteException.class, () -> BatchWrites.writeAll(p -> {
            throw new WriteException("connection refused");
        }, POINTS));
        assertEquals("connection refused", e.getMessage());
    }

    @Test
    void differingFailuresAreNotSystemic() {
        assertFalse(BatchWrites.writeAll(p -> {
            throw new WriteException(p.getMeasurement() + " rejected");
        }, POINTS));
    }

    @Test
    void defaultWriteBatchWritesEachPoint() {
        int[] count = {0};
        TimeSeriesWriter writer = p -> {
            count[0]++;
            return true;
        };
        assertTrue(writer.writeBatch(POINTS));
        assertEquals(3, count[0]);
    }
}
