package gr.imsi.athenarc.tsdb.datasource.aggregate;

import gr.imsi.athenarc.tsdb.datasource.TimeSeriesWriter;
import gr.imsi.athenarc.tsdb.domain.DataPoint;
import gr.imsi.athenarc.tsdb.exception.WriteException;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AggregateWriterTest {

    private static final DataPoint POINT = new DataPoint("cpu", Collections.singletonMap("value", 1), Instant.EPOCH);

    @Test
    void everyWriterGetsThePoint() {
        List<String> seen = new ArrayList<>();
        AggregateWriter writer = new AggregateWriter(Arrays.<TimeSeriesWriter>asList(
            p -> seen.add("first:" + p.getMeasurement()),
            p -> seen.add("second:" + p.getMeasurement())));

        assertTrue(writer.write(POINT));
        assertEquals(Arrays.asList("first:cpu", "second:cpu"), seen);
    }

    @Test
    void failingWriterDoesNotStopTheOthers() {
        List<String> seen = new ArrayList<>();
        AggregateWriter writer = new AggregateWriter(Arrays.<TimeSeriesWriter>asList(
            p -> {
                throw new WriteException("carbon unreachable");
            },
            p -> seen.add(p.getMeasurement())));

        assertFalse(writer.write(POINT));
        assertEquals(Arrays.asList("cpu"), seen);
    }

    @Test
    void sameFailureEverywhereIsThrown() {
        AggregateWriter writer = new AggregateWriter(Arrays.<TimeSeriesWriter>asList(
            p -> {
                throw new WriteException("disk full");
            },
            p -> {
                throw new WriteException("disk full");
            }));

        WriteException e = assertThrows(WriteException.class, () -> writer.write(POINT));
        assertEquals("disk full", e.getMessage());
    }

    @Test
    void rejectedWritesWithDifferentIndexesAreReported() {
        AggregateWriter writer = new AggregateWriter(Arrays.<TimeSeriesWriter>asList(p -> false, p -> false));
        assertFalse(writer.write(POINT));
    }

    @Test
    void batchesFanOutAsWholeBatches() {
        List<Integer> sizes = new ArrayList<>();
        TimeSeriesWriter recording = new TimeSeriesWriter() {
            @Override
            public boolean write(DataPoint dataPoint) {
                throw new AssertionError("batch expected");
            }

            @Override
            public boolean writeBatch(List<DataPoint> dataPoints) {
                sizes.add(dataPoints.size());
                return true;
            }
        };
        AggregateWriter writer = new AggregateWriter(Arrays.asList(recording, recording));

        assertTrue(writer.writeBatch(Arrays.asList(POINT, POINT, POINT)));
        assertEquals(Arrays.asList(3, 3), sizes);
    }

    @Test
    void needsAtLeastOneWriter() {
        assertThrows(IllegalArgumentException.class,
            () -> new AggregateWriter(Collections.<TimeSeriesWriter>emptyList()));
    }
}
