package gr.imsi.athenarc.tsdb.datasource.aggregate;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.tsdb.datasource.TimeSeriesWriter;
import gr.imsi.athenarc.tsdb.domain.DataPoint;
import gr.imsi.athenarc.tsdb.exception.TimeseriesException;
import gr.imsi.athenarc.tsdb.exception.WriteException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes every point to all of its writers. A writer failing does not stop the
 * others. When all of them fail with the same message that message is thrown
 * as a {@link WriteException}; any other failure is logged and reported as
 * {@code false}.
 */
public class AggregateWriter implements TimeSeriesWriter {

    private static final Logger LOG = LoggerFactory.getLogger(AggregateWriter.class);

    private final List<TimeSeriesWriter> writers;

    public AggregateWriter(List<? extends TimeSeriesWriter> writers) {
        Preconditions.checkArgument(!writers.isEmpty(), "No write databases configured");
        this.writers = ImmutableList.copyOf(writers);
    }

    public List<TimeSeriesWriter> getWriters() {
        return writers;
    }

    @Override
    public boolean write(DataPoint dataPoint) {
        Map<Integer, String> errors = new LinkedHashMap<>();
        for (int i = 0; i < writers.size(); i++) {
            try {
                if (!writers.get(i).write(dataPoint)) {
                    errors.put(i, "Write failed for database at index " + i);
                }
            } catch (TimeseriesException e) {
                errors.put(i, e.getMessage());
            }
        }
        return report(errors, "write");
    }

    @Override
    public boolean writeBatch(List<DataPoint> dataPoints) {
        Map<Integer, String> errors = new LinkedHashMap<>();
        for (int i = 0; i < writers.size(); i++) {
            try {
                if (!writers.get(i).writeBatch(dataPoints)) {
                    errors.put(i, "Batch write failed for database at index " + i);
                }
            } catch (TimeseriesException e) {
                errors.put(i, e.getMessage());
            }
        }
        return report(errors, "batch write");
    }

    private boolean report(Map<Integer, String> errors, String operation) {
        if (errors.isEmpty()) {
            return true;
        }
        Set<String> distinct = new LinkedHashSet<>(errors.values());
        if (errors.size() == writers.size() && distinct.size() == 1) {
            throw new WriteException(distinct.iterator().next());
        }
        LOG.warn("Aggregate {} failed on {} of {} databases: {}", operation, errors.size(), writers.size(), errors);
        return false;
    }
}
