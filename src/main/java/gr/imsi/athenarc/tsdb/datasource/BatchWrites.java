package gr.imsi.athenarc.tsdb.datasource;

import gr.imsi.athenarc.tsdb.domain.DataPoint;
import gr.imsi.athenarc.tsdb.exception.TimeseriesException;
import gr.imsi.athenarc.tsdb.exception.WriteException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-item batch writing. When every item fails with the same message the
 * failure is systemic and is thrown once; partial failures are logged and
 * reported through the return value.
 */
public final class BatchWrites {

    private static final Logger LOG = LoggerFactory.getLogger(BatchWrites.class);

    private BatchWrites() {
    }

    public static boolean writeAll(TimeSeriesWriter writer, List<DataPoint> dataPoints) {
        if (dataPoints.isEmpty()) {
            return true;
        }
        List<String> errors = new ArrayList<>();
        int failed = 0;
        for (DataPoint dataPoint : dataPoints) {
            try {
                if (!writer.write(dataPoint)) {
                    failed++;
                    errors.add("Write of " + dataPoint.getMeasurement() + " was not accepted");
                }
            } catch (TimeseriesException e) {
                failed++;
                errors.add(e.getMessage());
            }
        }
        if (failed == 0) {
            return true;
        }
        Set<String> distinct = new LinkedHashSet<>(errors);
        if (failed == dataPoints.size() && distinct.size() == 1) {
            throw new WriteException(distinct.iterator().next());
        }
        LOG.warn("{} of {} points failed to write: {}", failed, dataPoints.size(), distinct);
        return false;
    }
}
