package gr.imsi.athenarc.tsdb.datasource;

import gr.imsi.athenarc.tsdb.domain.DataPoint;

import java.util.List;

public interface TimeSeriesWriter {

    /**
     * Write one point.
     *
     * @return true when the backend accepted the point
     * @throws gr.imsi.athenarc.tsdb.exception.WriteException when the backend rejected it
     */
    boolean write(DataPoint dataPoint);

    /**
     * Write several points, one at a time. See {@link BatchWrites#writeAll}
     * for how individual failures are reported.
     */
    default boolean writeBatch(List<DataPoint> dataPoints) {
        return BatchWrites.writeAll(this, dataPoints);
    }
}
