package gr.imsi.athenarc.tsdb.datasource.prometheus;

import gr.imsi.athenarc.tsdb.datasource.TimeSeriesWriter;
import gr.imsi.athenarc.tsdb.domain.DataPoint;
import gr.imsi.athenarc.tsdb.exception.WriteException;

import java.util.List;

/**
 * Prometheus scrapes its targets; the query API takes no writes.
 */
public class PrometheusWriter implements TimeSeriesWriter {

    static final String MESSAGE = "Prometheus does not accept writes through its query API";

    @Override
    public boolean write(DataPoint dataPoint) {
        throw new WriteException(MESSAGE);
    }

    @Override
    public boolean writeBatch(List<DataPoint> dataPoints) {
        throw new WriteException(MESSAGE);
    }
}
