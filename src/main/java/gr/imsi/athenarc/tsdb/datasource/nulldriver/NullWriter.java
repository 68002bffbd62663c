package gr.imsi.athenarc.tsdb.datasource.nulldriver;

import gr.imsi.athenarc.tsdb.datasource.TimeSeriesWriter;
import gr.imsi.athenarc.tsdb.domain.DataPoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Accepts and drops every point.
 */
public class NullWriter implements TimeSeriesWriter {

    private static final Logger LOG = LoggerFactory.getLogger(NullWriter.class);

    @Override
    public boolean write(DataPoint dataPoint) {
        LOG.debug("Discarding point for {}", dataPoint.getMeasurement());
        return true;
    }

    @Override
    public boolean writeBatch(List<DataPoint> dataPoints) {
        LOG.debug("Discarding {} points", dataPoints.size());
        return true;
    }
}
