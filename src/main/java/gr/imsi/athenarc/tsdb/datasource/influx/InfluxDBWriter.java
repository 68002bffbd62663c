package gr.imsi.athenarc.tsdb.datasource.influx;

import com.influxdb.exceptions.InfluxException;

import gr.imsi.athenarc.tsdb.datasource.TimeSeriesWriter;
import gr.imsi.athenarc.tsdb.domain.DataPoint;
import gr.imsi.athenarc.tsdb.exception.WriteException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;

/**
 * Writes points to {@code /api/v2/write} as line protocol.
 */
public class InfluxDBWriter implements TimeSeriesWriter {

    private static final Logger LOG = LoggerFactory.getLogger(InfluxDBWriter.class);

    private final InfluxDBConnection connection;
    private final LineProtocolFormatter formatter;

    public InfluxDBWriter(InfluxDBConnection connection, LineProtocolFormatter formatter) {
        this.connection = connection;
        this.formatter = formatter;
    }

    @Override
    public boolean write(DataPoint dataPoint) {
        send(Collections.singletonList(formatter.format(dataPoint)));
        return true;
    }

    /**
     * Sends the whole batch in one request; a rejected request fails every point alike.
     */
    @Override
    public boolean writeBatch(List<DataPoint> dataPoints) {
        if (dataPoints.isEmpty()) {
            return true;
        }
        send(formatter.format(dataPoints));
        return true;
    }

    private void send(List<String> lines) {
        LOG.debug("Writing {} line(s) to InfluxDB", lines.size());
        try {
            connection.writeRecords(lines);
        } catch (InfluxException e) {
            LOG.error("InfluxDB write failed: {}", e.getMessage());
            throw new WriteException(String.format("Failed to write to InfluxDB2. Status code: %d. Response: %s",
                e.status(), e.getMessage()), e);
        }
    }
}
