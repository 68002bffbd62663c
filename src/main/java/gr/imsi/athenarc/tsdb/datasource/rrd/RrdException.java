package gr.imsi.athenarc.tsdb.datasource.rrd;

import gr.imsi.athenarc.tsdb.exception.TimeseriesException;

/**
 * An {@code ERROR:} reported by rrdtool, or a broken conversation with the process.
 */
public class RrdException extends TimeseriesException {

    public RrdException(String message) {
        super(message);
    }

    public RrdException(String message, Throwable cause) {
        super(message, cause);
    }
}
