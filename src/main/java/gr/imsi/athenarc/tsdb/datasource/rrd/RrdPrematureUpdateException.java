package gr.imsi.athenarc.tsdb.datasource.rrd;

/**
 * An update carried a timestamp at or before the file's last update.
 */
public class RrdPrematureUpdateException extends RrdException {

    public RrdPrematureUpdateException(String message, Throwable cause) {
        super(message, cause);
    }
}
