package gr.imsi.athenarc.tsdb.exception;

/**
 * The backend rejected or failed a write.
 */
public class WriteException extends TimeseriesException {

    public WriteException(String message) {
        super(message);
    }

    public WriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
