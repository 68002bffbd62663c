package gr.imsi.athenarc.tsdb.exception;

/**
 * The backend could not be reached.
 */
public class ConnectionException extends TimeseriesException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
