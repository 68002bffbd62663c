package gr.imsi.athenarc.tsdb.exception;

/**
 * Root of all errors raised by the middleware. Backend-specific failures are
 * wrapped in this type (or one of its subclasses) with the original cause attached.
 */
public class TimeseriesException extends RuntimeException {

    public TimeseriesException(String message) {
        super(message);
    }

    public TimeseriesException(String message, Throwable cause) {
        super(message, cause);
    }
}
