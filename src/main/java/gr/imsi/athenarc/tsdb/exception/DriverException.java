package gr.imsi.athenarc.tsdb.exception;

/**
 * Misuse of the driver registry: unknown or duplicate driver names.
 */
public class DriverException extends TimeseriesException {

    public DriverException(String message) {
        super(message);
    }

    public DriverException(String message, Throwable cause) {
        super(message, cause);
    }
}
