package gr.imsi.athenarc.tsdb.exception;

/**
 * Failure while listing measurements, tags or data sources.
 */
public class SchemaException extends TimeseriesException {

    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
