package gr.imsi.athenarc.tsdb.exception;

/**
 * Invalid or missing driver configuration.
 */
public class ConfigurationException extends TimeseriesException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
