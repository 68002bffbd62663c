package gr.imsi.athenarc.tsdb.exception;

import org.jetbrains.annotations.Nullable;

/**
 * Raised while lowering a query into backend-native text, e.g. when a literal
 * has a type the backend cannot express.
 */
public class RawQueryException extends QueryException {

    public RawQueryException(String message, @Nullable String query) {
        super(message, query);
    }

    public RawQueryException(String message, @Nullable String query, Throwable cause) {
        super(message, query, cause);
    }
}
