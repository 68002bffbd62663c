package gr.imsi.athenarc.tsdb.exception;

import org.jetbrains.annotations.Nullable;

/**
 * Compilation or execution failure of a query. Carries the offending query
 * text (or a description of the logical query) for diagnostics.
 */
public class QueryException extends TimeseriesException {

    @Nullable
    private final String query;

    public QueryException(String message) {
        this(message, (String) null);
    }

    public QueryException(String message, @Nullable String query) {
        super(message);
        this.query = query;
    }

    public QueryException(String message, @Nullable String query, Throwable cause) {
        super(message, cause);
        this.query = query;
    }

    @Nullable
    public String getQuery() {
        return query;
    }
}
