package gr.imsi.athenarc.tsdb.query;

/**
 * Backend-native form of a {@link Query}, produced by one compiler and consumed
 * by the matching executor. Instances are created per query and never reused.
 */
public interface CompiledQuery {

    /**
     * @return the query text as it is sent to (or logged for) the backend
     */
    String getRawQuery();

    /**
     * @return whether the backend answers with series or with labels
     */
    default QueryType getType() {
        return QueryType.DATA;
    }
}
