package gr.imsi.athenarc.tsdb.datasource;

import gr.imsi.athenarc.tsdb.query.CompiledQuery;
import gr.imsi.athenarc.tsdb.result.QueryResult;

/**
 * Sends a compiled query to its backend and parses the answer.
 *
 * @param <C> the compiled form this executor accepts
 */
public interface QueryExecutor<C extends CompiledQuery> {

    /**
     * @throws gr.imsi.athenarc.tsdb.exception.TimeseriesException wrapping the backend failure
     */
    QueryResult execute(C compiledQuery);
}
