package gr.imsi.athenarc.tsdb.datasource;

import gr.imsi.athenarc.tsdb.query.CompiledQuery;
import gr.imsi.athenarc.tsdb.query.Query;

/**
 * Lowers a {@link Query} into the native query of one backend.
 *
 * @param <C> the backend's compiled form
 */
public interface QueryCompiler<C extends CompiledQuery> {

    /**
     * @throws gr.imsi.athenarc.tsdb.exception.RawQueryException if a literal cannot be expressed natively
     * @throws gr.imsi.athenarc.tsdb.exception.QueryException if the query is invalid for this backend
     */
    C compile(Query query);
}
