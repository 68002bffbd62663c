package gr.imsi.athenarc.tsdb.datasource.nulldriver;

import gr.imsi.athenarc.tsdb.datasource.QueryCompiler;
import gr.imsi.athenarc.tsdb.query.Query;

/**
 * Renders the query's own description as the native form.
 */
public class NullCompiler implements QueryCompiler<NullQuery> {

    @Override
    public NullQuery compile(Query query) {
        return new NullQuery(query.toString());
    }
}
