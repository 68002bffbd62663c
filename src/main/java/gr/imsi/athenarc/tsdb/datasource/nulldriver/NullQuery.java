package gr.imsi.athenarc.tsdb.datasource.nulldriver;

import gr.imsi.athenarc.tsdb.query.CompiledQuery;
import gr.imsi.athenarc.tsdb.query.QueryType;

public class NullQuery implements CompiledQuery {

    private final String rawQuery;
    private final QueryType type;

    public NullQuery(String rawQuery, QueryType type) {
        this.rawQuery = rawQuery;
        this.type = type;
    }

    public NullQuery(String rawQuery) {
        this(rawQuery, QueryType.DATA);
    }

    @Override
    public String getRawQuery() {
        return rawQuery;
    }

    @Override
    public QueryType getType() {
        return type;
    }

    @Override
    public String toString() {
        return rawQuery;
    }
}
