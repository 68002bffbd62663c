package gr.imsi.athenarc.tsdb.datasource.influx;

import com.google.common.base.Preconditions;

import gr.imsi.athenarc.tsdb.query.CompiledQuery;
import gr.imsi.athenarc.tsdb.query.QueryType;

/**
 * Flux source text ready to be posted to {@code /api/v2/query}.
 */
public class FluxQuery implements CompiledQuery {

    private final String flux;
    private final QueryType type;

    public FluxQuery(String flux, QueryType type) {
        this.flux = Preconditions.checkNotNull(flux, "flux");
        this.type = Preconditions.checkNotNull(type, "type");
    }

    public FluxQuery(String flux) {
        this(flux, QueryType.DATA);
    }

    @Override
    public String getRawQuery() {
        return flux;
    }

    @Override
    public QueryType getType() {
        return type;
    }

    @Override
    public String toString() {
        return flux;
    }
}
