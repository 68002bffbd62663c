package gr.imsi.athenarc.tsdb.datasource.nulldriver;

import gr.imsi.athenarc.tsdb.datasource.QueryExecutor;
import gr.imsi.athenarc.tsdb.query.QueryType;
import gr.imsi.athenarc.tsdb.result.LabelResult;
import gr.imsi.athenarc.tsdb.result.QueryResult;
import gr.imsi.athenarc.tsdb.result.TimeSeriesResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class NullQueryExecutor implements QueryExecutor<NullQuery> {

    private static final Logger LOG = LoggerFactory.getLogger(NullQueryExecutor.class);

    @Override
    public QueryResult execute(NullQuery query) {
        LOG.debug("Discarding query {}", query.getRawQuery());
        if (query.getType() == QueryType.LABEL) {
            return LabelResult.empty();
        }
        return TimeSeriesResult.empty();
    }
}
