package gr.imsi.athenarc.tsdb.datasource;

import gr.imsi.athenarc.tsdb.domain.DataPoint;
import gr.imsi.athenarc.tsdb.query.CompiledQuery;
import gr.imsi.athenarc.tsdb.query.Query;
import gr.imsi.athenarc.tsdb.result.QueryResult;

import java.util.List;

/**
 * A configured backend: compiles, runs and writes.
 */
public interface DataSource {

    /**
     * @return the registry name of the backend, e.g. "influxdb2"
     */
    String getDriverName();

    /**
     * Lower a query without running it.
     */
    CompiledQuery compile(Query query);

    /**
     * Run a query compiled by this data source (or built by hand in its native form).
     */
    QueryResult execute(CompiledQuery compiledQuery);

    /**
     * Compile and run.
     */
    QueryResult query(Query query);

    boolean write(DataPoint dataPoint);

    boolean writeBatch(List<DataPoint> dataPoints);

    void closeConnection();
}
