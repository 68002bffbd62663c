package gr.imsi.athenarc.tsdb.datasource.influx;

import com.google.common.base.Stopwatch;
import com.influxdb.exceptions.InfluxException;

import gr.imsi.athenarc.tsdb.datasource.QueryExecutor;
import gr.imsi.athenarc.tsdb.exception.ConnectionException;
import gr.imsi.athenarc.tsdb.exception.QueryException;
import gr.imsi.athenarc.tsdb.result.QueryResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

public class InfluxDBQueryExecutor implements QueryExecutor<FluxQuery> {

    private static final Logger LOG = LoggerFactory.getLogger(InfluxDBQueryExecutor.class);

    private final InfluxDBConnection connection;
    private final InfluxCsvParser parser;

    public InfluxDBQueryExecutor(InfluxDBConnection connection, InfluxCsvParser parser) {
        this.connection = connection;
        this.parser = parser;
    }

    public InfluxDBQueryExecutor(InfluxDBConnection connection) {
        this(connection, new InfluxCsvParser());
    }

    @Override
    public QueryResult execute(FluxQuery query) {
        String flux = query.getRawQuery();
        LOG.info("Executing Query: \n" + flux);
        Stopwatch stopwatch = Stopwatch.createStarted();
        String csv;
        try {
            csv = connection.queryRaw(flux);
        } catch (InfluxException e) {
            LOG.error("InfluxDB query failed with status {}: {}", e.status(), e.getMessage());
            if (isConnectionFailure(e)) {
                throw new ConnectionException("Failed to reach InfluxDB2: " + e.getMessage(), e);
            }
            throw new QueryException("InfluxDB2 query failed: " + e.getMessage(), flux, e);
        }
        QueryResult result = parser.parse(csv, query.getType());
        LOG.debug("InfluxDB query answered in {} ms", stopwatch.elapsed(TimeUnit.MILLISECONDS));
        return result;
    }

    private static boolean isConnectionFailure(Throwable e) {
        for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof IOException) {
                return true;
            }
        }
        return false;
    }
}
