package gr.imsi.athenarc.tsdb;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

import gr.imsi.athenarc.tsdb.config.DriverConfiguration;
import gr.imsi.athenarc.tsdb.config.PropertiesConfigurationLoader;
import gr.imsi.athenarc.tsdb.datasource.DataSource;
import gr.imsi.athenarc.tsdb.datasource.DataSourceFactory;
import gr.imsi.athenarc.tsdb.exception.ConnectionException;
import gr.imsi.athenarc.tsdb.exception.TimeseriesException;
import gr.imsi.athenarc.tsdb.query.Condition;
import gr.imsi.athenarc.tsdb.query.Query;
import gr.imsi.athenarc.tsdb.result.LabelResult;
import gr.imsi.athenarc.tsdb.result.QueryResult;
import gr.imsi.athenarc.tsdb.result.Series;
import gr.imsi.athenarc.tsdb.result.SeriesPoint;
import gr.imsi.athenarc.tsdb.result.TimeSeriesResult;
import gr.imsi.athenarc.tsdb.util.RetryableOperation;
import gr.imsi.athenarc.tsdb.util.WhereClauseConverter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    @Parameter(names = "-driver", description = "Driver to use (influxdb2/graphite/rrdtool/prometheus/null)")
    private String driver = "null";

    @Parameter(names = "-measurement", description = "Measurement to query", required = true)
    private String measurement;

    @Parameter(names = "-field", description = "Field to select, repeatable")
    private List<String> fields = new ArrayList<>();

    @Parameter(names = "-latest", description = "Relative window, e.g. 1h or 2d")
    private String latest;

    @Parameter(names = "-interval", description = "Time grouping interval, e.g. 5m")
    private String interval;

    @Parameter(names = "-aggregate", description = "Aggregation function, e.g. mean or percentile_95")
    private String aggregate;

    @Parameter(names = "-where", converter = WhereClauseConverter.class, description = "field=value condition, repeatable")
    private List<Condition> conditions = new ArrayList<>();

    @Parameter(names = "-compileOnly", description = "Print the native query without running it")
    private boolean compileOnly = false;

    @Parameter(names = "--help", help = true, description = "Displays help")
    private boolean help;

    public static void main(String... args) {
        Main main = new Main();
        JCommander jCommander = new JCommander(main);
        try {
            jCommander.parse(args);
        } catch (ParameterException e) {
            System.err.println(e.getMessage());
            jCommander.usage();
            System.exit(2);
        }
        if (main.help) {
            jCommander.usage();
            return;
        }
        try {
            main.run();
        } catch (TimeseriesException e) {
            LOG.error("Query failed: {}", e.getMessage());
            System.exit(1);
        }
    }

    Query buildQuery() {
        Query query = new Query(measurement);
        if (!fields.isEmpty()) {
            query.select(fields);
        }
        for (Condition condition : conditions) {
            query.where(condition.getField(), condition.getOperator(), condition.getValue());
        }
        if (latest != null) {
            query.latest(latest);
        }
        if (interval != null) {
            query.groupByTime(interval);
        }
        if (aggregate != null) {
            String field = fields.isEmpty() ? null : fields.get(0);
            query.aggregate(aggregate, field, null);
        }
        return query;
    }

    private void run() {
        DriverConfiguration configuration = PropertiesConfigurationLoader.fromClasspath().load(driver);
        DataSource dataSource = DataSourceFactory.defaultRegistry().create(driver, configuration);
        try {
            Query query = buildQuery();
            if (compileOnly) {
                System.out.println(dataSource.compile(query).getRawQuery());
                return;
            }
            QueryResult result;
            try {
                result = RetryableOperation.execute(() -> dataSource.query(query), ConnectionException.class);
            } catch (TimeseriesException e) {
                throw e;
            } catch (Exception e) {
                throw new TimeseriesException("Query failed: " + e.getMessage(), e);
            }
            print(result);
        } finally {
            dataSource.closeConnection();
        }
    }

    private static void print(QueryResult result) {
        if (result instanceof LabelResult) {
            for (String value : ((LabelResult) result).getValues()) {
                System.out.println(value);
            }
            return;
        }
        for (Series series : ((TimeSeriesResult) result).getSeries()) {
            System.out.println(series.getMetric() + " " + series.getLabels());
            for (SeriesPoint point : series.getPoints()) {
                System.out.println("  " + point.getTimestamp() + " " + point.getValue());
            }
        }
    }
}
