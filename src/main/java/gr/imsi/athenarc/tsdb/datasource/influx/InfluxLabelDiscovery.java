package gr.imsi.athenarc.tsdb.datasource.influx;

import gr.imsi.athenarc.tsdb.exception.SchemaException;
import gr.imsi.athenarc.tsdb.exception.TimeseriesException;
import gr.imsi.athenarc.tsdb.result.LabelResult;
import gr.imsi.athenarc.tsdb.result.QueryResult;

import java.util.List;

/**
 * Lists measurements, tag keys and tag values through the Flux schema package.
 */
public class InfluxLabelDiscovery {

    private final FluxCompiler compiler;
    private final InfluxDBQueryExecutor executor;

    public InfluxLabelDiscovery(FluxCompiler compiler, InfluxDBQueryExecutor executor) {
        this.compiler = compiler;
        this.executor = executor;
    }

    public List<String> listMeasurements() {
        return run(compiler.measurements());
    }

    public List<String> listTagKeys() {
        return run(compiler.tagKeys());
    }

    public List<String> listTagValues(String tag) {
        return run(compiler.tagValues(tag));
    }

    private List<String> run(FluxQuery query) {
        QueryResult result;
        try {
            result = executor.execute(query);
        } catch (TimeseriesException e) {
            throw new SchemaException("Failed to list labels: " + e.getMessage(), e);
        }
        return ((LabelResult) result).getValues();
    }
}
