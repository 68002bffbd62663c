package gr.imsi.athenarc.tsdb.datasource.rrd;

import com.google.common.collect.ImmutableMap;

import gr.imsi.athenarc.tsdb.datasource.QueryExecutor;
import gr.imsi.athenarc.tsdb.datasource.rrd.tag.TagCondition;
import gr.imsi.athenarc.tsdb.datasource.rrd.tag.TagStrategy;
import gr.imsi.athenarc.tsdb.exception.SchemaException;
import gr.imsi.athenarc.tsdb.exception.TimeseriesException;
import gr.imsi.athenarc.tsdb.query.QueryType;
import gr.imsi.athenarc.tsdb.result.LabelResult;
import gr.imsi.athenarc.tsdb.result.QueryResult;
import gr.imsi.athenarc.tsdb.result.TimeSeriesResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;

/**
 * Runs xport commands. A file that does not exist yet means no data, not an error.
 * Label listings are answered from the directory layout.
 */
public class RrdQueryExecutor implements QueryExecutor<RrdCommand> {

    private static final Logger LOG = LoggerFactory.getLogger(RrdQueryExecutor.class);

    private final RrdCommandRunner runner;
    private final TagStrategy tagStrategy;
    private final RrdXportParser parser;

    public RrdQueryExecutor(RrdCommandRunner runner, TagStrategy tagStrategy, RrdXportParser parser) {
        this.runner = runner;
        this.tagStrategy = tagStrategy;
        this.parser = parser;
    }

    public RrdQueryExecutor(RrdCommandRunner runner, TagStrategy tagStrategy) {
        this(runner, tagStrategy, new RrdXportParser());
    }

    @Override
    public QueryResult execute(RrdCommand command) {
        if (command.getType() == QueryType.LABEL) {
            return listLabels(command);
        }
        LOG.info("Executing Query: \n" + command);
        String output;
        try {
            output = runner.run(command);
        } catch (RrdNotFoundException e) {
            LOG.warn("RRD file not found, returning no data: {}", e.getMessage());
            return TimeSeriesResult.empty();
        } catch (RrdException e) {
            LOG.error("RRD command failed: {}", e.getMessage());
            throw new TimeseriesException("RRD execution failed: " + e.getMessage(), e);
        }
        return parser.parse(output, command.getRequestedFields());
    }

    /**
     * Measurements for a bare listing, values of the named tag otherwise.
     */
    private LabelResult listLabels(RrdCommand command) {
        LOG.debug("Listing labels under {}: {}", tagStrategy.getBaseDir(), command);
        try {
            if (command.getArguments().isEmpty()) {
                return new LabelResult(tagStrategy.listMeasurements(Collections.<TagCondition>emptyList()));
            }
            String tag = command.getArguments().get(0);
            return new LabelResult(tagStrategy.listTagValues(tag), ImmutableMap.<String, Object>of("tag", tag));
        } catch (RrdException e) {
            throw new SchemaException("Failed to list labels: " + e.getMessage(), e);
        }
    }
}
