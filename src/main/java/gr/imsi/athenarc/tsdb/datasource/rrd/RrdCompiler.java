package gr.imsi.athenarc.tsdb.datasource.rrd;

import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.tsdb.datasource.QueryCompiler;
import gr.imsi.athenarc.tsdb.datasource.rrd.tag.TagCondition;
import gr.imsi.athenarc.tsdb.datasource.rrd.tag.TagStrategy;
import gr.imsi.athenarc.tsdb.domain.AggregateInterval;
import gr.imsi.athenarc.tsdb.exception.QueryException;
import gr.imsi.athenarc.tsdb.query.Aggregation;
import gr.imsi.athenarc.tsdb.query.ComparisonOperator;
import gr.imsi.athenarc.tsdb.query.Condition;
import gr.imsi.athenarc.tsdb.query.Query;
import gr.imsi.athenarc.tsdb.query.QueryType;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lowers a {@link Query} into an {@code rrdtool xport --json} command with one
 * {@code DEF}/{@code XPORT} pair per file and field.
 * <p>
 * Data source names are not known until a file exists, so the command names
 * the requested fields (or {@code value} when none are named) and leaves the
 * mismatch to the xport parser.
 */
public class RrdCompiler implements QueryCompiler<RrdCommand> {

    static final String DEFAULT_FIELD = "value";
    static final String DEFAULT_CF = "AVERAGE";
    static final String LIST_COMMAND = "list";

    private final TagStrategy tagStrategy;

    public RrdCompiler(TagStrategy tagStrategy) {
        this.tagStrategy = tagStrategy;
    }

    @Override
    public RrdCommand compile(Query query) {
        List<String> errors = query.validate();
        if (!errors.isEmpty()) {
            throw new QueryException("Query validation failed: " + String.join(", ", errors), query.toString());
        }
        List<String> options = new ArrayList<>();
        options.add("--json");
        addTimeOptions(query, options);

        List<String> fields = fields(query);
        String cf = consolidationFunction(query.getAggregations());
        List<Path> paths = resolvePaths(query);

        List<String> defs = new ArrayList<>();
        List<String> xports = new ArrayList<>();
        int counter = 1;
        for (Path path : paths) {
            String labels = paths.size() > 1 ? labelSuffix(tagStrategy.parseTags(path)) : "";
            for (String field : fields) {
                String var = "v" + counter++;
                defs.add("DEF:" + var + "=" + RrdCommand.escape(path.toString()) + ":"
                    + RrdCommand.escape(field) + ":" + cf);
                xports.add("XPORT:" + var + ":" + RrdCommand.escape(field + labels));
            }
        }
        List<String> arguments = new ArrayList<>(defs);
        arguments.addAll(xports);
        return new RrdCommand("xport", options, arguments, QueryType.DATA, fields);
    }

    /**
     * Lists the measurements that have at least one RRD file. The executor
     * answers it by scanning the directory, without calling rrdtool.
     */
    public RrdCommand labels() {
        return new RrdCommand(LIST_COMMAND, ImmutableList.of(), ImmutableList.of(), QueryType.LABEL, ImmutableList.of());
    }

    /**
     * Lists the distinct values of one tag across all RRD files.
     */
    public RrdCommand labels(String tag) {
        return new RrdCommand(LIST_COMMAND, ImmutableList.of(), ImmutableList.of(tag), QueryType.LABEL,
            ImmutableList.of());
    }

    private static void addTimeOptions(Query query, List<String> options) {
        Instant start = query.getStartTime();
        options.add("--start");
        if (query.getRelativeTime() != null) {
            options.add("end-" + query.getRelativeTime().toSeconds() + "s");
        } else if (start != null) {
            options.add(String.valueOf(start.getEpochSecond()));
        } else {
            options.add("end-1h");
        }
        Instant end = query.getEndTime();
        if (end != null) {
            options.add("--end");
            options.add(String.valueOf(end.getEpochSecond()));
        }
        if (query.getInterval() != null) {
            AggregateInterval interval = AggregateInterval.parse(query.getInterval());
            if (interval == null) {
                throw new QueryException("Invalid interval: " + query.getInterval(), query.toString());
            }
            options.add("--step");
            options.add(String.valueOf(interval.toSeconds()));
        }
    }

    private static List<String> fields(Query query) {
        List<String> fields = new ArrayList<>();
        for (String field : query.getFields()) {
            if (!Query.WILDCARD.equals(field)) {
                fields.add(field);
            }
        }
        if (fields.isEmpty()) {
            fields.add(DEFAULT_FIELD);
        }
        return fields;
    }

    static String consolidationFunction(List<Aggregation> aggregations) {
        if (aggregations.isEmpty()) {
            return DEFAULT_CF;
        }
        switch (aggregations.get(0).getNormalizedFunction()) {
            case "max":
                return "MAX";
            case "min":
                return "MIN";
            case "last":
                return "LAST";
            default:
                return DEFAULT_CF;
        }
    }

    /**
     * Tag conditions select files. BETWEEN and comparison operators are left
     * out since they usually range over values rather than tags.
     */
    private List<Path> resolvePaths(Query query) {
        List<TagCondition> conditions = new ArrayList<>();
        Map<String, String> equalities = new LinkedHashMap<>();
        for (Condition condition : query.getConditions()) {
            ComparisonOperator operator = condition.getOperator();
            if (Query.TIME_FIELD.equals(condition.getField()) || operator == ComparisonOperator.BETWEEN
                || !TagCondition.supports(operator)) {
                continue;
            }
            conditions.add(TagCondition.of(condition));
            if (operator.isEquality() && condition.isAnd()) {
                equalities.put(condition.getField(), String.valueOf(condition.getScalarValue()));
            }
        }
        List<Path> paths = tagStrategy.resolveFilePaths(query.getMeasurement(), conditions);
        if (paths.isEmpty()) {
            // nothing on disk yet; rrdtool reports the missing file and the executor returns no data
            return ImmutableList.of(tagStrategy.getFilePath(query.getMeasurement(), equalities));
        }
        return paths;
    }

    private static String labelSuffix(Map<String, String> tags) {
        if (tags.isEmpty()) {
            return "";
        }
        List<String> pairs = new ArrayList<>();
        for (Map.Entry<String, String> tag : tags.entrySet()) {
            pairs.add(tag.getKey() + "=" + tag.getValue());
        }
        return "{" + String.join(",", pairs) + "}";
    }
}
