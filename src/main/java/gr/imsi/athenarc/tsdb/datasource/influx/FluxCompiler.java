package gr.imsi.athenarc.tsdb.datasource.influx;

import com.google.common.base.Preconditions;

import gr.imsi.athenarc.tsdb.datasource.QueryCompiler;
import gr.imsi.athenarc.tsdb.domain.DateTimeUtil;
import gr.imsi.athenarc.tsdb.exception.QueryException;
import gr.imsi.athenarc.tsdb.exception.RawQueryException;
import gr.imsi.athenarc.tsdb.query.Aggregation;
import gr.imsi.athenarc.tsdb.query.ComparisonOperator;
import gr.imsi.athenarc.tsdb.query.Condition;
import gr.imsi.athenarc.tsdb.query.Fill;
import gr.imsi.athenarc.tsdb.query.HavingClause;
import gr.imsi.athenarc.tsdb.query.MathExpression;
import gr.imsi.athenarc.tsdb.query.Query;
import gr.imsi.athenarc.tsdb.query.QueryType;
import gr.imsi.athenarc.tsdb.query.SortDirection;
import gr.imsi.athenarc.tsdb.query.TimeSpec;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lowers a {@link Query} into a Flux pipeline:
 * <pre>
 * from(bucket: "b")
 *   |> range(start: ..., stop: ...)
 *   |> timeShift(duration: 0s, timeZone: "...")
 *   |> filter(fn: (r) => r._measurement == "m")
 *   |> ... conditions, fields, distinct, group, window, aggregations,
 *          fill, map, having, sort, tail, limit
 * </pre>
 * Flux cannot apply two reducers to the same column, so every further
 * aggregation over an already reduced column first gets its own copy through
 * {@code duplicate()}.
 */
public class FluxCompiler implements QueryCompiler<FluxQuery> {

    private static final String PIPE = "\n  |> ";
    private static final String DEFAULT_COLUMN = "_value";
    private static final String TIME_COLUMN = "_time";

    private final String bucket;

    public FluxCompiler(String bucket) {
        Preconditions.checkArgument(bucket != null && !bucket.isEmpty(), "bucket is required");
        this.bucket = bucket;
    }

    public String getBucket() {
        return bucket;
    }

    @Override
    public FluxQuery compile(Query query) {
        if (query.getMeasurement() == null || query.getMeasurement().isEmpty()) {
            throw new QueryException("Measurement is required", query.toString());
        }
        try {
            return new FluxQuery(build(query), QueryType.DATA);
        } catch (RawQueryException e) {
            throw new RawQueryException(e.getMessage(), query.toString(), e);
        }
    }

    private String build(Query query) {
        Set<String> imports = new LinkedHashSet<>();
        List<String> stages = new ArrayList<>();

        stages.add(rangeStage(query.getTimeSpec()));
        if (query.getTimezone() != null) {
            stages.add("timeShift(duration: 0s, timeZone: " + FluxLiterals.quote(query.getTimezone()) + ")");
        }
        stages.add("filter(fn: (r) => r._measurement == " + FluxLiterals.quote(query.getMeasurement()) + ")");
        addConditionStages(query.getConditions(), stages);

        if (!query.selectsAllFields()) {
            List<String> fieldPredicates = new ArrayList<>();
            for (String field : query.getFields()) {
                fieldPredicates.add("r._field == " + FluxLiterals.quote(field));
            }
            stages.add("filter(fn: (r) => " + String.join(" or ", fieldPredicates) + ")");
        }
        if (query.isDistinct()) {
            stages.add("distinct()");
        }
        if (!query.getGroupBy().isEmpty()) {
            stages.add("group(columns: " + stringArray(query.getGroupBy()) + ")");
        }
        if (query.getInterval() != null) {
            stages.add("window(every: " + query.getInterval() + ")");
        }
        addAggregationStages(query.getAggregations(), stages);

        Fill fill = query.getFill();
        if (fill != null) {
            switch (fill.getPolicy()) {
                case NULL:
                    stages.add("fill(value: null)");
                    break;
                case PREVIOUS:
                    stages.add("fill(usePrevious: true)");
                    break;
                case LINEAR:
                    imports.add("interpolate");
                    stages.add("interpolate.linear()");
                    break;
                case VALUE:
                    stages.add("fill(value: " + FluxLiterals.format(fill.getValue()) + ")");
                    break;
                default:
                    // NONE: Flux leaves empty windows out already
                    break;
            }
        }

        for (MathExpression math : query.getMathExpressions()) {
            stages.add("map(fn: (r) => ({ r with " + math.getAlias() + ": " + math.getExpression() + " }))");
        }
        for (HavingClause having : query.getHaving()) {
            stages.add("filter(fn: (r) => r[" + FluxLiterals.quote(having.getField()) + "] "
                + having.getOperator().toFluxOperator() + " " + FluxLiterals.format(having.getValue()) + ")");
        }
        for (Map.Entry<String, SortDirection> order : query.getOrderBy().entrySet()) {
            stages.add("sort(columns: [" + FluxLiterals.quote(order.getKey()) + "], desc: "
                + (order.getValue() == SortDirection.DESC) + ")");
        }
        if (query.getOffset() != null) {
            stages.add("tail(offset: " + query.getOffset() + ")");
        }
        if (query.getLimit() != null) {
            stages.add("limit(n: " + query.getLimit() + ")");
        }

        StringBuilder flux = new StringBuilder();
        for (String module : imports) {
            flux.append("import ").append(FluxLiterals.quote(module)).append('\n');
        }
        if (flux.length() > 0) {
            flux.append('\n');
        }
        flux.append("from(bucket: ").append(FluxLiterals.quote(bucket)).append(')');
        for (String stage : stages) {
            flux.append(PIPE).append(stage);
        }
        return flux.toString();
    }

    private String rangeStage(TimeSpec timeSpec) {
        switch (timeSpec.getKind()) {
            case ABSOLUTE:
                Instant start = timeSpec.getStart();
                Instant end = timeSpec.getEnd();
                if (start != null && end != null) {
                    return "range(start: " + DateTimeUtil.formatIso(start) + ", stop: " + DateTimeUtil.formatIso(end) + ")";
                }
                if (start != null) {
                    return "range(start: " + DateTimeUtil.formatIso(start) + ")";
                }
                return "range(start: -1h, stop: " + DateTimeUtil.formatIso(end) + ")";
            case RELATIVE:
                return "range(start: -" + timeSpec.getRelativeTime().format("y", "d", "h", "m", "s") + ")";
            default:
                return "range(start: -1h)";
        }
    }

    /**
     * One filter stage per AND condition; an OR condition joins the stage of
     * the condition before it.
     */
    private void addConditionStages(List<Condition> conditions, List<String> stages) {
        List<String> predicates = new ArrayList<>();
        for (Condition condition : conditions) {
            String predicate = predicate(condition);
            if (condition.isOr() && !predicates.isEmpty()) {
                int last = predicates.size() - 1;
                predicates.set(last, group(predicates.get(last)) + " or " + group(predicate));
            } else {
                predicates.add(predicate);
            }
        }
        for (String predicate : predicates) {
            stages.add("filter(fn: (r) => " + predicate + ")");
        }
    }

    private static String group(String predicate) {
        return predicate.contains(" and ") && !predicate.startsWith("(") ? "(" + predicate + ")" : predicate;
    }

    private String predicate(Condition condition) {
        boolean time = Query.TIME_FIELD.equals(condition.getField());
        String column = time ? "r." + TIME_COLUMN : "r[" + FluxLiterals.quote(condition.getField()) + "]";
        ComparisonOperator operator = condition.getOperator();
        switch (operator) {
            case IN:
                return "contains(value: " + column + ", set: " + literalArray(condition.getValues()) + ")";
            case NOT_IN: {
                // Flux has no negated contains(), so NOT IN becomes a chain of inequalities
                List<String> parts = new ArrayList<>();
                for (Object value : condition.getValues()) {
                    parts.add(column + " != " + FluxLiterals.format(value));
                }
                return String.join(" and ", parts);
            }
            case BETWEEN: {
                List<Object> bounds = condition.getValues();
                if (bounds.size() != 2) {
                    throw new RawQueryException("BETWEEN requires exactly two values, got " + bounds.size(), null);
                }
                return column + " >= " + FluxLiterals.format(bounds.get(0))
                    + " and " + column + " <= " + FluxLiterals.format(bounds.get(1));
            }
            case REGEX:
            case LIKE:
            case NOT_REGEX:
                return column + " " + operator.toFluxOperator() + " /" + condition.getScalarValue() + "/";
            default:
                return column + " " + operator.toFluxOperator() + " " + FluxLiterals.format(condition.getScalarValue());
        }
    }

    private void addAggregationStages(List<Aggregation> aggregations, List<String> stages) {
        if (aggregations.isEmpty()) {
            return;
        }
        Set<String> usedColumns = new HashSet<>();
        List<String> columns = new ArrayList<>();
        for (int i = 0; i < aggregations.size(); i++) {
            Aggregation aggregation = aggregations.get(i);
            String source = aggregation.getField() != null ? aggregation.getField() : DEFAULT_COLUMN;
            String column = source;
            if (!usedColumns.add(source)) {
                column = source + "_copy" + i;
                stages.add("duplicate(column: " + FluxLiterals.quote(source) + ", as: " + FluxLiterals.quote(column) + ")");
            }
            columns.add(column);
        }
        for (int i = 0; i < aggregations.size(); i++) {
            Aggregation aggregation = aggregations.get(i);
            stages.add(reducer(aggregation, FluxLiterals.quote(columns.get(i))));
            if (aggregation.getAlias() != null) {
                stages.add("rename(columns: {_value: " + FluxLiterals.quote(aggregation.getAlias()) + "})");
            }
        }
    }

    private String reducer(Aggregation aggregation, String column) {
        if (aggregation.isPercentile()) {
            return "quantile(q: " + quantile(aggregation.getPercentile()) + ", column: " + column + ")";
        }
        String function = aggregation.getNormalizedFunction();
        switch (function) {
            case "avg":
            case "mean":
                return "mean(column: " + column + ")";
            default:
                return function + "(column: " + column + ")";
        }
    }

    private static String quantile(String percentile) {
        try {
            double p = Double.parseDouble(percentile) / 100.0;
            return FluxLiterals.format(p);
        } catch (NumberFormatException e) {
            throw new RawQueryException("Invalid percentile: " + percentile, null, e);
        }
    }

    private static String stringArray(Iterable<String> values) {
        List<String> quoted = new ArrayList<>();
        for (String value : values) {
            quoted.add(FluxLiterals.quote(value));
        }
        return "[" + String.join(", ", quoted) + "]";
    }

    private static String literalArray(List<Object> values) {
        List<String> literals = new ArrayList<>();
        for (Object value : values) {
            literals.add(FluxLiterals.format(value));
        }
        return "[" + String.join(", ", literals) + "]";
    }

    // ---- schema discovery ----

    /**
     * Lists the measurements of the bucket.
     */
    public FluxQuery measurements() {
        return new FluxQuery("import \"influxdata/influxdb/schema\"\n\nschema.measurements(bucket: "
            + FluxLiterals.quote(bucket) + ")", QueryType.LABEL);
    }

    /**
     * Lists the tag keys of the bucket.
     */
    public FluxQuery tagKeys() {
        return new FluxQuery("import \"influxdata/influxdb/schema\"\n\nschema.tagKeys(bucket: "
            + FluxLiterals.quote(bucket) + ")", QueryType.LABEL);
    }

    /**
     * Lists the values a tag takes in the bucket.
     */
    public FluxQuery tagValues(String tag) {
        return new FluxQuery("import \"influxdata/influxdb/schema\"\n\nschema.tagValues(bucket: "
            + FluxLiterals.quote(bucket) + ", tag: " + FluxLiterals.quote(tag) + ")", QueryType.LABEL);
    }
}
