package gr.imsi.athenarc.tsdb.datasource.graphite;

import gr.imsi.athenarc.tsdb.datasource.QueryCompiler;
import gr.imsi.athenarc.tsdb.domain.AggregateInterval;
import gr.imsi.athenarc.tsdb.exception.QueryException;
import gr.imsi.athenarc.tsdb.query.Aggregation;
import gr.imsi.athenarc.tsdb.query.Condition;
import gr.imsi.athenarc.tsdb.query.Query;
import gr.imsi.athenarc.tsdb.query.SortDirection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Lowers a {@link Query} into a Graphite target expression.
 * <p>
 * Graphite filters by metric path, not by predicate, so only three kinds of
 * condition survive: equality narrows the wildcard path by substitution,
 * inequality becomes {@code exclude()} and a regex becomes {@code grep()}.
 * Every other operator is dropped from the target and logged at DEBUG.
 */
public class GraphiteCompiler implements QueryCompiler<GraphiteQuery> {

    private static final Logger LOG = LoggerFactory.getLogger(GraphiteCompiler.class);

    private final String prefix;

    public GraphiteCompiler(String prefix) {
        this.prefix = prefix == null ? "" : prefix;
    }

    public GraphiteCompiler() {
        this("");
    }

    @Override
    public GraphiteQuery compile(Query query) {
        if (query.getMeasurement() == null || query.getMeasurement().isEmpty()) {
            throw new QueryException("Measurement is required", query.toString());
        }
        String target = applyAggregations(basePath(query), query);
        target = applyConditions(target, query.getConditions());
        if (query.getLimit() != null) {
            target = "limit(" + target + ", " + query.getLimit() + ")";
        }
        for (SortDirection direction : query.getOrderBy().values()) {
            target = (direction == SortDirection.DESC ? "sortByMaxima(" : "sortByMinima(") + target + ")";
        }
        return new GraphiteQuery(target, from(query), until(query));
    }

    private String basePath(Query query) {
        String metricPath = prefix.isEmpty() ? query.getMeasurement() : prefix + "." + query.getMeasurement();
        List<String> fields = query.getFields();
        if (fields.isEmpty() || fields.contains(Query.WILDCARD)) {
            return metricPath + ".*";
        }
        if (fields.size() == 1) {
            return metricPath + "." + fields.get(0);
        }
        List<String> paths = new ArrayList<>();
        for (String field : fields) {
            paths.add("\"" + metricPath + "." + field + "\"");
        }
        return "group(" + String.join(", ", paths) + ")";
    }

    private String applyAggregations(String target, Query query) {
        List<Aggregation> aggregations = query.getAggregations();
        String interval = query.getInterval() == null ? null : toGraphiteInterval(query.getInterval());
        if (aggregations.size() > 1) {
            List<String> targets = new ArrayList<>();
            for (Aggregation aggregation : aggregations) {
                String wrapped = seriesFunction(aggregation, target);
                if (interval != null) {
                    wrapped = summarize(wrapped, interval, summarizeFunction(aggregation));
                }
                if (aggregation.getAlias() != null) {
                    wrapped = alias(wrapped, aggregation.getAlias());
                }
                targets.add(wrapped);
            }
            return "group(" + String.join(",", targets) + ")";
        }
        if (aggregations.size() == 1) {
            Aggregation aggregation = aggregations.get(0);
            String wrapped = seriesFunction(aggregation, target);
            if (aggregation.getAlias() != null) {
                wrapped = alias(wrapped, aggregation.getAlias());
            }
            return interval == null ? wrapped : summarize(wrapped, interval, "avg");
        }
        return interval == null ? target : summarize(target, interval, "avg");
    }

    private static String seriesFunction(Aggregation aggregation, String target) {
        if (aggregation.isPercentile()) {
            return "percentileOfSeries(" + target + ", " + aggregation.getPercentile() + ")";
        }
        switch (aggregation.getNormalizedFunction()) {
            case "mean":
            case "avg":
                return "averageSeries(" + target + ")";
            case "sum":
                return "sumSeries(" + target + ")";
            case "count":
                return "countSeries(" + target + ")";
            case "min":
                return "minSeries(" + target + ")";
            case "max":
                return "maxSeries(" + target + ")";
            case "stddev":
                return "stdev(" + target + ")";
            default:
                return target;
        }
    }

    private static String summarizeFunction(Aggregation aggregation) {
        String function = aggregation.getNormalizedFunction();
        return "mean".equals(function) ? "avg" : function;
    }

    private static String summarize(String target, String interval, String function) {
        return "summarize(" + target + ", \"" + interval + "\", \"" + function + "\")";
    }

    private static String alias(String target, String alias) {
        return "alias(" + target + ", \"" + alias + "\")";
    }

    private static String applyConditions(String target, List<Condition> conditions) {
        for (Condition condition : conditions) {
            Object value = condition.getScalarValue();
            switch (condition.getOperator()) {
                case EQUALS:
                case SAME:
                    target = target.replace("*", String.valueOf(value));
                    break;
                case NOT_EQUALS:
                case NOT_EQUALS_ALT:
                    target = "exclude(" + target + ", \"" + value + "\")";
                    break;
                case REGEX:
                    target = "grep(" + target + ", \"" + value + "\")";
                    break;
                default:
                    LOG.debug("Graphite cannot filter on {}, ignoring condition {}", condition.getOperator(), condition);
                    break;
            }
        }
        return target;
    }

    private static String from(Query query) {
        Instant start = query.getStartTime();
        if (start != null) {
            return String.valueOf(start.getEpochSecond());
        }
        if (query.getRelativeTime() != null) {
            return "-" + query.getRelativeTime().format("y", "d", "h", "min", "s");
        }
        return "-1h";
    }

    private static String until(Query query) {
        Instant end = query.getEndTime();
        return end == null ? "now" : String.valueOf(end.getEpochSecond());
    }

    /**
     * "5m" becomes "5minute"; text outside the compact grammar passes through.
     */
    static String toGraphiteInterval(String interval) {
        AggregateInterval parsed = AggregateInterval.parse(interval);
        return parsed == null ? interval : parsed.toGraphiteInterval();
    }
}
