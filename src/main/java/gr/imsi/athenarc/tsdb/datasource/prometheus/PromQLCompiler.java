package gr.imsi.athenarc.tsdb.datasource.prometheus;

import gr.imsi.athenarc.tsdb.datasource.QueryCompiler;
import gr.imsi.athenarc.tsdb.domain.AggregateInterval;
import gr.imsi.athenarc.tsdb.domain.DateTimeUtil;
import gr.imsi.athenarc.tsdb.exception.QueryException;
import gr.imsi.athenarc.tsdb.query.Aggregation;
import gr.imsi.athenarc.tsdb.query.Condition;
import gr.imsi.athenarc.tsdb.query.Query;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lowers a {@link Query} into PromQL. Conditions become label matchers, the
 * first aggregation wraps the selector and a time interval becomes a
 * {@code rate()} window. Prometheus evaluates one aggregation per expression,
 * so further aggregations and math expressions are not rendered.
 */
public class PromQLCompiler implements QueryCompiler<PrometheusQuery> {

    private static final Pattern CALL = Pattern.compile("^(\\w+)\\((.*)\\)$");

    @Override
    public PrometheusQuery compile(Query query) {
        if (query.getMeasurement() == null || query.getMeasurement().isEmpty()) {
            throw new QueryException("Measurement is required", query.toString());
        }
        String expression = query.getMeasurement() + labelSelector(query.getConditions());

        if (query.hasAggregations()) {
            expression = aggregate(query.getAggregations().get(0), expression);
            if (!query.getGroupBy().isEmpty()) {
                Matcher call = CALL.matcher(expression);
                if (call.matches()) {
                    expression = call.group(1) + " by (" + String.join(",", query.getGroupBy()) + ") (" + call.group(2) + ")";
                }
            }
        }
        Long step = null;
        if (query.getInterval() != null) {
            expression = "rate(" + expression + "[" + query.getInterval() + "])";
            AggregateInterval interval = AggregateInterval.parse(query.getInterval());
            step = interval == null ? null : interval.toSeconds();
        }
        if (!query.getMathExpressions().isEmpty()) {
            expression = "(" + expression + ") " + query.getMathExpressions().get(0).getExpression();
        }

        StringBuilder raw = new StringBuilder(expression);
        if (query.getLimit() != null) {
            raw.append(" # limit: ").append(query.getLimit());
        }
        Instant start = query.getStartTime();
        Instant end = query.getEndTime();
        if (start != null && end != null) {
            raw.append(" # time range: ").append(DateTimeUtil.formatIso(start))
                .append(" to ").append(DateTimeUtil.formatIso(end));
        } else if (query.getRelativeTime() != null) {
            raw.append(" # relative time: ").append(query.getRelativeTime().format("y ", "d ", "h ", "m ", "s ").trim());
        }
        return new PrometheusQuery(expression, raw.toString(), start, end, query.getRelativeTime(), step);
    }

    static String labelSelector(List<Condition> conditions) {
        List<String> matchers = new ArrayList<>();
        for (Condition condition : conditions) {
            String field = condition.getField();
            Object value = condition.getScalarValue();
            switch (condition.getOperator()) {
                case BETWEEN:
                    break;
                case NOT_EQUALS:
                case NOT_EQUALS_ALT:
                    matchers.add(field + "!=\"" + value + "\"");
                    break;
                case REGEX:
                    matchers.add(field + "=~\"" + value + "\"");
                    break;
                case IN:
                    matchers.add(field + "=~\"^(" + join(condition.getValues()) + ")$\"");
                    break;
                case NOT_IN:
                    matchers.add(field + "!~\"^(" + join(condition.getValues()) + ")$\"");
                    break;
                default:
                    matchers.add(field + "=\"" + value + "\"");
                    break;
            }
        }
        return matchers.isEmpty() ? "" : "{" + String.join(",", matchers) + "}";
    }

    private static String join(List<Object> values) {
        List<String> parts = new ArrayList<>(values.size());
        for (Object value : values) {
            parts.add(String.valueOf(value));
        }
        return String.join("|", parts);
    }

    private static String aggregate(Aggregation aggregation, String selector) {
        if (aggregation.isPercentile()) {
            return "quantile(" + quantile(aggregation.getPercentile()) + ", " + selector + ")";
        }
        String function = aggregation.getNormalizedFunction();
        switch (function) {
            case "avg":
            case "mean":
                return "avg(" + selector + ")";
            default:
                return function + "(" + selector + ")";
        }
    }

    private static String quantile(String percentile) {
        try {
            return new BigDecimal(percentile).movePointLeft(2).stripTrailingZeros().toPlainString();
        } catch (NumberFormatException e) {
            return "0.5";
        }
    }
}
