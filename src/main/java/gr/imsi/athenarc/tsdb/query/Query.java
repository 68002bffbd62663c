package gr.imsi.athenarc.tsdb.query;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Backend-agnostic description of a time-series query, built with a fluent
 * interface. Builder methods only record state; {@link #validate()} reports
 * what is missing or inconsistent.
 *
 * <pre>
 * Query query = new Query("cpu_usage")
 *     .select("value")
 *     .where("host", "=", "server1")
 *     .latest("1h")
 *     .groupByTime("5m")
 *     .avg("value", "avg_value");
 * </pre>
 */
public class Query {

    public static final String WILDCARD = "*";
    public static final String TIME_FIELD = "time";

    private String measurement;
    private final List<String> fields = new ArrayList<>(Collections.singletonList(WILDCARD));
    private boolean distinct = false;
    private final List<Condition> conditions = new ArrayList<>();
    private TimeSpec timeSpec = TimeSpec.unset();
    @Nullable
    private String timezone;
    private final Set<String> groupBy = new LinkedHashSet<>();
    @Nullable
    private String interval;
    private final List<Aggregation> aggregations = new ArrayList<>();
    @Nullable
    private Fill fill;
    private final List<MathExpression> mathExpressions = new ArrayList<>();
    private final Map<String, SortDirection> orderBy = new LinkedHashMap<>();
    @Nullable
    private Integer limit;
    @Nullable
    private Integer offset;
    private final List<HavingClause> having = new ArrayList<>();

    /**
     * Start a query against the given measurement.
     *
     * @param measurement The measurement (or metric path) to read from
     */
    public Query(String measurement) {
        this.measurement = measurement;
    }

    // ---- selection ----

    /**
     * Replace the selected fields. Selecting nothing falls back to the wildcard.
     *
     * @param fields The fields to read
     * @return This query for method chaining
     */
    public Query select(String... fields) {
        return select(Arrays.asList(fields));
    }

    public Query select(Collection<String> fields) {
        this.fields.clear();
        this.fields.addAll(fields);
        if (this.fields.isEmpty()) {
            this.fields.add(WILDCARD);
        }
        return this;
    }

    /**
     * Like {@link #select(String...)} but only distinct values are returned.
     */
    public Query selectDistinct(String... fields) {
        select(fields);
        this.distinct = true;
        return this;
    }

    // ---- conditions ----

    public Query where(String field, Object value) {
        return where(field, ComparisonOperator.EQUALS, value);
    }

    /**
     * Add an AND condition, the operator given by its token ("=", "!=", "REGEX", ...).
     *
     * @return This query for method chaining
     */
    public Query where(String field, String operator, @Nullable Object value) {
        return where(field, ComparisonOperator.fromToken(operator), value);
    }

    public Query where(String field, ComparisonOperator operator, @Nullable Object value) {
        conditions.add(new Condition(field, operator, value, LogicalType.AND));
        return this;
    }

    public Query orWhere(String field, String operator, @Nullable Object value) {
        return orWhere(field, ComparisonOperator.fromToken(operator), value);
    }

    public Query orWhere(String field, ComparisonOperator operator, @Nullable Object value) {
        conditions.add(new Condition(field, operator, value, LogicalType.OR));
        return this;
    }

    public Query whereIn(String field, Collection<?> values) {
        return where(field, ComparisonOperator.IN, values);
    }

    public Query whereNotIn(String field, Collection<?> values) {
        return where(field, ComparisonOperator.NOT_IN, values);
    }

    public Query whereBetween(String field, Object min, Object max) {
        return where(field, ComparisonOperator.BETWEEN, Arrays.asList(min, max));
    }

    public Query whereRegex(String field, String pattern) {
        return where(field, ComparisonOperator.REGEX, pattern);
    }

    public Query whereNotRegex(String field, String pattern) {
        return where(field, ComparisonOperator.NOT_REGEX, pattern);
    }

    // ---- time ----

    /**
     * Restrict the query to a fixed window. Replaces any relative window.
     *
     * @param start Inclusive start
     * @param end Exclusive end
     * @return This query for method chaining
     */
    public Query timeRange(Instant start, Instant end) {
        Preconditions.checkNotNull(start, "start");
        Preconditions.checkNotNull(end, "end");
        this.timeSpec = TimeSpec.absolute(start, end);
        return this;
    }

    /**
     * Open-ended window starting at {@code start}. Replaces any other window.
     */
    public Query since(Instant start) {
        Preconditions.checkNotNull(start, "start");
        this.timeSpec = TimeSpec.absolute(start, null);
        return this;
    }

    /**
     * Set the end of the window, keeping an absolute start if one was set.
     * Replaces any relative window.
     */
    public Query until(Instant end) {
        Preconditions.checkNotNull(end, "end");
        this.timeSpec = TimeSpec.absolute(timeSpec.getStart(), end);
        return this;
    }

    /**
     * Look back from now by a compact duration ("30s", "5m", "1h", "7d", "2w", "1y").
     * Replaces any absolute window.
     *
     * @throws gr.imsi.athenarc.tsdb.exception.QueryException if the duration cannot be parsed
     */
    public Query latest(String duration) {
        this.timeSpec = TimeSpec.relative(RelativeTime.parse(duration));
        return this;
    }

    public Query timezone(String timezone) {
        this.timezone = timezone;
        return this;
    }

    // ---- grouping ----

    public Query groupBy(Collection<String> tags) {
        groupBy.addAll(tags);
        return this;
    }

    public Query groupBy(Collection<String> tags, @Nullable String interval) {
        groupBy(tags);
        if (interval != null) {
            this.interval = interval;
        }
        return this;
    }

    /**
     * Bucket points into fixed windows, e.g. "5m".
     */
    public Query groupByTime(String interval) {
        this.interval = interval;
        return this;
    }

    // ---- aggregation ----

    public Query aggregate(String function, @Nullable String field, @Nullable String alias) {
        aggregations.add(new Aggregation(function, field, alias));
        return this;
    }

    public Query sum(String field, @Nullable String alias) {
        return aggregate("SUM", field, alias);
    }

    public Query avg(String field, @Nullable String alias) {
        return aggregate("AVG", field, alias);
    }

    public Query count(String field, @Nullable String alias) {
        return aggregate("COUNT", field, alias);
    }

    public Query min(String field, @Nullable String alias) {
        return aggregate("MIN", field, alias);
    }

    public Query max(String field, @Nullable String alias) {
        return aggregate("MAX", field, alias);
    }

    public Query first(String field, @Nullable String alias) {
        return aggregate("FIRST", field, alias);
    }

    public Query last(String field, @Nullable String alias) {
        return aggregate("LAST", field, alias);
    }

    public Query percentile(String field, double percentile, @Nullable String alias) {
        String p = percentile == Math.rint(percentile) ? String.valueOf((long) percentile) : String.valueOf(percentile);
        return aggregate("PERCENTILE_" + p, field, alias);
    }

    public Query stddev(String field, @Nullable String alias) {
        return aggregate("STDDEV", field, alias);
    }

    // ---- fill ----

    public Query fill(FillPolicy policy, @Nullable Object value) {
        this.fill = new Fill(policy, value);
        return this;
    }

    public Query fill(String policy, @Nullable Object value) {
        return fill(FillPolicy.fromString(policy), value);
    }

    public Query fillNull() {
        return fill(FillPolicy.NULL, null);
    }

    public Query fillNone() {
        return fill(FillPolicy.NONE, null);
    }

    public Query fillPrevious() {
        return fill(FillPolicy.PREVIOUS, null);
    }

    public Query fillLinear() {
        return fill(FillPolicy.LINEAR, null);
    }

    public Query fillValue(Object value) {
        return fill(FillPolicy.VALUE, value);
    }

    // ---- post-processing ----

    /**
     * Add a computed column. The expression is backend-native and is not checked.
     */
    public Query math(String expression, String alias) {
        mathExpressions.add(new MathExpression(expression, alias));
        return this;
    }

    public Query orderBy(String field, String direction) {
        return orderBy(field, SortDirection.fromString(direction));
    }

    public Query orderBy(String field, SortDirection direction) {
        orderBy.put(field, direction);
        return this;
    }

    public Query orderByTime(String direction) {
        return orderBy(TIME_FIELD, direction);
    }

    public Query limit(int limit) {
        this.limit = limit;
        return this;
    }

    public Query offset(int offset) {
        this.offset = offset;
        return this;
    }

    public Query having(String field, String operator, @Nullable Object value) {
        return having(field, ComparisonOperator.fromToken(operator), value);
    }

    public Query having(String field, ComparisonOperator operator, @Nullable Object value) {
        having.add(new HavingClause(field, operator, value));
        return this;
    }

    // ---- validation ----

    /**
     * Check the query for missing or inconsistent parts.
     *
     * @return human-readable problems, empty when the query is usable
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (measurement == null || measurement.isEmpty()) {
            errors.add("Measurement is required");
        }
        if (!aggregations.isEmpty() && groupBy.isEmpty() && interval == null) {
            errors.add("Aggregations require GROUP BY clause or time interval");
        }
        if (!having.isEmpty() && aggregations.isEmpty()) {
            errors.add("HAVING clause requires aggregation functions");
        }
        return errors;
    }

    public boolean isValid() {
        return validate().isEmpty();
    }

    // ---- inspection ----

    public boolean hasAggregations() {
        return !aggregations.isEmpty();
    }

    public boolean hasTimeGrouping() {
        return interval != null;
    }

    public boolean hasConditionForField(String field) {
        for (Condition condition : conditions) {
            if (condition.getField().equals(field)) {
                return true;
            }
        }
        return false;
    }

    public List<Condition> getConditionsForField(String field) {
        ImmutableList.Builder<Condition> builder = ImmutableList.builder();
        for (Condition condition : conditions) {
            if (condition.getField().equals(field)) {
                builder.add(condition);
            }
        }
        return builder.build();
    }

    public List<Condition> getConditionsByOperator(ComparisonOperator operator) {
        ImmutableList.Builder<Condition> builder = ImmutableList.builder();
        for (Condition condition : conditions) {
            if (condition.getOperator() == operator) {
                builder.add(condition);
            }
        }
        return builder.build();
    }

    public List<Condition> getAndConditions() {
        return Condition.filter(conditions, LogicalType.AND);
    }

    public List<Condition> getOrConditions() {
        return Condition.filter(conditions, LogicalType.OR);
    }

    public boolean selectsAllFields() {
        return fields.isEmpty() || fields.contains(WILDCARD);
    }

    // ---- getters ----

    public String getMeasurement() {
        return measurement;
    }

    public void setMeasurement(String measurement) {
        this.measurement = measurement;
    }

    public List<String> getFields() {
        return Collections.unmodifiableList(fields);
    }

    public boolean isDistinct() {
        return distinct;
    }

    public List<Condition> getConditions() {
        return Collections.unmodifiableList(conditions);
    }

    public TimeSpec getTimeSpec() {
        return timeSpec;
    }

    @Nullable
    public Instant getStartTime() {
        return timeSpec.getStart();
    }

    @Nullable
    public Instant getEndTime() {
        return timeSpec.getEnd();
    }

    @Nullable
    public RelativeTime getRelativeTime() {
        return timeSpec.getRelativeTime();
    }

    @Nullable
    public String getTimezone() {
        return timezone;
    }

    public Set<String> getGroupBy() {
        return Collections.unmodifiableSet(groupBy);
    }

    @Nullable
    public String getInterval() {
        return interval;
    }

    public List<Aggregation> getAggregations() {
        return Collections.unmodifiableList(aggregations);
    }

    @Nullable
    public Fill getFill() {
        return fill;
    }

    public List<MathExpression> getMathExpressions() {
        return Collections.unmodifiableList(mathExpressions);
    }

    public Map<String, SortDirection> getOrderBy() {
        return Collections.unmodifiableMap(orderBy);
    }

    @Nullable
    public Integer getLimit() {
        return limit;
    }

    @Nullable
    public Integer getOffset() {
        return offset;
    }

    public List<HavingClause> getHaving() {
        return Collections.unmodifiableList(having);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .omitNullValues()
            .add("measurement", measurement)
            .add("fields", fields)
            .add("distinct", distinct ? Boolean.TRUE : null)
            .add("conditions", conditions.isEmpty() ? null : conditions)
            .add("time", timeSpec)
            .add("timezone", timezone)
            .add("groupBy", groupBy.isEmpty() ? null : groupBy)
            .add("interval", interval)
            .add("aggregations", aggregations.isEmpty() ? null : aggregations)
            .add("fill", fill)
            .add("math", mathExpressions.isEmpty() ? null : mathExpressions)
            .add("orderBy", orderBy.isEmpty() ? null : orderBy)
            .add("limit", limit)
            .add("offset", offset)
            .add("having", having.isEmpty() ? null : having)
            .toString();
    }
}
