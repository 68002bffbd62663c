package gr.imsi.athenarc.tsdb.datasource.prometheus;

import com.google.common.base.Preconditions;

import gr.imsi.athenarc.tsdb.query.CompiledQuery;
import gr.imsi.athenarc.tsdb.query.RelativeTime;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * A PromQL expression plus the window it is evaluated over. The raw query is
 * the expression followed by comments describing limit and window.
 */
public class PrometheusQuery implements CompiledQuery {

    private final String expression;
    private final String rawQuery;
    @Nullable private final Instant start;
    @Nullable private final Instant end;
    @Nullable private final RelativeTime relativeTime;
    @Nullable private final Long stepSeconds;

    public PrometheusQuery(String expression, String rawQuery, @Nullable Instant start, @Nullable Instant end,
                           @Nullable RelativeTime relativeTime, @Nullable Long stepSeconds) {
        this.expression = Preconditions.checkNotNull(expression, "expression");
        this.rawQuery = Preconditions.checkNotNull(rawQuery, "rawQuery");
        this.start = start;
        this.end = end;
        this.relativeTime = relativeTime;
        this.stepSeconds = stepSeconds;
    }

    public PrometheusQuery(String expression) {
        this(expression, expression, null, null, null, null);
    }

    /**
     * The PromQL sent to the server.
     */
    public String getExpression() {
        return expression;
    }

    @Override
    public String getRawQuery() {
        return rawQuery;
    }

    @Nullable public Instant getStart() { return start; }
    @Nullable public Instant getEnd() { return end; }
    @Nullable public RelativeTime getRelativeTime() { return relativeTime; }
    @Nullable public Long getStepSeconds() { return stepSeconds; }

    public boolean isRangeQuery() {
        return (start != null && end != null) || relativeTime != null;
    }

    @Override
    public String toString() {
        return rawQuery;
    }
}
