package gr.imsi.athenarc.tsdb.query;

import com.google.common.base.Preconditions;

import org.jetbrains.annotations.Nullable;

/**
 * Post-aggregation filter on an aggregated column.
 */
public final class HavingClause {

    private final String field;
    private final ComparisonOperator operator;
    @Nullable
    private final Object value;

    public HavingClause(String field, ComparisonOperator operator, @Nullable Object value) {
        this.field = Preconditions.checkNotNull(field, "field");
        this.operator = Preconditions.checkNotNull(operator, "operator");
        this.value = value;
    }

    public String getField() {
        return field;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    @Nullable
    public Object getValue() {
        return value;
    }

    @Override
    public String toString() {
        return field + " " + operator + " " + value;
    }
}
