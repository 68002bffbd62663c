package gr.imsi.athenarc.tsdb.query;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single predicate of a query: field, operator, value and the way it joins
 * the previous predicate. Array-valued operators (IN, NOT IN, BETWEEN) hold
 * an immutable list; all others hold a scalar (possibly null).
 */
public final class Condition {

    private final String field;
    private final ComparisonOperator operator;
    @Nullable
    private final Object value;
    @Nullable
    private final List<Object> values;
    private final LogicalType logicalType;

    public Condition(String field, ComparisonOperator operator, @Nullable Object value, LogicalType logicalType) {
        this.field = Preconditions.checkNotNull(field, "field");
        this.operator = Preconditions.checkNotNull(operator, "operator");
        this.logicalType = Preconditions.checkNotNull(logicalType, "logicalType");
        this.values = toList(operator, value);
        this.value = values == null ? value : null;
    }

    public Condition(String field, ComparisonOperator operator, @Nullable Object value) {
        this(field, operator, value, LogicalType.AND);
    }

    @Nullable
    private static List<Object> toList(ComparisonOperator operator, @Nullable Object value) {
        if (value instanceof Collection) {
            // copied element by element since ImmutableList rejects nulls
            return Collections.unmodifiableList(new ArrayList<Object>((Collection<?>) value));
        }
        if (value instanceof Object[]) {
            List<Object> values = new ArrayList<>();
            Collections.addAll(values, (Object[]) value);
            return Collections.unmodifiableList(values);
        }
        if (operator.requiresArrayValue()) {
            List<Object> single = new ArrayList<>();
            single.add(value);
            return Collections.unmodifiableList(single);
        }
        return null;
    }

    public String getField() {
        return field;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    @Nullable
    public Object getValue() {
        return values != null ? values : value;
    }

    public LogicalType getLogicalType() {
        return logicalType;
    }

    public boolean isAnd() {
        return logicalType == LogicalType.AND;
    }

    public boolean isOr() {
        return logicalType == LogicalType.OR;
    }

    public boolean isArrayValue() {
        return values != null;
    }

    /**
     * The value as a scalar: the first element for list values.
     */
    @Nullable
    public Object getScalarValue() {
        if (values != null) {
            return values.isEmpty() ? null : values.get(0);
        }
        return value;
    }

    /**
     * The value as a list: scalars are wrapped in a singleton list.
     */
    public List<Object> getValues() {
        if (values != null) {
            return values;
        }
        List<Object> single = new ArrayList<>();
        single.add(value);
        return Collections.unmodifiableList(single);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Condition)) return false;
        Condition that = (Condition) o;
        return field.equals(that.field)
            && operator == that.operator
            && Objects.equals(value, that.value)
            && Objects.equals(values, that.values)
            && logicalType == that.logicalType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, operator, value, values, logicalType);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("type", logicalType)
            .add("field", field)
            .add("operator", operator)
            .add("value", getValue())
            .toString();
    }

    static List<Condition> filter(List<Condition> conditions, LogicalType type) {
        ImmutableList.Builder<Condition> builder = ImmutableList.builder();
        for (Condition condition : conditions) {
            if (condition.logicalType == type) {
                builder.add(condition);
            }
        }
        return builder.build();
    }
}
