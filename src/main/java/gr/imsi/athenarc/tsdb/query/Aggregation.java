package gr.imsi.athenarc.tsdb.query;

import com.google.common.base.Preconditions;

import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.Objects;

/**
 * A reducer applied to one field, optionally renamed in the output.
 * Percentiles are encoded in the function name as {@code percentile_<p>}.
 */
public final class Aggregation {

    public static final String PERCENTILE_PREFIX = "percentile_";

    private final String function;
    @Nullable
    private final String field;
    @Nullable
    private final String alias;

    public Aggregation(String function, @Nullable String field, @Nullable String alias) {
        Preconditions.checkArgument(function != null && !function.isEmpty(), "Aggregation function is required");
        this.function = function;
        this.field = field;
        this.alias = alias;
    }

    public String getFunction() {
        return function;
    }

    /**
     * The function name lower-cased, which is how all compilers match it.
     */
    public String getNormalizedFunction() {
        return function.toLowerCase(Locale.ROOT);
    }

    @Nullable
    public String getField() {
        return field;
    }

    @Nullable
    public String getAlias() {
        return alias;
    }

    public boolean isPercentile() {
        return getNormalizedFunction().startsWith(PERCENTILE_PREFIX);
    }

    /**
     * The percentile encoded in the function name, e.g. "95" for {@code percentile_95}.
     */
    @Nullable
    public String getPercentile() {
        return isPercentile() ? function.substring(PERCENTILE_PREFIX.length()) : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Aggregation)) return false;
        Aggregation that = (Aggregation) o;
        return function.equals(that.function) && Objects.equals(field, that.field) && Objects.equals(alias, that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, field, alias);
    }

    @Override
    public String toString() {
        return function + "(" + field + ")" + (alias != null ? " AS " + alias : "");
    }
}
