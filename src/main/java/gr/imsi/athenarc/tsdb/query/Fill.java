package gr.imsi.athenarc.tsdb.query;

import com.google.common.base.Preconditions;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

public final class Fill {

    private final FillPolicy policy;
    @Nullable
    private final Object value;

    public Fill(FillPolicy policy, @Nullable Object value) {
        this.policy = Preconditions.checkNotNull(policy, "policy");
        this.value = value;
    }

    public FillPolicy getPolicy() {
        return policy;
    }

    @Nullable
    public Object getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Fill)) return false;
        Fill fill = (Fill) o;
        return policy == fill.policy && Objects.equals(value, fill.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(policy, value);
    }

    @Override
    public String toString() {
        return policy == FillPolicy.VALUE ? "fill(" + value + ")" : "fill(" + policy + ")";
    }
}
