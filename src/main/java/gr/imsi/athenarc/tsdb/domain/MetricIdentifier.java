package gr.imsi.athenarc.tsdb.domain;

import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * A metric named by namespace and name. The measurement written to a backend
 * is {@code namespace_name}, or just the name when there is no namespace.
 */
public final class MetricIdentifier {

    private final String namespace;
    private final String name;

    public MetricIdentifier(String namespace, String name) {
        this.namespace = namespace == null ? "" : namespace;
        this.name = Preconditions.checkNotNull(name, "name");
    }

    public String getNamespace() {
        return namespace;
    }

    public String getName() {
        return name;
    }

    public String toMeasurement() {
        return namespace.isEmpty() ? name : namespace + "_" + name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MetricIdentifier)) return false;
        MetricIdentifier that = (MetricIdentifier) o;
        return namespace.equals(that.namespace) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespace, name);
    }

    @Override
    public String toString() {
        return toMeasurement();
    }
}
