package gr.imsi.athenarc.tsdb.domain;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single sample to write: one measurement, its fields, its tags and a timestamp.
 * Only {@link #addField} and {@link #addTag} change a point after construction.
 * Field values are numbers, booleans or strings; backends that only store
 * numbers skip the rest.
 */
public class DataPoint {

    private final String measurement;
    private final Map<String, Object> fields;
    private final Map<String, String> tags;
    private final Instant timestamp;

    public DataPoint(String measurement, Map<String, ?> fields, Map<String, String> tags, Instant timestamp) {
        Preconditions.checkArgument(measurement != null && !measurement.isEmpty(), "Measurement is required");
        this.measurement = measurement;
        this.fields = new LinkedHashMap<>(Preconditions.checkNotNull(fields, "fields"));
        this.tags = new LinkedHashMap<>(Preconditions.checkNotNull(tags, "tags"));
        this.timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public DataPoint(String measurement, Map<String, ?> fields, Instant timestamp) {
        this(measurement, fields, Collections.<String, String>emptyMap(), timestamp);
    }

    /**
     * A sample with a single field called {@code value}, the layout used for
     * metrics identified by namespace and name.
     */
    public static DataPoint of(MetricIdentifier metric, Map<String, String> tags, Number value, Instant timestamp) {
        return new DataPoint(metric.toMeasurement(), Collections.singletonMap("value", value), tags, timestamp);
    }

    public DataPoint addField(String name, Object value) {
        Preconditions.checkNotNull(name, "name");
        fields.put(name, value);
        return this;
    }

    public DataPoint addTag(String name, String value) {
        Preconditions.checkNotNull(name, "name");
        tags.put(name, value);
        return this;
    }

    public String getMeasurement() {
        return measurement;
    }

    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public Map<String, String> getTags() {
        return Collections.unmodifiableMap(tags);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataPoint)) return false;
        DataPoint that = (DataPoint) o;
        return measurement.equals(that.measurement) && fields.equals(that.fields)
            && tags.equals(that.tags) && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(measurement, fields, tags, timestamp);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("measurement", measurement)
            .add("fields", fields)
            .add("tags", tags)
            .add("timestamp", timestamp)
            .toString();
    }
}
