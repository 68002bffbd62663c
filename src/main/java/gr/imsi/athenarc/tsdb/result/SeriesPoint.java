package gr.imsi.athenarc.tsdb.result;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * One value of a series. Timestamps are epoch seconds; a missing value is null.
 */
public final class SeriesPoint {

    private final long timestamp;
    @Nullable
    private final Double value;

    public SeriesPoint(long timestamp, @Nullable Double value) {
        this.timestamp = timestamp;
        this.value = value;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Nullable
    public Double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SeriesPoint)) return false;
        SeriesPoint that = (SeriesPoint) o;
        return timestamp == that.timestamp && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return timestamp + "=" + value;
    }
}
