package gr.imsi.athenarc.tsdb.result;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named, labelled sequence of points. Points keep the order the backend sent them in.
 */
public final class Series {

    private final String metric;
    private final Map<String, String> labels;
    private final List<SeriesPoint> points;
    @Nullable
    private final String alias;

    public Series(String metric, Map<String, String> labels, List<SeriesPoint> points, @Nullable String alias) {
        this.metric = Preconditions.checkNotNull(metric, "metric");
        this.labels = ImmutableMap.copyOf(labels);
        this.points = ImmutableList.copyOf(points);
        this.alias = alias;
    }

    public Series(String metric, Map<String, String> labels, List<SeriesPoint> points) {
        this(metric, labels, points, null);
    }

    public String getMetric() {
        return metric;
    }

    public Map<String, String> getLabels() {
        return labels;
    }

    public List<SeriesPoint> getPoints() {
        return points;
    }

    @Nullable
    public String getAlias() {
        return alias;
    }

    public int size() {
        return points.size();
    }

    public List<Double> getValues() {
        List<Double> values = new ArrayList<>(points.size());
        for (SeriesPoint point : points) {
            values.add(point.getValue());
        }
        return values;
    }

    public static Builder builder(String metric) {
        return new Builder(metric);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Series)) return false;
        Series series = (Series) o;
        return metric.equals(series.metric) && labels.equals(series.labels)
            && points.equals(series.points) && Objects.equals(alias, series.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metric, labels, points, alias);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .omitNullValues()
            .add("metric", metric)
            .add("alias", alias)
            .add("labels", labels)
            .add("points", points.size())
            .toString();
    }

    /**
     * Accumulates points while a parser walks a response.
     */
    public static class Builder {
        private final String metric;
        private final Map<String, String> labels = new LinkedHashMap<>();
        private final List<SeriesPoint> points = new ArrayList<>();
        private String alias;

        private Builder(String metric) {
            this.metric = metric;
        }

        public Builder label(String key, String value) {
            labels.put(key, value);
            return this;
        }

        public Builder labels(Map<String, String> labels) {
            this.labels.putAll(labels);
            return this;
        }

        public Builder alias(String alias) {
            this.alias = alias;
            return this;
        }

        public Builder point(long timestamp, @Nullable Double value) {
            points.add(new SeriesPoint(timestamp, value));
            return this;
        }

        public Series build() {
            return new Series(metric, labels, points, alias);
        }
    }
}
