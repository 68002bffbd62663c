package gr.imsi.athenarc.tsdb.result;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Series returned by a data query. Series are not required to share timestamps
 * or lengths.
 */
public class TimeSeriesResult implements QueryResult {

    private final List<Series> series;
    private final Map<String, Object> metadata;

    public TimeSeriesResult(List<Series> series, Map<String, Object> metadata) {
        this.series = ImmutableList.copyOf(series);
        this.metadata = ImmutableMap.copyOf(metadata);
    }

    public TimeSeriesResult(List<Series> series) {
        this(series, Collections.<String, Object>emptyMap());
    }

    public static TimeSeriesResult empty() {
        return new TimeSeriesResult(Collections.<Series>emptyList());
    }

    public static TimeSeriesResult empty(Map<String, Object> metadata) {
        return new TimeSeriesResult(Collections.<Series>emptyList(), metadata);
    }

    public List<Series> getSeries() {
        return series;
    }

    /**
     * First series with the given metric name.
     */
    public Optional<Series> findSeries(String metric) {
        for (Series s : series) {
            if (s.getMetric().equals(metric)) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }

    @Override
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public boolean isEmpty() {
        return series.isEmpty();
    }

    @Override
    public String toString() {
        return "TimeSeriesResult{series=" + series + ", metadata=" + metadata + '}';
    }
}
