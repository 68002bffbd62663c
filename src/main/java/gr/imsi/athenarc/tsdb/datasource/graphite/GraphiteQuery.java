package gr.imsi.athenarc.tsdb.datasource.graphite;

import com.google.common.base.Preconditions;

import gr.imsi.athenarc.tsdb.query.CompiledQuery;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A render API request: one target expression plus its time window.
 */
public class GraphiteQuery implements CompiledQuery {

    private final String target;
    private final String from;
    private final String until;

    public GraphiteQuery(String target, String from, String until) {
        this.target = Preconditions.checkNotNull(target, "target");
        this.from = Preconditions.checkNotNull(from, "from");
        this.until = Preconditions.checkNotNull(until, "until");
    }

    public String getTarget() {
        return target;
    }

    public String getFrom() {
        return from;
    }

    public String getUntil() {
        return until;
    }

    /**
     * Form-encoded {@code target=..&from=..&until=..&format=json}, with
     * asterisks left readable.
     */
    @Override
    public String getRawQuery() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("target", target);
        params.put("from", from);
        params.put("until", until);
        params.put("format", "json");
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> param : params.entrySet()) {
            if (sb.length() > 0) {
                sb.append('&');
            }
            sb.append(param.getKey()).append('=')
                .append(URLEncoder.encode(param.getValue(), StandardCharsets.UTF_8));
        }
        return sb.toString().replace("%2A", "*");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GraphiteQuery)) return false;
        GraphiteQuery that = (GraphiteQuery) o;
        return target.equals(that.target) && from.equals(that.from) && until.equals(that.until);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, from, until);
    }

    @Override
    public String toString() {
        return getRawQuery();
    }
}
