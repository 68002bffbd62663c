package gr.imsi.athenarc.tsdb.datasource.prometheus;

import com.google.common.base.Stopwatch;

import gr.imsi.athenarc.tsdb.datasource.QueryExecutor;
import gr.imsi.athenarc.tsdb.domain.AggregateInterval;
import gr.imsi.athenarc.tsdb.exception.ConnectionException;
import gr.imsi.athenarc.tsdb.exception.QueryException;
import gr.imsi.athenarc.tsdb.result.QueryResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Runs expressions against {@code /api/v1/query_range}, or {@code /api/v1/query}
 * when the query has no window.
 */
public class PrometheusQueryExecutor implements QueryExecutor<PrometheusQuery> {

    private static final Logger LOG = LoggerFactory.getLogger(PrometheusQueryExecutor.class);

    private static final long DEFAULT_STEP_SECONDS = 60L;

    private final String baseUrl;
    private final Duration timeout;
    private final long defaultStepSeconds;
    private final HttpClient httpClient;
    private final PrometheusResponseParser parser;
    private final Clock clock;

    public PrometheusQueryExecutor(String baseUrl, Duration timeout, String defaultStep, HttpClient httpClient,
                                   PrometheusResponseParser parser, Clock clock) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
        AggregateInterval step = AggregateInterval.parse(defaultStep);
        this.defaultStepSeconds = step == null ? DEFAULT_STEP_SECONDS : step.toSeconds();
        this.httpClient = httpClient;
        this.parser = parser;
        this.clock = clock;
    }

    public PrometheusQueryExecutor(String baseUrl, Duration timeout, String defaultStep) {
        this(baseUrl, timeout, defaultStep, HttpClient.newBuilder().connectTimeout(timeout).build(),
            new PrometheusResponseParser(), Clock.systemUTC());
    }

    @Override
    public QueryResult execute(PrometheusQuery query) {
        String url = url(query);
        LOG.info("Executing Query: \n" + query.getRawQuery());
        Stopwatch stopwatch = Stopwatch.createStarted();
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(timeout)
            .header("Accept", "application/json")
            .GET()
            .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            LOG.error("Prometheus request to {} failed: {}", baseUrl, e.getMessage());
            throw new ConnectionException("Failed to reach Prometheus at " + baseUrl + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryException("Interrupted while querying Prometheus", query.getRawQuery(), e);
        }
        // 400 and 422 still carry the JSON error envelope
        if (response.statusCode() >= 500) {
            LOG.error("Prometheus returned status {}", response.statusCode());
            throw new QueryException("Prometheus returned status " + response.statusCode(), query.getRawQuery());
        }
        QueryResult result;
        try {
            result = parser.parse(response.body(), metricName(query.getExpression()));
        } catch (QueryException e) {
            throw new QueryException(e.getMessage(), query.getRawQuery(), e);
        }
        LOG.debug("Prometheus query answered in {} ms", stopwatch.elapsed(TimeUnit.MILLISECONDS));
        return result;
    }

    String url(PrometheusQuery query) {
        String expression = URLEncoder.encode(query.getExpression(), StandardCharsets.UTF_8);
        if (!query.isRangeQuery()) {
            return baseUrl + "/api/v1/query?query=" + expression;
        }
        Instant end;
        Instant start;
        if (query.getStart() != null && query.getEnd() != null) {
            start = query.getStart();
            end = query.getEnd();
        } else {
            end = clock.instant();
            start = end.minusSeconds(query.getRelativeTime().toSeconds());
        }
        long step = query.getStepSeconds() != null ? query.getStepSeconds() : defaultStepSeconds;
        return baseUrl + "/api/v1/query_range?query=" + expression
            + "&start=" + start.getEpochSecond()
            + "&end=" + end.getEpochSecond()
            + "&step=" + step;
    }

    /**
     * Bare metric name at the start of the expression, used when a series has no __name__.
     */
    static String metricName(String expression) {
        String inner = expression;
        int paren = inner.lastIndexOf('(');
        if (paren >= 0) {
            inner = inner.substring(paren + 1);
        }
        int end = 0;
        while (end < inner.length() && (Character.isLetterOrDigit(inner.charAt(end))
            || inner.charAt(end) == '_' || inner.charAt(end) == ':')) {
            end++;
        }
        return end == 0 ? expression : inner.substring(0, end);
    }
}
