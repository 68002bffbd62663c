package gr.imsi.athenarc.tsdb.datasource.graphite;

import com.google.common.base.Stopwatch;

import gr.imsi.athenarc.tsdb.datasource.QueryExecutor;
import gr.imsi.athenarc.tsdb.exception.ConnectionException;
import gr.imsi.athenarc.tsdb.exception.QueryException;
import gr.imsi.athenarc.tsdb.result.QueryResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Sends targets to the render API with a GET request.
 */
public class GraphiteQueryExecutor implements QueryExecutor<GraphiteQuery> {

    private static final Logger LOG = LoggerFactory.getLogger(GraphiteQueryExecutor.class);

    private final String webUrl;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final GraphiteResponseParser parser;

    public GraphiteQueryExecutor(String webUrl, Duration timeout, HttpClient httpClient, GraphiteResponseParser parser) {
        this.webUrl = webUrl;
        this.timeout = timeout;
        this.httpClient = httpClient;
        this.parser = parser;
    }

    public GraphiteQueryExecutor(String webUrl, Duration timeout) {
        this(webUrl, timeout, HttpClient.newBuilder().connectTimeout(timeout).build(), new GraphiteResponseParser());
    }

    @Override
    public QueryResult execute(GraphiteQuery query) {
        String url = webUrl + "?" + query.getRawQuery();
        LOG.info("Executing Query: \n" + query.getTarget());
        Stopwatch stopwatch = Stopwatch.createStarted();
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(timeout)
            .GET()
            .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            LOG.error("Graphite request to {} failed: {}", webUrl, e.getMessage());
            throw new ConnectionException("Failed to reach Graphite at " + webUrl + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryException("Interrupted while querying Graphite", query.getRawQuery(), e);
        }
        if (response.statusCode() != 200) {
            LOG.error("Graphite returned status {} for {}", response.statusCode(), url);
            throw new QueryException("Query execution failed: Graphite returned status "
                + response.statusCode(), query.getRawQuery());
        }
        QueryResult result = parser.parse(response.body());
        LOG.debug("Graphite query answered in {} ms", stopwatch.elapsed(TimeUnit.MILLISECONDS));
        return result;
    }
}
