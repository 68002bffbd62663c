package gr.imsi.athenarc.tsdb.datasource.prometheus;

import com.sun.net.httpserver.HttpServer;

import gr.imsi.athenarc.tsdb.exception.ConnectionException;
import gr.imsi.athenarc.tsdb.exception.QueryException;
import gr.imsi.athenarc.tsdb.query.Query;
import gr.imsi.athenarc.tsdb.result.TimeSeriesResult;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class PrometheusQueryExecutorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(1685318400L), ZoneOffset.UTC);

    private final PromQLCompiler compiler = new PromQLCompiler();

    private HttpServer server;
    private final AtomicReference<String> lastRequest = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String body = "{\"status\":\"success\",\"data\":{\"resultType\":\"matrix\",\"result\":[]}}";

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/v1/", exchange -> {
            lastRequest.set(exchange.getRequestURI().getPath() + "?" + exchange.getRequestURI().getRawQuery());
            byte[] payload = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, payload.length == 0 ? -1 : payload.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(payload);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort() + "/";
    }

    private PrometheusQueryExecutor executor(String defaultStep) {
        Duration timeout = Duration.ofSeconds(5);
        return new PrometheusQueryExecutor(baseUrl(), timeout, defaultStep,
            HttpClient.newBuilder().connectTimeout(timeout).build(), new PrometheusResponseParser(), CLOCK);
    }

    @Test
    void instantQueryWithoutWindow() {
        String url = executor("1m").url(new PrometheusQuery("up"));
        assertEquals(baseUrl() + "api/v1/query?query=up", url);
    }

    @Test
    void absoluteWindowUsesRangeEndpoint() {
        PrometheusQuery query = compiler.compile(new Query("cpu").where("host", "=", "a")
            .timeRange(Instant.ofEpochSecond(1685314800L), Instant.ofEpochSecond(1685316600L)));

        assertEquals(baseUrl() + "api/v1/query_range?query=cpu%7Bhost%3D%22a%22%7D"
            + "&start=1685314800&end=1685316600&step=15", executor("15s").url(query));
    }

    @Test
    void relativeWindowEndsAtClock() {
        PrometheusQuery query = compiler.compile(new Query("cpu").latest("1h").groupByTime("5m"));

        assertEquals(baseUrl() + "api/v1/query_range?query=rate%28cpu%5B5m%5D%29"
            + "&start=1685314800&end=1685318400&step=300", executor("15s").url(query));
    }

    @Test
    void unparseableDefaultStepFallsBackToMinute() {
        PrometheusQuery query = compiler.compile(new Query("cpu").latest("1h"));
        assertTrue(executor("soon").url(query).endsWith("&step=60"));
    }

    @Test
    void executesAndParses() {
        body = "{\"status\":\"success\",\"data\":{\"resultType\":\"vector\",\"result\":["
            + "{\"metric\":{\"__name__\":\"up\",\"job\":\"api\"},\"value\":[1685318400,\"1\"]}]}}";

        TimeSeriesResult result = (TimeSeriesResult) executor("1m").execute(new PrometheusQuery("up"));
        assertEquals("/api/v1/query?query=up", lastRequest.get());
        assertEquals(1.0, result.getSeries().get(0).getValues().get(0));
        assertEquals("api", result.getSeries().get(0).getLabels().get("job"));
    }

    @Test
    void clientErrorsCarryServerMessage() {
        status = 400;
        body = "{\"status\":\"error\",\"errorType\":\"bad_data\",\"error\":\"unexpected end of input\"}";

        QueryException e = assertThrows(QueryException.class,
            () -> executor("1m").execute(new PrometheusQuery("sum(")));
        assertEquals("Prometheus query failed: bad_data unexpected end of input", e.getMessage());
        assertEquals("sum(", e.getQuery());
    }

    @Test
    void serverErrorsFail() {
        status = 503;
        body = "unavailable";

        QueryException e = assertThrows(QueryException.class,
            () -> executor("1m").execute(new PrometheusQuery("up")));
        assertEquals("Prometheus returned status 503", e.getMessage());
    }

    @Test
    void unreachableServerIsConnectionFailure() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        PrometheusQueryExecutor executor = new PrometheusQueryExecutor("http://127.0.0.1:" + port,
            Duration.ofSeconds(2), "1m");
        assertThrows(ConnectionException.class, () -> executor.execute(new PrometheusQuery("up")));
    }

    @Test
    void metricNameFromExpression() {
        assertEquals("cpu", PrometheusQueryExecutor.metricName("cpu{host=\"a\"}"));
        assertEquals("requests", PrometheusQueryExecutor.metricName("rate(requests[5m])"));
        assertEquals("node:load", PrometheusQueryExecutor.metricName("sum by (host) (node:load)"));
    }
}
