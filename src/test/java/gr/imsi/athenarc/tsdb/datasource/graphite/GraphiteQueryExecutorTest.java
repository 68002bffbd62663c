package gr.imsi.athenarc.tsdb.datasource.graphite;

import com.sun.net.httpserver.HttpServer;

import gr.imsi.athenarc.tsdb.exception.ConnectionException;
import gr.imsi.athenarc.tsdb.exception.QueryException;
import gr.imsi.athenarc.tsdb.result.Series;
import gr.imsi.athenarc.tsdb.result.TimeSeriesResult;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class GraphiteQueryExecutorTest {

    private HttpServer server;
    private final AtomicReference<String> lastQuery = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String body = "[]";

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/render", exchange -> {
            lastQuery.set(exchange.getRequestURI().getRawQuery());
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

    private GraphiteQueryExecutor executor() {
        return new GraphiteQueryExecutor("http://127.0.0.1:" + server.getAddress().getPort() + "/render",
            Duration.ofSeconds(5));
    }

    @Test
    void parsesRenderJson() {
        body = "[{\"target\": \"servers.web01.cpu\", \"datapoints\": [[1.5, 1685314800], [null, 1685314860]]}]";

        TimeSeriesResult result = (TimeSeriesResult) executor().execute(new GraphiteQuery("servers.web01.cpu", "-1h", "now"));

        assertEquals("target=servers.web01.cpu&from=-1h&until=now&format=json", lastQuery.get());
        Series series = result.getSeries().get(0);
        assertEquals("servers.web01.cpu", series.getMetric());
        assertEquals(Arrays.asList(1.5, null), series.getValues());
        assertEquals(1685314860L, series.getPoints().get(1).getTimestamp());
    }

    @Test
    void nonJsonBodyIsEmptyResult() {
        body = "<html>oops</html>";
        assertTrue(((TimeSeriesResult) executor().execute(new GraphiteQuery("a.b", "-1h", "now"))).isEmpty());
    }

    @Test
    void emptyBodyIsEmptyResult() {
        body = "";
        assertTrue(((TimeSeriesResult) executor().execute(new GraphiteQuery("a.b", "-1h", "now"))).isEmpty());
    }

    @Test
    void errorStatusFailsTheQuery() {
        status = 500;
        body = "boom";
        QueryException e = assertThrows(QueryException.class,
            () -> executor().execute(new GraphiteQuery("a.b", "-1h", "now")));
        assertEquals("Query execution failed: Graphite returned status 500", e.getMessage());
        assertNotNull(e.getQuery());
    }

    @Test
    void unreachableServerIsConnectionFailure() {
        int port = server.getAddress().getPort();
        server.stop(0);
        GraphiteQueryExecutor executor = new GraphiteQueryExecutor("http://127.0.0.1:" + port + "/render",
            Duration.ofSeconds(2));
        assertThrows(ConnectionException.class, () -> executor.execute(new GraphiteQuery("a.b", "-1h", "now")));
    }
}
