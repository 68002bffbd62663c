package gr.imsi.athenarc.tsdb.datasource.graphite;

import gr.imsi.athenarc.tsdb.config.GraphiteConfiguration;
import gr.imsi.athenarc.tsdb.domain.DataPoint;
import gr.imsi.athenarc.tsdb.exception.WriteException;

import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.math.BigDecimal;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class GraphiteWriterTest {

    private static final Instant TS = Instant.ofEpochSecond(1698408000L);

    @Test
    void buildsPlaintextLines() {
        GraphiteWriter writer = new GraphiteWriter(null, "stats", 10);
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("user", 12.50);
        fields.put("label", "n/a");
        fields.put("count", 3);
        DataPoint point = new DataPoint("cpu", fields, Collections.singletonMap("host", "web01"), TS);

        List<String> lines = new ArrayList<>();
        assertFalse(writer.toLines(point, lines));
        assertEquals(Arrays.asList(
            "stats.cpu.host.web01.user 12.5 1698408000\n",
            "stats.cpu.host.web01.count 3 1698408000\n"), lines);
    }

    @Test
    void normalizesNumbers() {
        assertEquals("1", GraphiteWriter.numeric(1.0));
        assertEquals("0.25", GraphiteWriter.numeric(new BigDecimal("0.2500")));
        assertEquals("42", GraphiteWriter.numeric(" 42 "));
        assertNull(GraphiteWriter.numeric(Double.NaN));
        assertNull(GraphiteWriter.numeric(true));
    }

    @Test
    void sendsBatchOverTcp() throws Exception {
        try (ServerSocket carbon = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            CompletableFuture<List<String>> received = CompletableFuture.supplyAsync(() -> readAll(carbon));
            GraphiteConfiguration config = new GraphiteConfiguration.Builder()
                .host("127.0.0.1")
                .port(carbon.getLocalPort())
                .build();
            CarbonConnection connection = new CarbonConnection(config);
            GraphiteWriter writer = new GraphiteWriter(connection, "", 1);

            assertTrue(writer.writeBatch(Arrays.asList(
                new DataPoint("cpu", Collections.singletonMap("value", 1), TS),
                new DataPoint("mem", Collections.singletonMap("value", 2.5), TS))));
            connection.closeConnection();

            assertEquals(Arrays.asList("cpu.value 1 1698408000", "mem.value 2.5 1698408000"),
                received.get(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void refusedConnectionIsWriteFailure() throws IOException {
        int port;
        try (ServerSocket unused = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = unused.getLocalPort();
        }
        GraphiteConfiguration config = new GraphiteConfiguration.Builder().host("127.0.0.1").port(port).build();
        GraphiteWriter writer = new GraphiteWriter(new CarbonConnection(config), "", 10);

        WriteException e = assertThrows(WriteException.class,
            () -> writer.write(new DataPoint("cpu", Collections.singletonMap("value", 1), TS)));
        assertTrue(e.getMessage().startsWith("Failed to write data to Graphite: "), e.getMessage());
    }

    private static List<String> readAll(ServerSocket server) {
        List<String> lines = new ArrayList<>();
        try (Socket socket = server.accept();
             BufferedReader reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
        return lines;
    }
}
