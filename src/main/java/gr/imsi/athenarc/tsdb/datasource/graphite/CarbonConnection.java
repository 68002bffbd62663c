package gr.imsi.athenarc.tsdb.datasource.graphite;

import gr.imsi.athenarc.tsdb.config.GraphiteConfiguration;
import gr.imsi.athenarc.tsdb.datasource.connection.DatabaseConnection;
import gr.imsi.athenarc.tsdb.exception.ConnectionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Socket to the carbon plaintext receiver. TCP sends each chunk as one
 * stream write; UDP sends one datagram per line.
 */
public class CarbonConnection implements DatabaseConnection {

    private static final Logger LOG = LoggerFactory.getLogger(CarbonConnection.class);

    private final GraphiteConfiguration configuration;
    private Socket socket;
    private DatagramSocket datagramSocket;

    public CarbonConnection(GraphiteConfiguration configuration) {
        this.configuration = configuration;
    }

    @Override
    public CarbonConnection connect() {
        if (isConnected()) {
            return this;
        }
        InetSocketAddress address = new InetSocketAddress(configuration.getHost(), configuration.getPort());
        int timeoutMillis = (int) configuration.getTimeout().toMillis();
        try {
            if (configuration.getProtocol() == GraphiteConfiguration.Protocol.UDP) {
                datagramSocket = new DatagramSocket();
                datagramSocket.connect(address);
            } else {
                socket = new Socket();
                socket.connect(address, timeoutMillis);
                socket.setSoTimeout(timeoutMillis);
            }
        } catch (IOException e) {
            closeConnection();
            throw new ConnectionException("Failed to connect to Graphite: " + e.getMessage(), e);
        }
        LOG.debug("Connected to carbon at {} over {}", address, configuration.getProtocol());
        return this;
    }

    @Override
    public boolean isConnected() {
        return (socket != null && socket.isConnected() && !socket.isClosed())
            || (datagramSocket != null && datagramSocket.isConnected());
    }

    public void send(List<String> lines) throws IOException {
        connect();
        if (datagramSocket != null) {
            for (String line : lines) {
                byte[] payload = line.getBytes(StandardCharsets.UTF_8);
                datagramSocket.send(new DatagramPacket(payload, payload.length));
            }
            return;
        }
        OutputStream out = socket.getOutputStream();
        out.write(String.join("", lines).getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    @Override
    public void closeConnection() {
        if (socket != null) {
            try {
                socket.close();
            } catch (IOException e) {
                LOG.warn("Failed to close carbon socket: {}", e.getMessage());
            }
            socket = null;
        }
        if (datagramSocket != null) {
            datagramSocket.close();
            datagramSocket = null;
        }
    }
}
