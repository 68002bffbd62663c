package gr.imsi.athenarc.tsdb.datasource.connection;

/**
 * A client-side handle on a backend endpoint.
 */
public interface DatabaseConnection extends AutoCloseable {

    DatabaseConnection connect();

    boolean isConnected();

    void closeConnection();

    @Override
    default void close() {
        closeConnection();
    }
}
