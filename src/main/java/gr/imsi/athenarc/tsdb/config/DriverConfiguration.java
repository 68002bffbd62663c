package gr.imsi.athenarc.tsdb.config;

/**
 * Connection settings of one backend.
 */
public interface DriverConfiguration {

    /**
     * @return the name the driver is registered under
     */
    String getDriverName();
}
