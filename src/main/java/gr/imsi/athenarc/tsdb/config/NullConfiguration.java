package gr.imsi.athenarc.tsdb.config;

public class NullConfiguration implements DriverConfiguration {

    public static final String DRIVER_NAME = "null";

    @Override
    public String getDriverName() {
        return DRIVER_NAME;
    }
}
