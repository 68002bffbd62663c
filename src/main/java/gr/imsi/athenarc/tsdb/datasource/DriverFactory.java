package gr.imsi.athenarc.tsdb.datasource;

import gr.imsi.athenarc.tsdb.config.DriverConfiguration;

/**
 * Creates a data source for one backend from its configuration.
 */
@FunctionalInterface
public interface DriverFactory {

    DataSource create(DriverConfiguration configuration);
}
