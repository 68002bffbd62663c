package gr.imsi.athenarc.tsdb.datasource;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedSet;

import gr.imsi.athenarc.tsdb.config.DriverConfiguration;
import gr.imsi.athenarc.tsdb.exception.DriverException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps driver names to factories. Drivers are added by explicit
 * {@link #register} calls; nothing is discovered at runtime.
 */
public class DriverRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(DriverRegistry.class);

    private final Map<String, DriverFactory> factories = new LinkedHashMap<>();

    /**
     * @throws DriverException if the name is already taken
     */
    public synchronized DriverRegistry register(String name, DriverFactory factory) {
        Preconditions.checkArgument(name != null && !name.isEmpty(), "Driver name is required");
        Preconditions.checkNotNull(factory, "factory");
        if (factories.containsKey(name)) {
            throw new DriverException("Driver already registered: " + name);
        }
        factories.put(name, factory);
        LOG.debug("Registered driver {}", name);
        return this;
    }

    public synchronized boolean isRegistered(String name) {
        return factories.containsKey(name);
    }

    public synchronized Set<String> getRegisteredDrivers() {
        return ImmutableSortedSet.copyOf(factories.keySet());
    }

    /**
     * @throws DriverException if no driver is registered under the name
     */
    public DataSource create(String name, DriverConfiguration configuration) {
        DriverFactory factory;
        synchronized (this) {
            factory = factories.get(name);
        }
        if (factory == null) {
            throw new DriverException("Driver not registered: " + name);
        }
        LOG.info("Creating {} data source", name);
        return factory.create(configuration);
    }

    /**
     * Creates a data source for the driver the configuration belongs to.
     */
    public DataSource create(DriverConfiguration configuration) {
        return create(configuration.getDriverName(), configuration);
    }
}
