package gr.imsi.athenarc.tsdb.datasource;

import gr.imsi.athenarc.tsdb.config.NullConfiguration;
import gr.imsi.athenarc.tsdb.exception.DriverException;

import com.google.common.collect.ImmutableSet;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DriverRegistryTest {

    @Test
    void createsThroughRegisteredFactory() {
        AtomicInteger calls = new AtomicInteger();
        DriverRegistry registry = new DriverRegistry().register("stub", config -> {
            calls.incrementAndGet();
            return DataSourceFactory.createNullDataSource();
        });

        assertTrue(registry.isRegistered("stub"));
        assertNotNull(registry.create("stub", new NullConfiguration()));
        assertEquals(1, calls.get());
    }

    @Test
    void duplicateNameIsRejected() {
        DriverRegistry registry = new DriverRegistry().register("stub", config -> null);
        DriverException e = assertThrows(DriverException.class, () -> registry.register("stub", config -> null));
        assertEquals("Driver already registered: stub", e.getMessage());
    }

    @Test
    void unknownNameIsRejected() {
        DriverException e = assertThrows(DriverException.class,
            () -> new DriverRegistry().create("cassandra", new NullConfiguration()));
        assertEquals("Driver not registered: cassandra", e.getMessage());
    }

    @Test
    void emptyNameIsInvalid() {
        assertThrows(IllegalArgumentException.class, () -> new DriverRegistry().register("", config -> null));
    }

    @Test
    void defaultRegistryListsBundledDrivers() {
        assertEquals(ImmutableSet.of("aggregate", "graphite", "influxdb2", "null", "prometheus", "rrdtool"),
            DataSourceFactory.defaultRegistry().getRegisteredDrivers());
    }
}
