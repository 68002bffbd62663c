package gr.imsi.athenarc.tsdb.config;

import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.tsdb.exception.ConfigurationException;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Fans writes out to several backends and reads from one of them. Without an
 * explicit read backend the first write backend answers queries.
 */
public class AggregateConfiguration implements DriverConfiguration {

    public static final String DRIVER_NAME = "aggregate";

    private final List<DriverConfiguration> writeConfigurations;
    @Nullable
    private final DriverConfiguration readConfiguration;

    private AggregateConfiguration(Builder builder) {
        this.writeConfigurations = ImmutableList.copyOf(builder.writeConfigurations);
        this.readConfiguration = builder.readConfiguration;
    }

    @Override
    public String getDriverName() {
        return DRIVER_NAME;
    }

    public List<DriverConfiguration> getWriteConfigurations() {
        return writeConfigurations;
    }

    @Nullable
    public DriverConfiguration getReadConfiguration() {
        return readConfiguration;
    }

    public static class Builder {
        private final List<DriverConfiguration> writeConfigurations = new ArrayList<>();
        private DriverConfiguration readConfiguration;

        public Builder write(DriverConfiguration configuration) {
            this.writeConfigurations.add(configuration);
            return this;
        }

        public Builder read(DriverConfiguration configuration) {
            this.readConfiguration = configuration;
            return this;
        }

        public AggregateConfiguration build() {
            if (writeConfigurations.isEmpty()) {
                throw new ConfigurationException("Aggregate driver needs at least one write database");
            }
            for (DriverConfiguration configuration : writeConfigurations) {
                checkNotNested(configuration);
            }
            if (readConfiguration != null) {
                checkNotNested(readConfiguration);
            }
            return new AggregateConfiguration(this);
        }

        private static void checkNotNested(DriverConfiguration configuration) {
            if (configuration == null) {
                throw new ConfigurationException("Aggregate driver got a null database configuration");
            }
            if (configuration instanceof AggregateConfiguration) {
                throw new ConfigurationException("Aggregate drivers cannot be nested");
            }
        }
    }
}
