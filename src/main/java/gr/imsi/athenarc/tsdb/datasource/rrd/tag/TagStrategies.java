package gr.imsi.athenarc.tsdb.datasource.rrd.tag;

import gr.imsi.athenarc.tsdb.config.RrdConfiguration;
import gr.imsi.athenarc.tsdb.exception.ConfigurationException;

import java.util.Locale;

/**
 * Picks the strategy named by {@code rrdtool.tag_strategy}.
 */
public final class TagStrategies {

    private TagStrategies() {
    }

    public static TagStrategy forConfiguration(RrdConfiguration configuration) {
        String name = configuration.getTagStrategy() == null
            ? FileNameTagStrategy.NAME : configuration.getTagStrategy().trim().toLowerCase(Locale.ROOT);
        switch (name) {
            case FileNameTagStrategy.NAME:
                return new FileNameTagStrategy(configuration.getDir());
            case FolderTagStrategy.NAME:
                return new FolderTagStrategy(configuration.getDir(), configuration.getFolderTags());
            case NoTagsStrategy.NAME:
            case "notags":
                return new NoTagsStrategy(configuration.getDir());
            default:
                throw new ConfigurationException("Unknown RRD tag strategy: " + configuration.getTagStrategy());
        }
    }
}
