package com.assetdna.tracker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Registry settings bound from the {@code assetdna.*} namespace.
 */
@Data
@ConfigurationProperties(prefix = "assetdna")
public class AssetDnaProperties {

    private String urnPrefix = "urn:assetdna";

    // Stamped on imported assets that do not name their source system
    private String defaultExternalSystem = "OTOBO";

    private Reports reports = new Reports();

    private Mongo mongo = new Mongo();

    @Data
    public static class Reports {
        private int defaultWindowMonths = 6;
        private int maxWindowMonths = 120;
        private boolean includeUnchangedByDefault = false;
    }

    @Data
    public static class Mongo {
        // Requires a replica set
        private boolean transactionsEnabled = false;
    }
}
