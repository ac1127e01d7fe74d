package com.architecture.inventory.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings for one inventory run, bound from the {@code inventory.*} properties.
 */
@Data
@ConfigurationProperties(prefix = "inventory")
public class InventoryProperties {

    private List<String> assets = new ArrayList<>();   // Asset YAML files to read
    private String typeRegistry = "classpath:asset-types/it-assets.yaml";
    private String output = "asset_inventory";
    private String theme = "light";                    // light or dark
    private String leafType;                           // Trim to assets leading to this type (regex search)
    private boolean leafNegate;                        // Trim to assets not leading to leafType
    private String updated;                            // Fixed "updated" text, mostly for testing
    private boolean writeOutputs = true;
    private Limits limits = new Limits();

    @Data
    public static class Limits {
        private long maxTraversalVisits = 10_000_000L;  // Total node visits per propagation pass
        private int maxFixpointPasses = 10_000;         // Passes of a negated selection closure
    }
}
