package com.architecture.inventory.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * JSON summary of an inventory run, written as {@code report.json}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventoryReport {

    private String title;
    private String generated;
    private int assetCount;
    private List<String> archived;              // Ids of archived assets
    private Map<String, Long> issueCounts;      // Severity name -> count, sorted by name
    private List<AssetEntry> assets;
    private List<ViewEntry> views;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AssetEntry {
        private String id;
        private String type;
        private String name;
        private String definedIn;
        private List<Issue> issues;
        private DependentsBreakdown dependents;
        private List<String> dependentTypes;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ViewEntry {
        private String name;
        private String description;
        private List<String> assetIds;
        private List<String> missingIds;        // Dependencies drawn as placeholders
    }
}
