package com.architecture.inventory.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Registry definition of an asset type.
 */
@Value
@Builder
public class AssetType {

    public static final String TAG_TOP = "top";
    public static final String TAG_BOTTOM = "bottom";

    String name;                              // Registry key, e.g. "physical/server/service"
    String description;
    String style;                             // DOT node attributes, e.g. "shape=box, width=1"
    String color;
    @Builder.Default
    Set<String> tags = Set.of();              // "top" and/or "bottom"
    @Builder.Default
    List<String> requiredFields = List.of();
    @Builder.Default
    List<String> requiredDependencyPatterns = List.of();  // Regexes searched in dependency types
    String idPrefix;

    public boolean isTop() {
        return tags.contains(TAG_TOP);
    }

    public boolean isBottom() {
        return tags.contains(TAG_BOTTOM);
    }
}
