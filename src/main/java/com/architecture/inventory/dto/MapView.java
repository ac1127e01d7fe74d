package com.architecture.inventory.dto;

import com.architecture.inventory.model.Asset;
import com.architecture.inventory.model.LabelField;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A focused view of the inventory: the selection that produced it and the
 * assets it contains.
 */
@Value
@Builder
public class MapView {

    String name;            // Output base name, e.g. "index", "_unapplied", "_app_web"
    String description;     // e.g. "All assets", "Assets not leading to an asset of type application/.*"
    String labelPattern;
    LabelField field;
    boolean negated;
    List<Asset> assets;
}
