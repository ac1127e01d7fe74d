package com.architecture.inventory.model;

import java.util.Set;
import java.util.function.Function;

/**
 * Which asset attribute is propagated as a label, and where the propagated
 * labels are stored.
 */
public enum LabelField {
    TYPE(Asset::getType, Asset::getDependentTypes),
    ID(Asset::getId, Asset::getDependentIds);

    private final Function<Asset, String> label;
    private final Function<Asset, Set<String>> target;

    LabelField(Function<Asset, String> label, Function<Asset, Set<String>> target) {
        this.label = label;
        this.target = target;
    }

    public String labelOf(Asset asset) {
        return label.apply(asset);
    }

    /**
     * The live label set of the asset (dependentTypes or dependentIds).
     */
    public Set<String> labelsOf(Asset asset) {
        return target.apply(asset);
    }
}
