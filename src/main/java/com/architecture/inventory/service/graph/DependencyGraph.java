package com.architecture.inventory.service.graph;

import com.architecture.inventory.model.Asset;
import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The id lookup and reverse edges of one inventory snapshot.
 *
 * {@code dependents} is keyed by every referenced id, including ids that no
 * asset defines.
 */
@Getter
public class DependencyGraph {

    private final List<Asset> assets;
    private final Map<String, Asset> lookup;
    private final Map<String, List<String>> dependents;

    public DependencyGraph(List<Asset> assets, Map<String, Asset> lookup, Map<String, List<String>> dependents) {
        this.assets = Collections.unmodifiableList(assets);
        this.lookup = Collections.unmodifiableMap(lookup);
        this.dependents = Collections.unmodifiableMap(dependents);
    }

    public Asset get(String id) {
        return lookup.get(id);
    }

    public boolean contains(String id) {
        return lookup.containsKey(id);
    }

    public List<String> dependentsOf(String id) {
        return dependents.getOrDefault(id, List.of());
    }
}
