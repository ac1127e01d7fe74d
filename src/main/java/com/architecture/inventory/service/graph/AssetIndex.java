package com.architecture.inventory.service.graph;

import com.architecture.inventory.model.Asset;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assets addressed by stable integer index, with forward dependency edges as
 * index arrays. Undefined and excluded dependency ids have no edge.
 */
final class AssetIndex {

    private final List<Asset> nodes;
    private final int[][] dependencies;
    private final int rootCount;

    private AssetIndex(List<Asset> nodes, int[][] dependencies, int rootCount) {
        this.nodes = nodes;
        this.dependencies = dependencies;
        this.rootCount = rootCount;
    }

    /**
     * Index the given assets first, in order, then any asset only reachable
     * through the lookup.
     */
    static AssetIndex of(List<Asset> assets, Map<String, Asset> lookup) {
        Map<Asset, Integer> positions = new IdentityHashMap<>();
        List<Asset> nodes = new ArrayList<>();
        for (Asset asset : assets) {
            if (!positions.containsKey(asset)) {
                positions.put(asset, nodes.size());
                nodes.add(asset);
            }
        }
        int rootCount = nodes.size();
        for (Asset asset : lookup.values()) {
            if (!positions.containsKey(asset)) {
                positions.put(asset, nodes.size());
                nodes.add(asset);
            }
        }

        int[][] dependencies = new int[nodes.size()][];
        for (int i = 0; i < nodes.size(); i++) {
            List<Integer> targets = new ArrayList<>();
            for (String dependencyId : nodes.get(i).edgeDependencyIds()) {
                Asset dependency = lookup.get(dependencyId);
                if (dependency != null) {
                    targets.add(positions.get(dependency));
                }
            }
            dependencies[i] = targets.stream().mapToInt(Integer::intValue).toArray();
        }
        return new AssetIndex(nodes, dependencies, rootCount);
    }

    /**
     * Number of indexed assets that came from the asset list, i.e. indices
     * {@code 0..rootCount-1}.
     */
    int rootCount() {
        return rootCount;
    }

    int size() {
        return nodes.size();
    }

    Asset get(int index) {
        return nodes.get(index);
    }

    int[] dependenciesOf(int index) {
        return dependencies[index];
    }
}
