package com.architecture.inventory.service.graph;

import com.architecture.inventory.dto.RenderSet;
import com.architecture.inventory.model.Asset;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gives every dependency id of a view a node, synthesizing a placeholder for
 * ids the view does not contain.
 */
@Service
@Slf4j
public class PlaceholderResolver {

    private static final String NODE_ID_PREFIX = "n";

    /**
     * Assign node ids {@code n0..n(k-1)} to the subset in order, then one
     * placeholder per unique missing dependency id, numbered on from {@code nk}
     * in order of first reference.
     */
    public RenderSet resolve(List<Asset> subset) {
        Map<String, Asset> nodes = new LinkedHashMap<>();
        for (int i = 0; i < subset.size(); i++) {
            Asset asset = subset.get(i);
            asset.setNodeId(NODE_ID_PREFIX + i);
            nodes.putIfAbsent(asset.getId(), asset);
        }

        List<Asset> placeholders = new ArrayList<>();
        int nextNode = subset.size();
        for (Asset asset : subset) {
            for (String dependencyId : asset.edgeDependencyIds()) {
                if (!nodes.containsKey(dependencyId)) {
                    Asset placeholder = Asset.placeholder(dependencyId, NODE_ID_PREFIX + nextNode++);
                    nodes.put(dependencyId, placeholder);
                    placeholders.add(placeholder);
                }
            }
        }

        if (!placeholders.isEmpty()) {
            log.debug("Added {} placeholders for missing dependencies", placeholders.size());
        }
        return new RenderSet(Collections.unmodifiableList(new ArrayList<>(subset)),
                Collections.unmodifiableList(placeholders),
                Collections.unmodifiableMap(nodes));
    }
}
