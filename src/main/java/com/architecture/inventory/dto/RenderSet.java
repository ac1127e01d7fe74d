package com.architecture.inventory.dto;

import com.architecture.inventory.model.Asset;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A view's assets together with the placeholders standing in for the
 * dependencies it references but does not contain.
 */
@Value
public class RenderSet {

    List<Asset> assets;
    List<Asset> placeholders;
    Map<String, Asset> nodes;   // Every edge endpoint by id, placeholders included

    public List<Asset> all() {
        List<Asset> all = new ArrayList<>(assets);
        all.addAll(placeholders);
        return all;
    }

    public Asset node(String id) {
        return nodes.get(id);
    }
}
