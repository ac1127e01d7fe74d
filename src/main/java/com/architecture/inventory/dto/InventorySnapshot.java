package com.architecture.inventory.dto;

import com.architecture.inventory.model.Asset;
import com.architecture.inventory.service.graph.DependencyGraph;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of one inventory run: annotated active assets, the archived ones
 * kept aside, the graph and the validation report.
 */
@Value
@Builder
public class InventorySnapshot {

    String title;
    String generated;           // The "updated" part of the title
    List<Asset> assets;         // Active assets, annotated
    List<Asset> archived;       // Tagged "archived", never validated or graphed
    DependencyGraph graph;
    ValidationReport report;
}
