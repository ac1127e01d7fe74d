package com.architecture.inventory.service.graph;

import com.architecture.inventory.config.InventoryProperties;
import com.architecture.inventory.exception.TraversalLimitExceededException;
import com.architecture.inventory.model.Asset;
import com.architecture.inventory.model.LabelField;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Pushes each asset's label (type or id) onto everything it transitively
 * depends on, so every asset ends up knowing which labels lead to it.
 *
 * For an asset A the resulting set is {@code {label(A)} ∪ {label(X) : X depends on A transitively}}.
 */
@Service
@Slf4j
public class PropagationEngine {

    private final long maxTraversalVisits;

    public PropagationEngine(InventoryProperties properties) {
        this.maxTraversalVisits = properties.getLimits().getMaxTraversalVisits();
    }

    public void propagate(DependencyGraph graph, LabelField field) {
        propagate(graph.getAssets(), graph.getLookup(), field);
    }

    /**
     * Replace {@code field}'s label set on every asset with the propagated labels.
     *
     * Each root gets its own visited set, so cycles terminate but the total cost
     * is one traversal per root. The visit limit bounds each root's traversal.
     *
     * @throws TraversalLimitExceededException when a single root visits more nodes than the limit
     */
    public void propagate(List<Asset> assets, Map<String, Asset> lookup, LabelField field) {
        AssetIndex index = AssetIndex.of(assets, lookup);
        for (int i = 0; i < index.size(); i++) {
            field.labelsOf(index.get(i)).clear();
        }

        long totalVisits = 0;
        Deque<Integer> stack = new ArrayDeque<>();
        for (int root = 0; root < index.rootCount(); root++) {
            Asset rootAsset = index.get(root);
            String label = field.labelOf(rootAsset);
            if (label == null) {
                continue;
            }

            long visits = 0;
            boolean[] visited = new boolean[index.size()];
            visited[root] = true;
            stack.push(root);
            while (!stack.isEmpty()) {
                int node = stack.pop();
                field.labelsOf(index.get(node)).add(label);
                if (++visits > maxTraversalVisits) {
                    throw new TraversalLimitExceededException(
                            "Propagation of " + field + " from " + rootAsset.getId(), maxTraversalVisits);
                }
                for (int dependency : index.dependenciesOf(node)) {
                    if (!visited[dependency]) {
                        visited[dependency] = true;
                        stack.push(dependency);
                    }
                }
            }
            totalVisits += visits;
        }
        log.debug("Propagated {} labels over {} assets in {} visits", field, index.size(), totalVisits);
    }
}
