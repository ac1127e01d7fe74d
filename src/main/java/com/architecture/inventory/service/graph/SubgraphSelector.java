package com.architecture.inventory.service.graph;

import com.architecture.inventory.config.InventoryProperties;
import com.architecture.inventory.exception.TraversalLimitExceededException;
import com.architecture.inventory.model.Asset;
import com.architecture.inventory.model.LabelField;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Carves focused views out of an annotated asset list using the propagated
 * label sets. Results keep the input order.
 */
@Service
@Slf4j
public class SubgraphSelector {

    private final int maxFixpointPasses;

    public SubgraphSelector(InventoryProperties properties) {
        this.maxFixpointPasses = properties.getLimits().getMaxFixpointPasses();
    }

    /**
     * Assets with a propagated label fully matching {@code labelPattern}.
     *
     * In negated mode the complement is taken and then closed over dependency
     * edges, so no selected asset references one that was left out.
     */
    public List<Asset> select(List<Asset> assets, String labelPattern, LabelField field, boolean negate) {
        Pattern pattern = Pattern.compile("^(?:" + labelPattern + ")$");
        List<Asset> matching = assets.stream()
                .filter(asset -> field.labelsOf(asset).stream().anyMatch(label -> pattern.matcher(label).find()))
                .collect(Collectors.toList());
        if (!negate) {
            log.debug("Selected {} of {} assets leading to {}", matching.size(), assets.size(), labelPattern);
            return matching;
        }

        Set<Asset> leading = new HashSet<>(matching);
        Set<String> selectedIds = new LinkedHashSet<>();
        for (Asset asset : assets) {
            if (!leading.contains(asset)) {
                selectedIds.add(asset.getId());
            }
        }
        closeOverDependencies(assets, selectedIds);

        List<Asset> selected = assets.stream()
                .filter(asset -> selectedIds.contains(asset.getId()))
                .collect(Collectors.toList());
        log.debug("Selected {} of {} assets not leading to {}", selected.size(), assets.size(), labelPattern);
        return selected;
    }

    /**
     * Keep (or with {@code negate}, drop) assets with a dependent type found by
     * the pattern. A plain filter, no closure.
     */
    public List<Asset> trimByLeafType(List<Asset> assets, String leafTypePattern, boolean negate) {
        Pattern pattern = Pattern.compile(leafTypePattern);
        List<Asset> trimmed = assets.stream()
                .filter(asset -> negate != asset.getDependentTypes().stream()
                        .anyMatch(type -> pattern.matcher(type).find()))
                .collect(Collectors.toList());
        log.info("Showing {} of {} assets", trimmed.size(), assets.size());
        return trimmed;
    }

    private void closeOverDependencies(List<Asset> assets, Set<String> selectedIds) {
        Map<String, Asset> lookup = new LinkedHashMap<>();
        for (Asset asset : assets) {
            lookup.putIfAbsent(asset.getId(), asset);
        }

        int passes = 0;
        boolean added = true;
        while (added) {
            if (++passes > maxFixpointPasses) {
                throw new TraversalLimitExceededException("Dependency closure", maxFixpointPasses);
            }
            added = false;
            for (String id : new ArrayList<>(selectedIds)) {
                for (String dependencyId : lookup.get(id).edgeDependencyIds()) {
                    if (lookup.containsKey(dependencyId) && selectedIds.add(dependencyId)) {
                        added = true;
                    }
                }
            }
        }
        log.debug("Dependency closure settled after {} passes", passes);
    }
}
