package com.architecture.inventory.service.graph;

import com.architecture.inventory.exception.DuplicateIdentifierException;
import com.architecture.inventory.model.Asset;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the {@link DependencyGraph} of an asset list and rejects duplicate ids.
 */
@Service
@Slf4j
public class DependencyGraphBuilder {

    /**
     * Index assets by id and collect reverse dependency edges.
     *
     * Every duplicate is collected before failing so one run reports them all.
     * Defined assets also get their direct dependents attached.
     *
     * @throws DuplicateIdentifierException if any id occurs more than once
     */
    public DependencyGraph build(List<Asset> assets) {
        Map<String, Asset> lookup = new LinkedHashMap<>();
        Map<String, List<String>> dependents = new LinkedHashMap<>();
        List<DuplicateIdentifierException.Duplicate> duplicates = new ArrayList<>();

        for (Asset asset : assets) {
            String id = asset.getId();
            Asset first = lookup.get(id);
            if (first != null) {
                log.error("{} already seen, first used in {}, duplicated in {}",
                        id, sourceOf(first), sourceOf(asset));
                duplicates.add(new DuplicateIdentifierException.Duplicate(id, sourceOf(first), sourceOf(asset)));
            } else {
                lookup.put(id, asset);
            }
            for (String dependencyId : asset.dependencyIds()) {
                dependents.computeIfAbsent(dependencyId, k -> new ArrayList<>()).add(id);
            }
        }

        if (!duplicates.isEmpty()) {
            throw new DuplicateIdentifierException(duplicates);
        }

        attachDependents(assets, lookup);

        log.info("Built dependency graph: {} assets, {} referenced ids", lookup.size(), dependents.size());
        return new DependencyGraph(new ArrayList<>(assets), lookup, dependents);
    }

    private void attachDependents(List<Asset> assets, Map<String, Asset> lookup) {
        for (Asset asset : assets) {
            asset.setDependents(new ArrayList<>());
        }
        for (Asset asset : assets) {
            for (String dependencyId : asset.dependencyIds()) {
                Asset dependency = lookup.get(dependencyId);
                if (dependency != null) {
                    dependency.getDependents().add(asset.getId());
                }
            }
        }
    }

    private static String sourceOf(Asset asset) {
        return asset.getSource() != null ? asset.getSource().getPath() : "<unknown source>";
    }
}
