package com.architecture.inventory.service.graph;

import com.architecture.inventory.dto.DependentsBreakdown;
import com.architecture.inventory.model.Asset;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Breaks an asset's dependents down into direct, intermediate and terminal
 * ones by walking the direct-dependents lists breadth first.
 */
@Service
public class DependentsAnalyzer {

    public DependentsBreakdown breakdown(Asset asset, Map<String, Asset> lookup) {
        Set<String> all = new LinkedHashSet<>();
        Set<String> terminal = new LinkedHashSet<>();
        Set<String> queued = new HashSet<>(asset.getDependents());
        Deque<String> toCheck = new ArrayDeque<>(asset.getDependents());

        while (!toCheck.isEmpty()) {
            String id = toCheck.poll();
            all.add(id);
            Asset dependent = lookup.get(id);
            if (dependent == null) {
                continue;
            }
            if (dependent.getDependents().isEmpty()) {
                terminal.add(id);
            }
            for (String next : dependent.getDependents()) {
                if (queued.add(next)) {
                    toCheck.add(next);
                }
            }
        }

        Set<String> direct = new LinkedHashSet<>(asset.getDependents());
        List<String> intermediate = all.stream()
                .filter(id -> !direct.contains(id) && !terminal.contains(id))
                .collect(Collectors.toList());

        return DependentsBreakdown.builder()
                .direct(sorted(direct, lookup))
                .intermediate(sorted(intermediate, lookup))
                .terminal(sorted(terminal, lookup))
                .build();
    }

    /**
     * Ids present in the lookup, sorted by "type:name" as they are listed in reports.
     */
    private static List<String> sorted(Iterable<String> ids, Map<String, Asset> lookup) {
        Set<String> present = new LinkedHashSet<>();
        for (String id : ids) {
            if (lookup.containsKey(id)) {
                present.add(id);
            }
        }
        return present.stream()
                .sorted(Comparator.comparing((String id) -> displayKey(lookup.get(id)))
                        .thenComparing(Comparator.naturalOrder()))
                .collect(Collectors.toList());
    }

    private static String displayKey(Asset asset) {
        return asset.getType() + ":" + asset.getName();
    }
}
