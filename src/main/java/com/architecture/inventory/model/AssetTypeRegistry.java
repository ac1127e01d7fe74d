package com.architecture.inventory.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Catalog of known asset types, keyed by type name.
 *
 * Required-dependency patterns are compiled once here so the rules that match
 * them against dependency types never recompile.
 */
public class AssetTypeRegistry {

    private final Map<String, AssetType> types = new LinkedHashMap<>();
    private final Map<String, Pattern> dependencyPatterns = new LinkedHashMap<>();

    public AssetTypeRegistry(Collection<AssetType> assetTypes) {
        for (AssetType assetType : assetTypes) {
            types.put(assetType.getName(), assetType);
            for (String pattern : assetType.getRequiredDependencyPatterns()) {
                dependencyPatterns.computeIfAbsent(pattern, Pattern::compile);
            }
        }
    }

    public Optional<AssetType> find(String typeName) {
        if (typeName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(types.get(typeName));
    }

    public boolean contains(String typeName) {
        return typeName != null && types.containsKey(typeName);
    }

    public Set<String> typeNames() {
        return Collections.unmodifiableSet(types.keySet());
    }

    public Collection<AssetType> types() {
        return Collections.unmodifiableCollection(types.values());
    }

    public Set<String> idPrefixes() {
        Set<String> prefixes = new LinkedHashSet<>();
        for (AssetType type : types.values()) {
            if (type.getIdPrefix() != null) {
                prefixes.add(type.getIdPrefix());
            }
        }
        return prefixes;
    }

    /**
     * Compiled form of a registered required-dependency pattern.
     */
    public Pattern dependencyPattern(String regex) {
        return dependencyPatterns.computeIfAbsent(regex, Pattern::compile);
    }

    public int size() {
        return types.size();
    }
}
