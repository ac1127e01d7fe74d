package com.architecture.inventory.service;

import com.architecture.inventory.exception.InventoryLoadException;
import com.architecture.inventory.model.AssetType;
import com.architecture.inventory.model.AssetTypeRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.regex.PatternSyntaxException;

/**
 * Loads an {@link AssetTypeRegistry} from a YAML catalog.
 *
 * Expected shape:
 * <pre>
 * asset_types:
 *   physical/server:
 *     description: A real physical server
 *     style: "shape=box, width=1"
 *     color: gray
 *     tags: [bottom]
 *     required_fields: []
 *     required_dependencies: []
 *     prefix: srv
 * </pre>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AssetTypeRegistryLoader {

    private final ResourceLoader resourceLoader;

    /**
     * Load a catalog from a Spring resource location, e.g.
     * {@code classpath:asset-types/it-assets.yaml} or {@code file:/etc/types.yaml}.
     */
    public AssetTypeRegistry load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new InventoryLoadException("Type registry not found: " + location);
        }

        Object document;
        try (InputStream in = resource.getInputStream()) {
            document = new Yaml().load(in);
        } catch (IOException | YAMLException e) {
            throw new InventoryLoadException("Failed reading type registry " + location + ": " + e.getMessage(), e);
        }
        if (!(document instanceof Map) || !(((Map<?, ?>) document).get("asset_types") instanceof Map)) {
            throw new InventoryLoadException("Type registry " + location + " has no 'asset_types' mapping");
        }

        Map<?, ?> definitions = (Map<?, ?>) ((Map<?, ?>) document).get("asset_types");
        List<AssetType> types = new ArrayList<>();
        for (Map.Entry<?, ?> entry : definitions.entrySet()) {
            String name = String.valueOf(entry.getKey());
            if (!(entry.getValue() instanceof Map)) {
                throw new InventoryLoadException("Type '" + name + "' in " + location + " is not a mapping");
            }
            types.add(toAssetType(name, (Map<?, ?>) entry.getValue()));
        }

        try {
            AssetTypeRegistry registry = new AssetTypeRegistry(types);
            log.info("Loaded {} asset types from {}", registry.size(), location);
            return registry;
        } catch (PatternSyntaxException e) {
            throw new InventoryLoadException("Invalid dependency pattern in " + location + ": " + e.getMessage(), e);
        }
    }

    private AssetType toAssetType(String name, Map<?, ?> definition) {
        return AssetType.builder()
                .name(name)
                .description(scalar(definition.get("description")))
                .style(scalar(definition.get("style")))
                .color(scalar(definition.get("color")))
                .tags(new LinkedHashSet<>(stringList(definition.get("tags"))))
                .requiredFields(stringList(definition.get("required_fields")))
                .requiredDependencyPatterns(stringList(definition.get("required_dependencies")))
                .idPrefix(scalar(definition.get("prefix")))
                .build();
    }

    private static String scalar(Object value) {
        return value != null ? String.valueOf(value) : null;
    }

    private static List<String> stringList(Object value) {
        List<String> values = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                values.add(String.valueOf(item));
            }
        } else if (value != null) {
            values.add(String.valueOf(value));
        }
        return List.copyOf(values);
    }
}
