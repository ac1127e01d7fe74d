package com.architecture.inventory.service;

import com.architecture.inventory.exception.InventoryLoadException;
import com.architecture.inventory.model.Asset;
import com.architecture.inventory.model.SourceFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads asset YAML files: an optional {@code general} section and an
 * {@code assets} list of records.
 */
@Service
@Slf4j
public class AssetLoader {

    /**
     * Load every file in order, concatenating their assets.
     */
    public List<Asset> loadAll(List<Path> assetFiles) {
        List<Asset> assets = new ArrayList<>();
        for (Path assetFile : assetFiles) {
            assets.addAll(load(assetFile));
        }
        log.info("Loaded {} assets from {} files", assets.size(), assetFiles.size());
        return assets;
    }

    /**
     * Load one asset file. An empty file yields no assets.
     */
    public List<Asset> load(Path assetFile) {
        Path absolute = assetFile.toAbsolutePath();
        Object document;
        try (InputStream in = Files.newInputStream(absolute)) {
            document = new Yaml().load(in);
        } catch (IOException | YAMLException e) {
            log.error("Failed reading {}", absolute);
            throw new InventoryLoadException("Failed reading " + absolute + ": " + e.getMessage(), e);
        }
        if (document == null) {
            return List.of();
        }
        if (!(document instanceof Map)) {
            throw new InventoryLoadException("Expected a mapping at the top of " + absolute);
        }

        Map<?, ?> fileData = (Map<?, ?>) document;
        SourceFile source = SourceFile.builder()
                .path(absolute.toString())
                .title(generalTitle(fileData))
                .build();

        Object records = fileData.get("assets");
        if (records == null) {
            return List.of();
        }
        if (!(records instanceof List)) {
            throw new InventoryLoadException("'assets' must be a list in " + absolute);
        }

        List<Asset> assets = new ArrayList<>();
        int position = 0;
        for (Object record : (List<?>) records) {
            if (!(record instanceof Map)) {
                throw new InventoryLoadException("Asset #" + position + " in " + absolute + " is not a mapping");
            }
            assets.add(toAsset((Map<?, ?>) record, source, position));
            position++;
        }
        log.debug("Read {} assets from {}", assets.size(), absolute);
        return assets;
    }

    private Asset toAsset(Map<?, ?> record, SourceFile source, int position) {
        Object id = record.get("id");
        if (id == null) {
            throw new InventoryLoadException("Asset #" + position + " in " + source.getPath() + " has no id");
        }

        Asset asset = Asset.builder().source(source).build();
        for (Map.Entry<?, ?> entry : record.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            switch (key) {
                case "id":
                    asset.setId(scalar(value));
                    break;
                case "type":
                    asset.setType(scalar(value));
                    break;
                case "name":
                    asset.setName(scalar(value));
                    break;
                case "location":
                    asset.setLocation(scalar(value));
                    break;
                case "owner":
                    asset.setOwner(scalar(value));
                    break;
                case "size":
                    asset.setSize(scalar(value));
                    break;
                case "depends_on":
                    asset.setDependsOn(stringList(value));
                    break;
                case "tags":
                    asset.setTags(stringList(value));
                    break;
                case "open_issues":
                    asset.setOpenIssues(stringList(value));
                    break;
                case "closed_issues":
                    asset.setClosedIssues(stringList(value));
                    break;
                case "notes":
                    asset.setNotes(stringList(value));
                    break;
                case "links":
                    asset.setLinks(stringList(value));
                    break;
                default:
                    asset.getExtraAttributes().put(key, value);
            }
        }
        return asset;
    }

    private static String generalTitle(Map<?, ?> fileData) {
        Object general = fileData.get("general");
        if (general instanceof Map) {
            Object title = ((Map<?, ?>) general).get("title");
            return title != null ? String.valueOf(title) : null;
        }
        return null;
    }

    private static String scalar(Object value) {
        return value != null ? String.valueOf(value) : null;
    }

    /**
     * A YAML list of scalars; a single scalar becomes a one-element list.
     */
    private static List<String> stringList(Object value) {
        List<String> values = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                if (item != null) {
                    values.add(String.valueOf(item));
                }
            }
        } else if (value != null) {
            values.add(String.valueOf(value));
        }
        return values;
    }
}
