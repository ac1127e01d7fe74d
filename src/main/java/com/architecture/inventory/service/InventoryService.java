package com.architecture.inventory.service;

import com.architecture.inventory.config.InventoryProperties;
import com.architecture.inventory.dto.DependentsBreakdown;
import com.architecture.inventory.dto.InventorySnapshot;
import com.architecture.inventory.dto.MapView;
import com.architecture.inventory.dto.ValidationReport;
import com.architecture.inventory.model.Asset;
import com.architecture.inventory.model.LabelField;
import com.architecture.inventory.model.SourceFile;
import com.architecture.inventory.service.graph.DependencyGraph;
import com.architecture.inventory.service.graph.DependencyGraphBuilder;
import com.architecture.inventory.service.graph.DependentsAnalyzer;
import com.architecture.inventory.service.graph.PropagationEngine;
import com.architecture.inventory.service.graph.SubgraphSelector;
import com.architecture.inventory.service.graph.ViewPlanner;
import com.architecture.inventory.service.validation.RuleEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Runs the inventory pipeline: load, split off archived assets, build the
 * graph, validate, propagate dependent types and ids.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class InventoryService {

    private static final DateTimeFormatter UPDATED_FORMAT =
            DateTimeFormatter.ofPattern("EEE MMM d HH:mm:ss yyyy", Locale.ENGLISH);

    private final AssetLoader assetLoader;
    private final DependencyGraphBuilder graphBuilder;
    private final RuleEngine ruleEngine;
    private final PropagationEngine propagationEngine;
    private final SubgraphSelector subgraphSelector;
    private final ViewPlanner viewPlanner;
    private final DependentsAnalyzer dependentsAnalyzer;
    private final InventoryProperties properties;

    /**
     * Load the given asset files and analyze them.
     */
    public InventorySnapshot run(List<Path> assetFiles) {
        log.info("Starting inventory run over {} files", assetFiles.size());
        return analyze(assetLoader.loadAll(assetFiles));
    }

    /**
     * Analyze already-loaded assets.
     *
     * @throws com.architecture.inventory.exception.DuplicateIdentifierException before any validation
     *                                                                          when ids collide
     */
    public InventorySnapshot analyze(List<Asset> loaded) {
        List<Asset> archived = loaded.stream().filter(Asset::isArchived).collect(Collectors.toList());
        List<Asset> assets = loaded.stream().filter(asset -> !asset.isArchived()).collect(Collectors.toList());
        log.info("{} active assets, {} archived", assets.size(), archived.size());

        DependencyGraph graph = graphBuilder.build(assets);
        ValidationReport report = ruleEngine.validate(assets, graph);

        propagationEngine.propagate(graph, LabelField.TYPE);
        propagationEngine.propagate(graph, LabelField.ID);

        String generated = properties.getUpdated() != null
                ? properties.getUpdated()
                : LocalDateTime.now().format(UPDATED_FORMAT);

        return InventorySnapshot.builder()
                .title(title(loaded, generated))
                .generated(generated)
                .assets(assets)
                .archived(archived)
                .graph(graph)
                .report(report)
                .build();
    }

    /**
     * The standard views, after the optional leaf-type trim.
     */
    public List<MapView> views(InventorySnapshot snapshot) {
        List<Asset> assets = snapshot.getAssets();
        if (properties.getLeafType() != null && !properties.getLeafType().isBlank()) {
            assets = subgraphSelector.trimByLeafType(assets, properties.getLeafType(), properties.isLeafNegate());
        }
        return viewPlanner.plan(assets);
    }

    /**
     * Direct, intermediate and terminal dependents of every active asset.
     */
    public Map<String, DependentsBreakdown> dependents(InventorySnapshot snapshot) {
        Map<String, Asset> lookup = snapshot.getGraph().getLookup();
        Map<String, DependentsBreakdown> breakdowns = new LinkedHashMap<>();
        for (Asset asset : snapshot.getAssets()) {
            breakdowns.put(asset.getId(), dependentsAnalyzer.breakdown(asset, lookup));
        }
        return breakdowns;
    }

    private static String title(List<Asset> assets, String generated) {
        String general = assets.stream()
                .map(Asset::getSource)
                .filter(Objects::nonNull)
                .map(SourceFile::getTitle)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse("");
        return general + " updated " + generated;
    }
}
