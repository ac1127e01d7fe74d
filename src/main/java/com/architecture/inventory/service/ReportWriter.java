package com.architecture.inventory.service;

import com.architecture.inventory.dto.DependentsBreakdown;
import com.architecture.inventory.dto.InventoryReport;
import com.architecture.inventory.dto.InventorySnapshot;
import com.architecture.inventory.dto.MapView;
import com.architecture.inventory.dto.RenderSet;
import com.architecture.inventory.model.Asset;
import com.architecture.inventory.service.graph.DotGraphWriter;
import com.architecture.inventory.service.graph.DotTheme;
import com.architecture.inventory.service.graph.PlaceholderResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes the outputs of a run: {@code report.json} and one {@code <view>.dot}
 * per view.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReportWriter {

    static final String REPORT_FILE = "report.json";

    private final PlaceholderResolver placeholderResolver;
    private final DotGraphWriter dotGraphWriter;
    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public InventoryReport write(Path outputDir, InventorySnapshot snapshot, List<MapView> views,
                                 Map<String, DependentsBreakdown> dependents, DotTheme theme) {
        try {
            Files.createDirectories(outputDir);
            List<InventoryReport.ViewEntry> viewEntries = new ArrayList<>();
            for (MapView view : views) {
                RenderSet resolved = placeholderResolver.resolve(view.getAssets());
                String dot = dotGraphWriter.write(resolved, snapshot.getReport(), snapshot.getTitle(), theme);
                Files.writeString(outputDir.resolve(view.getName() + ".dot"), dot, StandardCharsets.UTF_8);
                viewEntries.add(InventoryReport.ViewEntry.builder()
                        .name(view.getName())
                        .description(view.getDescription())
                        .assetIds(ids(resolved.getAssets()))
                        .missingIds(ids(resolved.getPlaceholders()))
                        .build());
            }

            InventoryReport report = buildReport(snapshot, viewEntries, dependents);
            objectMapper.writeValue(outputDir.resolve(REPORT_FILE).toFile(), report);
            log.info("Wrote {} and {} maps to {}", REPORT_FILE, views.size(), outputDir.toAbsolutePath());
            return report;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed writing inventory outputs to " + outputDir, e);
        }
    }

    InventoryReport buildReport(InventorySnapshot snapshot, List<InventoryReport.ViewEntry> views,
                                Map<String, DependentsBreakdown> dependents) {
        List<InventoryReport.AssetEntry> assets = snapshot.getAssets().stream()
                .map(asset -> InventoryReport.AssetEntry.builder()
                        .id(asset.getId())
                        .type(asset.getType())
                        .name(asset.getName())
                        .definedIn(asset.getSource() != null ? asset.getSource().getPath() : null)
                        .issues(snapshot.getReport().issuesFor(asset.getId()))
                        .dependents(dependents.get(asset.getId()))
                        .dependentTypes(new ArrayList<>(asset.getDependentTypes()))
                        .build())
                .collect(Collectors.toList());

        return InventoryReport.builder()
                .title(snapshot.getTitle())
                .generated(snapshot.getGenerated())
                .assetCount(snapshot.getAssets().size())
                .archived(ids(snapshot.getArchived()))
                .issueCounts(snapshot.getReport().countsBySeverity())
                .assets(assets)
                .views(views)
                .build();
    }

    private static List<String> ids(List<Asset> assets) {
        return assets.stream().map(Asset::getId).collect(Collectors.toList());
    }
}
