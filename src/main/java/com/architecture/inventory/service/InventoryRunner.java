package com.architecture.inventory.service;

import com.architecture.inventory.config.InventoryProperties;
import com.architecture.inventory.dto.InventorySnapshot;
import com.architecture.inventory.dto.MapView;
import com.architecture.inventory.service.graph.DotTheme;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs the inventory over the configured asset files on application startup,
 * e.g. {@code --inventory.assets=assets/servers.yaml,assets/apps.yaml}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class InventoryRunner implements CommandLineRunner {

    private final InventoryService inventoryService;
    private final ReportWriter reportWriter;
    private final InventoryProperties properties;

    @Override
    public void run(String... args) throws Exception {
        if (properties.getAssets().isEmpty()) {
            log.info("No asset files configured (inventory.assets), nothing to do");
            return;
        }

        List<Path> assetFiles = properties.getAssets().stream()
                .map(Path::of)
                .collect(Collectors.toList());
        InventorySnapshot snapshot = inventoryService.run(assetFiles);
        List<MapView> views = inventoryService.views(snapshot);

        if (properties.isWriteOutputs()) {
            reportWriter.write(Path.of(properties.getOutput()), snapshot, views,
                    inventoryService.dependents(snapshot), DotTheme.fromName(properties.getTheme()));
        }
        log.info("Inventory '{}' done: {} assets, issues {}",
                snapshot.getTitle(), snapshot.getAssets().size(), snapshot.getReport().countsBySeverity());
    }
}
