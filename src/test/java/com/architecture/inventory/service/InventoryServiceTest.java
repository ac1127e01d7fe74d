package com.architecture.inventory.service;

import com.architecture.inventory.config.InventoryProperties;
import com.architecture.inventory.dto.DependentsBreakdown;
import com.architecture.inventory.dto.InventorySnapshot;
import com.architecture.inventory.dto.MapView;
import com.architecture.inventory.exception.DuplicateIdentifierException;
import com.architecture.inventory.model.Asset;
import com.architecture.inventory.model.AssetTypeRegistry;
import com.architecture.inventory.service.graph.DependencyGraphBuilder;
import com.architecture.inventory.service.graph.DependentsAnalyzer;
import com.architecture.inventory.service.graph.PropagationEngine;
import com.architecture.inventory.service.graph.SubgraphSelector;
import com.architecture.inventory.service.graph.ViewPlanner;
import com.architecture.inventory.service.validation.RuleEngine;
import com.architecture.inventory.service.validation.StandardRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.architecture.inventory.TestInventory.asset;
import static com.architecture.inventory.TestInventory.itRegistry;
import static com.architecture.inventory.TestInventory.properties;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InventoryServiceTest {

    private static final String UPDATED = "Mon Jan 1 09:00:00 2024";

    @Mock
    private AssetLoader assetLoader;

    private InventoryProperties properties;
    private RuleEngine ruleEngine;
    private InventoryService inventoryService;

    @BeforeEach
    void setUp() {
        AssetTypeRegistry registry = itRegistry();
        properties = properties();
        properties.setUpdated(UPDATED);
        ruleEngine = spy(new RuleEngine(new StandardRules(registry).ruleSet(), registry));
        SubgraphSelector selector = new SubgraphSelector(properties);
        inventoryService = new InventoryService(
                assetLoader,
                new DependencyGraphBuilder(),
                ruleEngine,
                new PropagationEngine(properties),
                selector,
                new ViewPlanner(selector, registry),
                new DependentsAnalyzer(),
                properties);
    }

    private static List<Asset> inventory() {
        Asset server = asset("srv_1", "physical/server");
        server.getSource().setTitle("Lab inventory");
        Asset service = asset("psvc_1", "physical/server/service", "srv_1");
        Asset app = asset("app_1", "application/external", "psvc_1");
        app.setLocation("https://wiki.example.org");
        app.setOwner("docs team");
        Asset drive = asset("drv_1", "drive", "srv_1");
        Asset retired = asset("srv_0", "physical/server");
        retired.getTags().add(Asset.TAG_ARCHIVED);
        return new ArrayList<>(List.of(server, service, app, drive, retired));
    }

    @Test
    void runLoadsConfiguredFilesAndAnnotatesActiveAssets() {
        List<Path> files = List.of(Path.of("servers.yaml"), Path.of("apps.yaml"));
        when(assetLoader.loadAll(files)).thenReturn(inventory());

        InventorySnapshot snapshot = inventoryService.run(files);

        verify(assetLoader).loadAll(files);
        assertThat(snapshot.getTitle()).isEqualTo("Lab inventory updated " + UPDATED);
        assertThat(snapshot.getGenerated()).isEqualTo(UPDATED);
        assertThat(snapshot.getAssets()).extracting(Asset::getId).containsExactly("srv_1", "psvc_1", "app_1", "drv_1");
        assertThat(snapshot.getArchived()).extracting(Asset::getId).containsExactly("srv_0");

        Asset server = snapshot.getGraph().get("srv_1");
        assertThat(server.getDependents()).containsExactly("psvc_1", "drv_1");
        assertThat(server.getDependentTypes()).contains("application/external", "drive");
        assertThat(server.getDependentIds()).containsExactlyInAnyOrder("srv_1", "psvc_1", "app_1", "drv_1");
    }

    @Test
    void archivedAssetsAreNeitherValidatedNorGraphed() {
        InventorySnapshot snapshot = inventoryService.analyze(inventory());

        assertThat(snapshot.getReport().hasIssues("srv_0")).isFalse();
        assertThat(snapshot.getGraph().contains("srv_0")).isFalse();
        assertThat(snapshot.getReport().issuesFor("drv_1")).isNotEmpty();
    }

    @Test
    void duplicateIdsStopTheRunBeforeValidation() {
        List<Asset> assets = inventory();
        assets.add(asset("srv_1", "physical/server"));

        assertThatThrownBy(() -> inventoryService.analyze(assets))
                .isInstanceOf(DuplicateIdentifierException.class)
                .hasMessageContaining("srv_1");
        verifyNoInteractions(ruleEngine);
    }

    @Test
    void titleWithoutGeneralSectionStillCarriesTheUpdate() {
        InventorySnapshot snapshot = inventoryService.analyze(List.of(asset("srv_1", "physical/server")));

        assertThat(snapshot.getTitle()).isEqualTo(" updated " + UPDATED);
    }

    @Test
    void viewsCoverTheWholeInventoryByDefault() {
        InventorySnapshot snapshot = inventoryService.analyze(inventory());

        List<MapView> views = inventoryService.views(snapshot);

        assertThat(views.get(0).getAssets()).hasSize(4);
        assertThat(views).extracting(MapView::getName).contains("_app_1").doesNotContain("_srv_0");
    }

    @Test
    void leafTypeTrimsViewsToAssetsLeadingToIt() {
        properties.setLeafType("application");
        InventorySnapshot snapshot = inventoryService.analyze(inventory());

        List<MapView> views = inventoryService.views(snapshot);

        assertThat(views.get(0).getAssets()).extracting(Asset::getId).containsExactly("srv_1", "psvc_1", "app_1");
    }

    @Test
    void negatedLeafTypeKeepsTheRest() {
        properties.setLeafType("application");
        properties.setLeafNegate(true);
        InventorySnapshot snapshot = inventoryService.analyze(inventory());

        List<MapView> views = inventoryService.views(snapshot);

        assertThat(views.get(0).getAssets()).extracting(Asset::getId).containsExactly("drv_1");
    }

    @Test
    void dependentsAreBrokenDownForEveryActiveAsset() {
        InventorySnapshot snapshot = inventoryService.analyze(inventory());

        Map<String, DependentsBreakdown> dependents = inventoryService.dependents(snapshot);

        assertThat(dependents).containsOnlyKeys("srv_1", "psvc_1", "app_1", "drv_1");
        assertThat(dependents.get("srv_1").getDirect()).containsExactly("drv_1", "psvc_1");
        assertThat(dependents.get("srv_1").getIntermediate()).isEmpty();
        assertThat(dependents.get("srv_1").getTerminal()).containsExactly("app_1", "drv_1");
    }
}
