package com.architecture.inventory.service.graph;

import com.architecture.inventory.dto.MapView;
import com.architecture.inventory.model.Asset;
import com.architecture.inventory.model.AssetTypeRegistry;
import com.architecture.inventory.model.LabelField;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.architecture.inventory.TestInventory.asset;
import static com.architecture.inventory.TestInventory.itRegistry;
import static com.architecture.inventory.TestInventory.properties;
import static org.assertj.core.api.Assertions.assertThat;

class ViewPlannerTest {

    private AssetTypeRegistry registry;
    private ViewPlanner planner;
    private List<Asset> assets;

    @BeforeEach
    void setUp() {
        registry = itRegistry();
        planner = new ViewPlanner(new SubgraphSelector(properties()), registry);
        assets = List.of(
                asset("srv_1", "physical/server"),
                asset("psvc_1", "physical/server/service", "srv_1"),
                asset("app_web", "application/external", "psvc_1"),
                asset("app_intra", "application/internal", "psvc_1"),
                asset("drv_1", "drive", "srv_1"));
        DependencyGraph graph = new DependencyGraphBuilder().build(assets);
        PropagationEngine propagation = new PropagationEngine(properties());
        propagation.propagate(graph, LabelField.TYPE);
        propagation.propagate(graph, LabelField.ID);
    }

    private Map<String, MapView> planByName() {
        return planner.plan(assets).stream()
                .collect(Collectors.toMap(MapView::getName, Function.identity()));
    }

    @Test
    void plansIndexUnappliedOnePerTypeAndOnePerApplication() {
        List<MapView> views = planner.plan(assets);

        assertThat(views).hasSize(2 + registry.size() + 2);
        assertThat(views.get(0).getName()).isEqualTo("index");
        assertThat(views.get(1).getName()).isEqualTo("_unapplied");
        assertThat(views).extracting(MapView::getName)
                .contains("_physical_server_service", "_application_external", "_app_web", "_app_intra");
    }

    @Test
    void indexHoldsEveryAsset() {
        MapView index = planByName().get("index");

        assertThat(index.getAssets()).containsExactlyElementsOf(assets);
        assertThat(index.getDescription()).isEqualTo("All assets");
    }

    @Test
    void unappliedIsDependencyClosed() {
        MapView unapplied = planByName().get("_unapplied");

        assertThat(unapplied.isNegated()).isTrue();
        assertThat(unapplied.getAssets()).extracting(Asset::getId).containsExactly("srv_1", "drv_1");
        assertThat(unapplied.getDescription())
                .isEqualTo("Assets not leading to an asset of type application/.*");
    }

    @Test
    void applicationViewHoldsWhatItDependsOn() {
        MapView web = planByName().get("_app_web");

        assertThat(web.getField()).isEqualTo(LabelField.ID);
        assertThat(web.getAssets()).extracting(Asset::getId).containsExactly("srv_1", "psvc_1", "app_web");
    }

    @Test
    void typeViewForUnusedTypeIsEmpty() {
        MapView websites = planByName().get("_website_static");

        assertThat(websites.getAssets()).isEmpty();
        assertThat(websites.getDescription()).isEqualTo("website/static assets only");
    }

    @Test
    void applicationIdsAreMatchedLiterally() {
        List<Asset> hosted = List.of(
                asset("srv_a", "physical/server"),
                asset("srv_b", "physical/server"),
                asset("app_web.1", "application/external", "srv_a"),
                asset("app_webx1", "application/external", "srv_b"),
                asset("app_x(1", "application/internal", "srv_b"));
        DependencyGraph graph = new DependencyGraphBuilder().build(hosted);
        new PropagationEngine(properties()).propagate(graph, LabelField.ID);

        Map<String, MapView> views = planner.plan(hosted).stream()
                .collect(Collectors.toMap(MapView::getName, Function.identity()));

        assertThat(views.get("_app_web.1").getAssets()).extracting(Asset::getId)
                .containsExactly("srv_a", "app_web.1");
        assertThat(views.get("_app_x(1").getAssets()).extracting(Asset::getId)
                .containsExactly("srv_b", "app_x(1");
        assertThat(views.get("_app_web.1").getDescription()).isEqualTo("app_web.1 assets only");
    }
}
