package com.architecture.inventory.service.graph;

import com.architecture.inventory.exception.DuplicateIdentifierException;
import com.architecture.inventory.model.Asset;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.architecture.inventory.TestInventory.asset;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class DependencyGraphBuilderTest {

    private final DependencyGraphBuilder builder = new DependencyGraphBuilder();

    @Test
    void indexesAssetsAndCollectsDependents() {
        Asset server = asset("srv_1", "physical/server");
        Asset service = asset("psvc_1", "physical/server/service", "srv_1 runs on", "missing_1");
        Asset app = asset("app_1", "application/external", "psvc_1");

        DependencyGraph graph = builder.build(List.of(server, service, app));

        assertThat(graph.getLookup()).containsOnlyKeys("srv_1", "psvc_1", "app_1");
        assertThat(graph.dependentsOf("srv_1")).containsExactly("psvc_1");
        assertThat(graph.dependentsOf("psvc_1")).containsExactly("app_1");
        assertThat(graph.getDependents()).containsKey("missing_1");
        assertThat(graph.dependentsOf("app_1")).isEmpty();
    }

    @Test
    void attachesDirectDependentsOnlyToDefinedAssets() {
        Asset server = asset("srv_1", "physical/server");
        Asset first = asset("psvc_1", "physical/server/service", "srv_1");
        Asset second = asset("psvc_2", "physical/server/service", "srv_1", "missing_1");

        builder.build(List.of(server, first, second));

        assertThat(server.getDependents()).containsExactly("psvc_1", "psvc_2");
        assertThat(first.getDependents()).isEmpty();
    }

    @Test
    void rebuildingDoesNotDuplicateDependents() {
        Asset server = asset("srv_1", "physical/server");
        Asset service = asset("psvc_1", "physical/server/service", "srv_1");

        builder.build(List.of(server, service));
        builder.build(List.of(server, service));

        assertThat(server.getDependents()).containsExactly("psvc_1");
    }

    @Test
    void reportsEveryDuplicateIdWithBothSources() {
        Asset first = asset("srv_1", "physical/server");
        Asset again = asset("srv_1", "physical/server");
        again.getSource().setPath("/inventory/other.yaml");
        Asset drive = asset("drv_1", "drive");
        Asset driveAgain = asset("drv_1", "drive");

        DuplicateIdentifierException error = catchThrowableOfType(
                () -> builder.build(List.of(first, again, drive, driveAgain)),
                DuplicateIdentifierException.class);

        assertThat(error).isNotNull();
        assertThat(error.getDuplicates())
                .extracting(DuplicateIdentifierException.Duplicate::getId)
                .containsExactly("srv_1", "drv_1");
        assertThat(error.getDuplicates().get(0).getFirstSource()).isEqualTo("/inventory/srv_1.yaml");
        assertThat(error.getDuplicates().get(0).getDuplicateSource()).isEqualTo("/inventory/other.yaml");
        assertThat(error.getMessage()).contains("srv_1", "drv_1");
    }

    @Test
    void extractsIdsAndSkipsInsufficientDependenciesOnRequest() {
        Asset asset = asset("con_1", "container/docker",
                "dply_1 Dockerfile",
                "srv_1 INSUF shares the host",
                "^storage/.* stateless",
                "  ");

        assertThat(asset.dependencyIds()).containsExactly("dply_1", "srv_1", "^storage/.*");
        assertThat(asset.sufficientDependencyIds()).containsExactly("dply_1", "^storage/.*");
        assertThat(asset.edgeDependencyIds()).containsExactly("dply_1", "srv_1");
    }

    @Test
    void exclusionsAreRawDependentKeysButNeverDirectDependents() {
        Asset storage = asset("sto_1", "storage/local");
        Asset service = asset("psvc_1", "physical/server/service", "^storage/.* stateless");

        DependencyGraph graph = builder.build(List.of(storage, service));

        assertThat(graph.dependentsOf("^storage/.*")).containsExactly("psvc_1");
        assertThat(graph.contains("^storage/.*")).isFalse();
        assertThat(storage.getDependents()).isEmpty();
    }
}
