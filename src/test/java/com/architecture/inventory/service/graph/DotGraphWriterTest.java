package com.architecture.inventory.service.graph;

import com.architecture.inventory.dto.Issue;
import com.architecture.inventory.dto.IssueCode;
import com.architecture.inventory.dto.RenderSet;
import com.architecture.inventory.dto.ValidationReport;
import com.architecture.inventory.model.Asset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.architecture.inventory.TestInventory.asset;
import static com.architecture.inventory.TestInventory.itRegistry;
import static org.assertj.core.api.Assertions.assertThat;

class DotGraphWriterTest {

    private DotGraphWriter writer;
    private final PlaceholderResolver resolver = new PlaceholderResolver();

    private Asset server;
    private Asset service;
    private ValidationReport report;

    @BeforeEach
    void setUp() {
        writer = new DotGraphWriter(itRegistry());
        server = asset("srv_1", "physical/server");
        server.setLocation("rack 4");
        service = asset("psvc_1", "physical/server/service", "srv_1", "missing_1");
        report = new ValidationReport();
        report.put("psvc_1", List.of(Issue.error(IssueCode.UNDEFINED_DEPENDENCY,
                "Depends on undefined asset ID=missing_1")));
    }

    @Test
    void writesNodesPlaceholdersAndEdgesFromDependencyToDependent() {
        RenderSet view = resolver.resolve(List.of(server, service));

        String dot = writer.write(view, report, "Inventory updated now", DotTheme.LIGHT);

        assertThat(dot).startsWith("digraph Assets {");
        assertThat(dot).contains("label=\"Inventory updated now\"");
        assertThat(dot).contains("n2 [label=\"???\", shape=doubleoctagon, fillcolor=\"pink\", style=filled]");
        assertThat(dot).contains("n0 -> n1");
        assertThat(dot).contains("n2 -> n1");
        assertThat(dot).contains("shape=box, width=1");
        assertThat(dot).endsWith("}");
    }

    @Test
    void fillsAssetsWithProblemsInTheThemeErrorColour() {
        RenderSet view = resolver.resolve(List.of(server, service));

        String dot = writer.write(view, report, "t", DotTheme.DARK);

        assertThat(dot.lines().filter(line -> line.startsWith("  n1 [")).findFirst())
                .hasValueSatisfying(line -> assertThat(line).contains("fillcolor=\"#200000\""));
        assertThat(dot.lines().filter(line -> line.startsWith("  n0 [")).findFirst())
                .hasValueSatisfying(line -> assertThat(line).doesNotContain("fillcolor"));
        assertThat(dot).contains("bgcolor=black");
    }

    @Test
    void unknownTypeFallsBackToDefaultShape() {
        Asset mystery = asset("qc_1", "quantum/computer");

        String dot = writer.write(resolver.resolve(List.of(mystery)), new ValidationReport(), "t", DotTheme.LIGHT);

        assertThat(dot).contains("n0 [label=\"qc_1\", target=\"_qc_1\", shape=box, tooltip=");
    }

    @Test
    void tooltipListsIssuesThenAttributesThenSource() {
        List<String> tooltip = writer.tooltip(service, report);

        assertThat(tooltip.get(0)).isEqualTo("ERROR Depends on undefined asset ID=missing_1");
        assertThat(tooltip).containsSubsequence(
                "id: psvc_1",
                "type: physical/server/service",
                "DEPENDS_ON",
                "  srv_1",
                "  missing_1",
                "Defined in /inventory/psvc_1.yaml");
    }

    @Test
    void longNamesWrapAtSeparatorNearMiddle() {
        assertThat(DotGraphWriter.wrapName("database_server_primary")).isEqualTo("database\n_server_primary");
        assertThat(DotGraphWriter.wrapName("short name")).isEqualTo("short name");
        assertThat(DotGraphWriter.wrapName("averyveryverylongnamewithoutbreaks"))
                .isEqualTo("averyveryverylongnamewithoutbreaks");
    }
}
