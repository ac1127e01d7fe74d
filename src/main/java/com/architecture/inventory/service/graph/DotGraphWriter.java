package com.architecture.inventory.service.graph;

import com.architecture.inventory.dto.Issue;
import com.architecture.inventory.dto.RenderSet;
import com.architecture.inventory.dto.ValidationReport;
import com.architecture.inventory.model.Asset;
import com.architecture.inventory.model.AssetType;
import com.architecture.inventory.model.AssetTypeRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes a resolved view as Graphviz DOT text. Edges run from the dependency
 * to the dependent asset; placeholders are drawn as error-coloured octagons.
 */
@Service
@RequiredArgsConstructor
public class DotGraphWriter {

    private static final String DEFAULT_STYLE = "shape=box";
    private static final int WRAP_THRESHOLD = 8;
    private static final String WRAP_CHARS = " _-";

    private final AssetTypeRegistry registry;

    public String write(RenderSet view, ValidationReport report, String title, DotTheme theme) {
        List<String> lines = new ArrayList<>();
        for (String header : theme.header()) {
            lines.add(String.format(header, escape(title)));
        }

        for (Asset placeholder : view.getPlaceholders()) {
            lines.add("  " + placeholder.getNodeId() + " [label=\"" + Asset.PLACEHOLDER_NAME
                    + "\", shape=doubleoctagon, fillcolor=\"" + theme.errorColor() + "\", style=filled]");
        }

        for (Asset asset : view.getAssets()) {
            lines.add(node(asset, report, theme));
            for (String dependencyId : asset.edgeDependencyIds()) {
                Asset dependency = view.node(dependencyId);
                lines.add("  " + dependency.getNodeId() + " -> " + asset.getNodeId()
                        + " [fontcolor=\"" + theme.edgeLabelColor() + "\"]");
            }
        }

        lines.add("}");
        return String.join("\n", lines);
    }

    private String node(Asset asset, ValidationReport report, DotTheme theme) {
        List<String> attributes = new ArrayList<>();
        attributes.add("label=\"" + escape(wrapName(asset.getName() != null ? asset.getName() : asset.getId())) + "\"");
        attributes.add("target=\"_" + escape(asset.getId()) + "\"");
        // unknown types are reported by validation, draw them with the default shape
        attributes.add(registry.find(asset.getType()).map(AssetType::getStyle).orElse(DEFAULT_STYLE));
        if (report.hasProblems(asset.getId())) {
            attributes.add("style=\"filled\"");
            attributes.add("fillcolor=\"" + theme.errorColor() + "\"");
        }
        attributes.add("tooltip=\"" + escape(String.join("\n", tooltip(asset, report))) + "\"");
        return "  " + asset.getNodeId() + " [" + String.join(", ", attributes) + "]";
    }

    /**
     * Hover text: issues first, then scalar attributes, list attributes and
     * where the asset is defined.
     */
    List<String> tooltip(Asset asset, ValidationReport report) {
        List<String> tooltip = new ArrayList<>();
        for (Issue issue : report.issuesFor(asset.getId())) {
            tooltip.add(issue.getSeverity() + " " + issue.getMessage());
        }
        asset.stringAttributes().forEach((key, value) -> tooltip.add(key + ": " + value));
        for (Map.Entry<String, List<String>> list : asset.listAttributes().entrySet()) {
            if (list.getValue() != null && !list.getValue().isEmpty()) {
                tooltip.add(list.getKey().toUpperCase());
                for (String item : list.getValue()) {
                    tooltip.add("  " + item);
                }
            }
        }
        if (asset.getSource() != null) {
            tooltip.add("Defined in " + asset.getSource().getPath());
        }
        return tooltip;
    }

    /**
     * Break a long name in two at a separator close to its middle.
     */
    static String wrapName(String text) {
        int half = text.length() / 2;
        if (half <= WRAP_THRESHOLD) {
            return text;
        }
        for (int i = 0; i < half - 1; i++) {
            if (WRAP_CHARS.indexOf(text.charAt(half + i)) >= 0) {
                return text.substring(0, half + i) + "\n" + text.substring(half + i);
            }
            if (WRAP_CHARS.indexOf(text.charAt(half - i)) >= 0) {
                return text.substring(0, half - i) + "\n" + text.substring(half - i);
            }
        }
        return text;
    }

    private static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
