package com.architecture.inventory.service.graph;

import java.util.List;

/**
 * Graphviz colours and header lines for the light and dark map themes.
 * Header lines take the title as their only format argument.
 */
public enum DotTheme {
    LIGHT(List.of(
            "digraph Assets {",
            "  graph [rankdir=LR, concentrate=true, label=\"%s\", fontname=FreeSans, tooltip=\" \"]",
            "  node [fontname=FreeSans, fontsize=10]",
            "  edge [fontname=FreeSans, fontsize=10]"),
            "#c0c0c0", "pink"),
    DARK(List.of(
            "digraph Assets {",
            "  graph [rankdir=LR, concentrate=true, label=\"%s\", fontname=FreeSans, tooltip=\" \",",
            "         bgcolor=black]",
            "  node [fontname=FreeSans, fontsize=10, color=\"#808080\", fontcolor=\"#808080\"]",
            "  edge [fontname=FreeSans, fontsize=10, color=\"#808080\"]"),
            "#303030", "#200000");

    private final List<String> header;
    private final String edgeLabelColor;
    private final String errorColor;

    DotTheme(List<String> header, String edgeLabelColor, String errorColor) {
        this.header = header;
        this.edgeLabelColor = edgeLabelColor;
        this.errorColor = errorColor;
    }

    public List<String> header() {
        return header;
    }

    public String edgeLabelColor() {
        return edgeLabelColor;
    }

    public String errorColor() {
        return errorColor;
    }

    /**
     * Theme by name, light unless the name is "dark".
     */
    public static DotTheme fromName(String name) {
        return "dark".equalsIgnoreCase(name) ? DARK : LIGHT;
    }
}
