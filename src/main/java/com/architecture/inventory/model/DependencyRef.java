package com.architecture.inventory.model;

import lombok.Value;

/**
 * One parsed {@code depends_on} entry: {@code <id> [free-text commentary]}.
 *
 * A leading {@code ^} on the id marks an intentional exclusion of a required
 * dependency pattern. {@code INSUF} in the commentary marks the edge as present
 * but insufficient for the required-dependency-type check.
 */
@Value
public class DependencyRef {

    public static final String EXCLUSION_MARKER = "^";
    public static final String INSUFFICIENT_MARKER = "INSUF";

    String expression;
    String id;
    String commentary;

    /**
     * Parse a dependency expression. Returns null for a blank expression.
     */
    public static DependencyRef parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return null;
        }
        String trimmed = expression.trim();
        String[] parts = trimmed.split("\\s+", 2);
        return new DependencyRef(expression, parts[0], parts.length > 1 ? parts[1] : "");
    }

    public boolean isExcluded() {
        return id.startsWith(EXCLUSION_MARKER);
    }

    /**
     * The pattern named by an exclusion, i.e. the id without its leading marker.
     */
    public String excludedPattern() {
        return isExcluded() ? id.substring(EXCLUSION_MARKER.length()) : null;
    }

    public boolean isInsufficient() {
        return commentary.contains(INSUFFICIENT_MARKER);
    }
}
