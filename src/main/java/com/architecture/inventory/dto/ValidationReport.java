package com.architecture.inventory.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Issues per asset id, in the order assets were validated. Assets without
 * issues have no entry.
 */
public class ValidationReport {

    private final Map<String, List<Issue>> issues = new LinkedHashMap<>();

    public void put(String assetId, List<Issue> assetIssues) {
        issues.put(assetId, Collections.unmodifiableList(assetIssues));
    }

    public List<Issue> issuesFor(String assetId) {
        return issues.getOrDefault(assetId, List.of());
    }

    public boolean hasIssues(String assetId) {
        return issues.containsKey(assetId);
    }

    /**
     * True when the asset has at least one ERROR or WARNING.
     */
    public boolean hasProblems(String assetId) {
        return issuesFor(assetId).stream().anyMatch(Issue::isProblem);
    }

    public Map<String, List<Issue>> asMap() {
        return Collections.unmodifiableMap(issues);
    }

    /**
     * Number of issues per severity name, sorted by name.
     */
    public Map<String, Long> countsBySeverity() {
        Map<String, Long> counts = new TreeMap<>();
        for (List<Issue> assetIssues : issues.values()) {
            for (Issue issue : assetIssues) {
                counts.merge(issue.getSeverity().name(), 1L, Long::sum);
            }
        }
        return counts;
    }

    public long count(Severity severity) {
        return countsBySeverity().getOrDefault(severity.name(), 0L);
    }

    public int size() {
        return issues.size();
    }
}
