package com.architecture.inventory.service.validation;

import com.architecture.inventory.dto.Issue;
import com.architecture.inventory.model.Asset;

import java.util.List;
import java.util.Map;

/**
 * A check run against one asset. Returns the issues found, empty when the
 * asset passes.
 */
@FunctionalInterface
public interface ValidationRule {

    List<Issue> evaluate(Asset asset, Map<String, Asset> lookup, Map<String, List<String>> dependents);
}
