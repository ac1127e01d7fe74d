package com.architecture.inventory.service.validation;

import com.architecture.inventory.dto.Issue;
import com.architecture.inventory.dto.IssueCode;
import com.architecture.inventory.model.Asset;
import com.architecture.inventory.model.AssetType;
import com.architecture.inventory.model.AssetTypeRegistry;
import com.architecture.inventory.model.DependencyRef;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The inventory checks applied to every asset, backed by a type registry.
 *
 * Registration order is the order issues appear in reports; the type check
 * goes first because it explains most of what follows for a mistyped asset.
 */
public class StandardRules {

    public static final String ALL_TYPES = ".*";
    static final String NO_TYPE = "NO-TYPE";

    private final AssetTypeRegistry registry;

    public StandardRules(AssetTypeRegistry registry) {
        this.registry = registry;
    }

    public RuleSet ruleSet() {
        return RuleSet.builder()
                .rule(ALL_TYPES, "known-asset-type", this::knownAssetType)
                .rule(ALL_TYPES, "no-undefined-dependencies", this::noUndefinedDependencies)
                .rule(ALL_TYPES, "known-id-prefix", this::knownIdPrefix)
                .typeDependentRule(ALL_TYPES, "dependents-unless-top", this::dependentsUnlessTop)
                .typeDependentRule(ALL_TYPES, "dependencies-unless-bottom", this::dependenciesUnlessBottom)
                .rule(ALL_TYPES, "open-issues", this::openIssues)
                .rule(ALL_TYPES, "needs-work-tag", this::needsWork)
                .typeDependentRule(ALL_TYPES, "required-fields", this::requiredFields)
                .typeDependentRule(ALL_TYPES, "required-dependency-types", this::requiredDependencyTypes)
                .build();
    }

    List<Issue> knownAssetType(Asset asset, Map<String, Asset> lookup, Map<String, List<String>> dependents) {
        if (!registry.contains(asset.getType())) {
            return List.of(Issue.error(IssueCode.UNKNOWN_ASSET_TYPE, "Has unknown type " + asset.getType()));
        }
        return List.of();
    }

    List<Issue> noUndefinedDependencies(Asset asset, Map<String, Asset> lookup, Map<String, List<String>> dependents) {
        List<Issue> issues = new ArrayList<>();
        for (String id : new LinkedHashSet<>(asset.dependencyIds())) {
            // ^id excludes a required dependency pattern, it names no asset
            if (!lookup.containsKey(id) && !id.startsWith(DependencyRef.EXCLUSION_MARKER)) {
                issues.add(Issue.warning(IssueCode.UNDEFINED_DEPENDENCY, "Depends on undefined asset ID=" + id));
            }
        }
        return issues;
    }

    List<Issue> knownIdPrefix(Asset asset, Map<String, Asset> lookup, Map<String, List<String>> dependents) {
        if (!registry.idPrefixes().contains(idPrefix(asset.getId()))) {
            return List.of(Issue.warning(IssueCode.UNKNOWN_ID_PREFIX, "Has unknown prefix"));
        }
        return List.of();
    }

    List<Issue> dependentsUnlessTop(Asset asset, Map<String, Asset> lookup, Map<String, List<String>> dependents) {
        Optional<AssetType> type = registry.find(asset.getType());
        if (type.isPresent() && !type.get().isTop()
                && dependents.getOrDefault(asset.getId(), List.of()).isEmpty()) {
            return List.of(Issue.warning(IssueCode.NO_DEPENDENTS, "Non-top-level asset has no dependents"));
        }
        return List.of();
    }

    List<Issue> dependenciesUnlessBottom(Asset asset, Map<String, Asset> lookup, Map<String, List<String>> dependents) {
        Optional<AssetType> type = registry.find(asset.getType());
        if (type.isPresent() && !type.get().isBottom() && !asset.hasField("depends_on")) {
            return List.of(Issue.warning(IssueCode.NO_DEPENDENCIES, "Non-bottom-level asset has no dependencies"));
        }
        return List.of();
    }

    List<Issue> openIssues(Asset asset, Map<String, Asset> lookup, Map<String, List<String>> dependents) {
        if (asset.hasField("open_issues")) {
            return List.of(Issue.warning(IssueCode.OPEN_ISSUES, "Has open issues"));
        }
        return List.of();
    }

    List<Issue> needsWork(Asset asset, Map<String, Asset> lookup, Map<String, List<String>> dependents) {
        if (asset.hasTag(Asset.TAG_NEEDS_WORK)) {
            return List.of(Issue.warning(IssueCode.NEEDS_WORK, "Has '" + Asset.TAG_NEEDS_WORK + "' tag"));
        }
        return List.of();
    }

    List<Issue> requiredFields(Asset asset, Map<String, Asset> lookup, Map<String, List<String>> dependents) {
        Optional<AssetType> type = registry.find(asset.getType());
        if (type.isEmpty()) {
            return List.of();
        }
        List<Issue> issues = new ArrayList<>();
        for (String field : type.get().getRequiredFields()) {
            if (!asset.hasField(field)) {
                issues.add(Issue.warning(IssueCode.MISSING_REQUIRED_FIELD,
                        "'" + asset.getType() + "' definition missing '" + field + "' field"));
            }
        }
        return issues;
    }

    /**
     * Each required pattern must be found in the type of at least one
     * sufficient dependency, unless the asset lists {@code ^pattern}.
     * Undefined dependencies count with type {@value #NO_TYPE}.
     */
    List<Issue> requiredDependencyTypes(Asset asset, Map<String, Asset> lookup, Map<String, List<String>> dependents) {
        Optional<AssetType> type = registry.find(asset.getType());
        if (type.isEmpty()) {
            return List.of();
        }
        Set<String> dependencyIds = new LinkedHashSet<>(asset.dependencyIds());
        List<String> sufficientTypes = new ArrayList<>();
        for (String id : asset.sufficientDependencyIds()) {
            Asset dependency = lookup.get(id);
            sufficientTypes.add(dependency != null && dependency.getType() != null ? dependency.getType() : NO_TYPE);
        }

        List<Issue> issues = new ArrayList<>();
        for (String required : type.get().getRequiredDependencyPatterns()) {
            if (dependencyIds.contains(DependencyRef.EXCLUSION_MARKER + required)) {
                issues.add(Issue.note(IssueCode.EXCLUDED_DEPENDENCY,
                        "Specifically excludes '" + required + "' dependency"));
                continue;
            }
            Pattern pattern = registry.dependencyPattern(required);
            if (sufficientTypes.stream().noneMatch(t -> pattern.matcher(t).find())) {
                issues.add(Issue.warning(IssueCode.MISSING_REQUIRED_DEPENDENCY_TYPE,
                        "'" + asset.getType() + "' should define '" + required + "' dependency"));
            }
        }
        return issues;
    }

    static String idPrefix(String id) {
        if (id == null) {
            return "";
        }
        int separator = id.indexOf('_');
        return separator < 0 ? id : id.substring(0, separator);
    }
}
