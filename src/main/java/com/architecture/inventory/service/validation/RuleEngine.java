package com.architecture.inventory.service.validation;

import com.architecture.inventory.dto.Issue;
import com.architecture.inventory.dto.IssueCode;
import com.architecture.inventory.dto.ValidationReport;
import com.architecture.inventory.exception.RuleEvaluationException;
import com.architecture.inventory.model.Asset;
import com.architecture.inventory.model.AssetTypeRegistry;
import com.architecture.inventory.service.graph.DependencyGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs a {@link RuleSet} over every asset and collects the issues per asset id.
 *
 * Issues are data: only an unexpected rule failure is thrown, and even then the
 * failing asset's partial issues are in the report first.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RuleEngine {

    private static final String UNSPECIFIED_TYPE = "NOT-SPECIFIED";

    private final RuleSet ruleSet;
    private final AssetTypeRegistry registry;

    public ValidationReport validate(List<Asset> assets, DependencyGraph graph) {
        return validate(assets, graph.getLookup(), graph.getDependents());
    }

    /**
     * Validate assets in order. Assets without issues get no report entry.
     *
     * @throws RuleEvaluationException if a rule fails; its partial report holds
     *                                 every asset validated so far
     */
    public ValidationReport validate(List<Asset> assets, Map<String, Asset> lookup,
                                     Map<String, List<String>> dependents) {
        ValidationReport report = new ValidationReport();
        for (Asset asset : assets) {
            List<Issue> issues = new ArrayList<>();
            try {
                evaluate(asset, lookup, dependents, issues);
            } catch (RuntimeException e) {
                issues.add(Issue.error(IssueCode.INTERNAL_FAILURE, "Validation failed: " + e.getMessage()));
                throw new RuleEvaluationException(asset.getId(), report, e);
            } finally {
                if (!issues.isEmpty()) {
                    report.put(asset.getId(), issues);
                    logIssues(asset, issues);
                }
            }
        }
        log.info("Validated {} assets: {} with issues, counts {}",
                assets.size(), report.size(), report.countsBySeverity());
        return report;
    }

    private void evaluate(Asset asset, Map<String, Asset> lookup, Map<String, List<String>> dependents,
                          List<Issue> issues) {
        String type = asset.getType() != null ? asset.getType() : UNSPECIFIED_TYPE;
        boolean knownType = registry.contains(asset.getType());
        int skipped = 0;

        for (RuleSet.RegisteredRule rule : ruleSet.rulesFor(type)) {
            if (rule.isTypeDependent() && !knownType) {
                skipped++;
                continue;
            }
            issues.addAll(rule.getRule().evaluate(asset, lookup, dependents));
        }

        if (skipped > 0) {
            issues.add(Issue.warning(IssueCode.TYPE_CHECKS_SKIPPED,
                    "Skipped " + skipped + " type-dependent checks for unknown type '" + asset.getType() + "'"));
        }
    }

    private void logIssues(Asset asset, List<Issue> issues) {
        String source = asset.getSource() != null ? asset.getSource().getPath() : "<unknown source>";
        log.warn("ASSET: {} '{}' in {}", asset.getId(), asset.getName(), source);
        for (Issue issue : issues) {
            log.warn("    {}", issue);
        }
    }
}
