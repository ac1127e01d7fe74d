package com.architecture.inventory.service.validation;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Validation rules grouped by the asset-type pattern they apply to.
 *
 * Groups keep the order in which their pattern was first registered, rules keep
 * registration order within a group. Patterns are compiled when the set is
 * built and the set never changes afterwards.
 */
public final class RuleSet {

    private final List<RuleGroup> groups;

    private RuleSet(List<RuleGroup> groups) {
        this.groups = Collections.unmodifiableList(groups);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<RuleGroup> groups() {
        return groups;
    }

    /**
     * Rules of every group whose pattern is found in the type, in order.
     */
    public List<RegisteredRule> rulesFor(String type) {
        List<RegisteredRule> rules = new ArrayList<>();
        for (RuleGroup group : groups) {
            if (group.matches(type)) {
                rules.addAll(group.getRules());
            }
        }
        return rules;
    }

    public int size() {
        return groups.stream().mapToInt(group -> group.getRules().size()).sum();
    }

    @Value
    public static class RuleGroup {
        String pattern;
        Pattern compiled;
        List<RegisteredRule> rules;

        public boolean matches(String type) {
            return compiled.matcher(type).find();
        }
    }

    /**
     * A rule and its name. Type-dependent rules read the asset's registry entry
     * and are skipped when the asset's type is unknown.
     */
    @Value
    public static class RegisteredRule {
        String name;
        boolean typeDependent;
        ValidationRule rule;
    }

    public static class Builder {

        private final Map<String, List<RegisteredRule>> rules = new LinkedHashMap<>();

        public Builder rule(String typePattern, String name, ValidationRule rule) {
            return add(typePattern, new RegisteredRule(name, false, rule));
        }

        public Builder typeDependentRule(String typePattern, String name, ValidationRule rule) {
            return add(typePattern, new RegisteredRule(name, true, rule));
        }

        private Builder add(String typePattern, RegisteredRule rule) {
            rules.computeIfAbsent(typePattern, k -> new ArrayList<>()).add(rule);
            return this;
        }

        public RuleSet build() {
            List<RuleGroup> groups = new ArrayList<>();
            rules.forEach((pattern, patternRules) -> groups.add(
                    new RuleGroup(pattern, Pattern.compile(pattern), List.copyOf(patternRules))));
            return new RuleSet(groups);
        }
    }
}
