package com.architecture.inventory.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An inventory record: a typed asset with its declared dependencies.
 *
 * Known record keys are typed fields; any other key read from the source file
 * is kept in {@link #extraAttributes}. The derived attributes (dependents,
 * dependentTypes, dependentIds, nodeId) are filled in by the engine.
 *
 * Equality is identity: the same id may legitimately appear on two records
 * while duplicates are being reported.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(of = {"id", "type", "name"})
public class Asset {

    public static final String TAG_ARCHIVED = "archived";
    public static final String TAG_NEEDS_WORK = "needs_work";
    public static final String PLACEHOLDER_NAME = "???";

    private String id;
    private String type;
    private String name;

    @Builder.Default
    private List<String> dependsOn = new ArrayList<>();   // Raw dependency expressions

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private String location;
    private String owner;
    private String size;

    @Builder.Default
    private List<String> openIssues = new ArrayList<>();
    @Builder.Default
    private List<String> closedIssues = new ArrayList<>();
    @Builder.Default
    private List<String> notes = new ArrayList<>();
    @Builder.Default
    private List<String> links = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> extraAttributes = new LinkedHashMap<>();

    private SourceFile source;

    // Derived, never persisted

    @Builder.Default
    private List<String> dependents = new ArrayList<>();        // Direct dependents that are defined
    @Builder.Default
    private Set<String> dependentTypes = new LinkedHashSet<>();
    @Builder.Default
    private Set<String> dependentIds = new LinkedHashSet<>();
    private String nodeId;
    private boolean placeholder;

    /**
     * Synthetic stand-in for a dependency id that no asset defines.
     */
    public static Asset placeholder(String id, String nodeId) {
        return Asset.builder()
                .id(id)
                .name(PLACEHOLDER_NAME)
                .nodeId(nodeId)
                .placeholder(true)
                .build();
    }

    // ========================= DEPENDENCIES =========================

    public List<DependencyRef> dependencies() {
        if (dependsOn == null) {
            return List.of();
        }
        return dependsOn.stream()
                .map(DependencyRef::parse)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    /**
     * Ids of all declared dependencies, exclusion markers included.
     */
    public List<String> dependencyIds() {
        return dependencies().stream()
                .map(DependencyRef::getId)
                .collect(Collectors.toList());
    }

    /**
     * Ids of dependencies that are not flagged INSUF.
     */
    public List<String> sufficientDependencyIds() {
        return dependencies().stream()
                .filter(ref -> !ref.isInsufficient())
                .map(DependencyRef::getId)
                .collect(Collectors.toList());
    }

    /**
     * Ids of real dependency edges, i.e. without {@code ^} exclusions.
     */
    public List<String> edgeDependencyIds() {
        return dependencies().stream()
                .filter(ref -> !ref.isExcluded())
                .map(DependencyRef::getId)
                .collect(Collectors.toList());
    }

    // ========================= FIELDS =========================

    public boolean hasTag(String tag) {
        return tags != null && tags.contains(tag);
    }

    public boolean isArchived() {
        return hasTag(TAG_ARCHIVED);
    }

    /**
     * Value of a record field by its source key ("open_issues", "owner", ...).
     */
    public Object fieldValue(String field) {
        switch (field) {
            case "id":
                return id;
            case "type":
                return type;
            case "name":
                return name;
            case "depends_on":
                return dependsOn;
            case "tags":
                return tags;
            case "location":
                return location;
            case "owner":
                return owner;
            case "size":
                return size;
            case "open_issues":
                return openIssues;
            case "closed_issues":
                return closedIssues;
            case "notes":
                return notes;
            case "links":
                return links;
            default:
                return extraAttributes == null ? null : extraAttributes.get(field);
        }
    }

    /**
     * True when the field is present and non-empty.
     */
    public boolean hasField(String field) {
        Object value = fieldValue(field);
        if (value == null) {
            return false;
        }
        if (value instanceof String) {
            return !((String) value).isEmpty();
        }
        if (value instanceof Collection) {
            return !((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return !((Map<?, ?>) value).isEmpty();
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return true;
    }

    /**
     * Scalar attributes in display order, extra scalar attributes last.
     */
    public Map<String, String> stringAttributes() {
        Map<String, String> attributes = new LinkedHashMap<>();
        putIfPresent(attributes, "id", id);
        putIfPresent(attributes, "type", type);
        putIfPresent(attributes, "name", name);
        putIfPresent(attributes, "location", location);
        putIfPresent(attributes, "owner", owner);
        putIfPresent(attributes, "size", size);
        if (extraAttributes != null) {
            extraAttributes.forEach((key, value) -> {
                if (value instanceof String) {
                    attributes.put(key, (String) value);
                }
            });
        }
        return attributes;
    }

    /**
     * List attributes keyed by their source key, depends_on included.
     */
    public Map<String, List<String>> listAttributes() {
        Map<String, List<String>> attributes = new LinkedHashMap<>();
        attributes.put("closed_issues", closedIssues);
        attributes.put("depends_on", dependsOn);
        attributes.put("links", links);
        attributes.put("notes", notes);
        attributes.put("open_issues", openIssues);
        attributes.put("tags", tags);
        return attributes;
    }

    private static void putIfPresent(Map<String, String> target, String key, String value) {
        if (value != null) {
            target.put(key, value);
        }
    }
}
