package com.architecture.inventory.dto;

/**
 * Kinds of validation issue an asset can carry.
 */
public enum IssueCode {
    UNKNOWN_ASSET_TYPE,
    UNDEFINED_DEPENDENCY,
    UNKNOWN_ID_PREFIX,
    NO_DEPENDENTS,
    NO_DEPENDENCIES,
    OPEN_ISSUES,
    NEEDS_WORK,
    MISSING_REQUIRED_FIELD,
    MISSING_REQUIRED_DEPENDENCY_TYPE,
    EXCLUDED_DEPENDENCY,
    TYPE_CHECKS_SKIPPED,
    INTERNAL_FAILURE
}
