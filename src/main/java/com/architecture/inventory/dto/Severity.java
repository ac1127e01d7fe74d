package com.architecture.inventory.dto;

/**
 * Severity of a validation issue. Anything other than NOTE marks the asset
 * as problematic in rendered views.
 */
public enum Severity {
    ERROR,
    WARNING,
    NOTE
}
