package com.raditha.smells.model;

/**
 * Categories of smells reported by the detectors.
 */
public enum SmellKind {
    LONG_METHOD("Long Method"),
    LONG_PARAMETER_LIST("Long Parameter List"),
    DUPLICATE_FUNCTION("Duplicate Function"),
    DUPLICATE_BLOCK("Duplicate Block"),
    STRUCTURAL_DUPLICATE("Structural Duplicate");

    private final String displayName;

    SmellKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
