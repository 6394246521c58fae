package io.github.trackidity.flow_finder.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Kind of an edge between callable units, as resolved by the front-end.
 */
public enum CallKind {
    MODIFIER("Modifier"),
    BASE_CONSTRUCTOR("BaseConstructor"),
    INTERNAL("Internal"),
    SUPER("Internal"),
    LIBRARY("Library"),
    EXTERNAL("External"),
    SOLIDITY("Solidity");

    private final String displayLabel;

    CallKind(String displayLabel) {
        this.displayLabel = displayLabel;
    }

    @JsonCreator
    public static CallKind fromString(String value) {
        if (value == null || value.isBlank()) {
            return INTERNAL;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }

    public String displayLabel() {
        return displayLabel;
    }

    /**
     * Edges of these kinds are never followed during traversal.
     */
    public boolean isLeaf() {
        return this == EXTERNAL || this == SOLIDITY;
    }

    /**
     * Only plain internal calls are redirected to the most-derived override.
     */
    public boolean isVirtual() {
        return this == INTERNAL;
    }
}
