package io.github.trackidity.flow_finder.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ContractKind {
    CONTRACT, ABSTRACT, INTERFACE, LIBRARY;

    @JsonCreator
    public static ContractKind fromString(String value) {
        if (value == null || value.isBlank()) {
            return CONTRACT;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
