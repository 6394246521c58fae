package io.github.trackidity.flow_finder.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Mutability {
    VIEW, PURE, NONPAYABLE, PAYABLE;

    @JsonCreator
    public static Mutability fromString(String value) {
        if (value == null || value.isBlank()) {
            return NONPAYABLE;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * view and pure functions cannot modify state.
     */
    public boolean mayModifyState() {
        return this == NONPAYABLE || this == PAYABLE;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
