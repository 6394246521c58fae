package io.github.trackidity.flow_finder.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Visibility {
    PUBLIC, EXTERNAL, INTERNAL, PRIVATE;

    @JsonCreator
    public static Visibility fromString(String value) {
        if (value == null || value.isBlank()) {
            return PUBLIC;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public boolean isExternallyCallable() {
        return this == PUBLIC || this == EXTERNAL;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
