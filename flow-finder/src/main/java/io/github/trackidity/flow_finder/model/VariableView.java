package io.github.trackidity.flow_finder.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Output form of a state variable. {@code modifiers} holds the entry points that
 * write it, the name the presentation layer expects.
 */
@JsonPropertyOrder({"varId", "name", "type", "contract", "inherited", "inheritedFrom", "isConstant", "isImmutable",
        "location", "modifiers"})
public record VariableView(
        String varId,
        String name,
        String type,
        String contract,
        boolean inherited,
        String inheritedFrom,
        @JsonProperty("isConstant") boolean constant,
        @JsonProperty("isImmutable") boolean immutable,
        Location location,
        List<WriterView> modifiers
) {
}
