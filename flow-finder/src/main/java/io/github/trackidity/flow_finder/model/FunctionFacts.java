package io.github.trackidity.flow_finder.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A function declaration as supplied by the front-end.
 */
public record FunctionFacts(
        String name,
        List<String> parameters,
        Visibility visibility,
        Mutability mutability,
        @JsonProperty("isConstructor") boolean constructor,
        @JsonProperty("isReceive") boolean receive,
        @JsonProperty("isFallback") boolean fallback,
        Boolean implemented,
        @JsonProperty("modifierRefs") List<String> modifiers,
        List<CallRef> calls,
        List<WriteRef> writes,
        Location location
) {

    public FunctionFacts {
        if (name == null || name.isEmpty()) {
            name = constructor ? "constructor" : receive ? "receive" : fallback ? "fallback" : "<unknown>";
        }
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        visibility = visibility == null ? Visibility.PUBLIC : visibility;
        mutability = mutability == null ? Mutability.NONPAYABLE : mutability;
        implemented = implemented == null ? Boolean.TRUE : implemented;
        modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
        calls = calls == null ? List.of() : List.copyOf(calls);
        writes = writes == null ? List.of() : List.copyOf(writes);
    }

    public static String signatureOf(String name, List<String> parameters) {
        return name + "(" + String.join(",", parameters) + ")";
    }

    /**
     * Name plus parameter types. Overloads differ here even when they share a name.
     */
    @JsonIgnore
    public String signature() {
        return signatureOf(name, parameters);
    }
}
