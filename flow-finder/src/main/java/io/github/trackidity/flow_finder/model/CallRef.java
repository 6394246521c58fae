package io.github.trackidity.flow_finder.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.List;

/**
 * A call edge as resolved by the front-end. {@code parameters} is null when the
 * front-end only knows the target by name.
 */
public record CallRef(
        @JsonAlias("targetContract") String contract,
        @JsonAlias("targetName") String name,
        List<String> parameters,
        CallKind kind,
        Location location
) {

    public CallRef {
        parameters = parameters == null ? null : List.copyOf(parameters);
        kind = kind == null ? CallKind.INTERNAL : kind;
    }

    public static CallRef internal(String contract, String name) {
        return new CallRef(contract, name, null, CallKind.INTERNAL, null);
    }

    public static CallRef of(CallKind kind, String contract, String name) {
        return new CallRef(contract, name, null, kind, null);
    }

    public String signature() {
        return parameters == null ? null : FunctionFacts.signatureOf(name, parameters);
    }
}
