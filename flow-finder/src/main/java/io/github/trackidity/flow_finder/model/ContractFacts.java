package io.github.trackidity.flow_finder.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A contract as supplied by the front-end, identified by (file, name).
 * {@code linearization}, when present, is the front-end's own most-derived-first
 * ancestor order (excluding the contract itself).
 */
public record ContractFacts(
        String file,
        String name,
        ContractKind kind,
        @JsonProperty("isDependency") boolean dependency,
        List<String> bases,
        List<String> linearization,
        List<FunctionFacts> functions,
        List<ModifierFacts> modifiers,
        List<StateVariableFacts> stateVariables,
        Location location
) {

    public ContractFacts {
        kind = kind == null ? ContractKind.CONTRACT : kind;
        bases = bases == null ? List.of() : List.copyOf(bases);
        linearization = linearization == null ? null : List.copyOf(linearization);
        functions = functions == null ? List.of() : List.copyOf(functions);
        modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
        stateVariables = stateVariables == null ? List.of() : List.copyOf(stateVariables);
    }

    @JsonIgnore
    public ContractId id() {
        return new ContractId(file, name);
    }
}
