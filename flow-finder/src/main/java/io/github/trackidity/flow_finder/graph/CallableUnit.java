package io.github.trackidity.flow_finder.graph;

import io.github.trackidity.flow_finder.model.*;

import java.util.List;

/**
 * A function or modifier stored in a call graph arena under an integer handle.
 * Exactly one of {@code function} and {@code modifier} is set.
 */
public record CallableUnit(int handle, ContractFacts contract, FunctionFacts function, ModifierFacts modifier) {

    public static String idOf(ContractFacts contract, FunctionFacts function) {
        return contract.file() + ":" + contract.name() + "." + function.signature();
    }

    public static String idOf(ContractFacts contract, ModifierFacts modifier) {
        return contract.file() + ":" + contract.name() + "." + modifier.name();
    }

    public boolean isModifier() {
        return modifier != null;
    }

    public boolean isConstructor() {
        return function != null && function.constructor();
    }

    /**
     * Unique within an analysis unit, stable across runs.
     */
    public String id() {
        return isModifier() ? idOf(contract, modifier) : idOf(contract, function);
    }

    public String name() {
        return isModifier() ? modifier.name() : function.name();
    }

    public String canonicalName() {
        return contract.name() + "." + (isModifier() ? modifier.name() : function.signature());
    }

    public List<CallRef> calls() {
        return isModifier() ? modifier.calls() : function.calls();
    }

    public List<WriteRef> writes() {
        return isModifier() ? modifier.writes() : function.writes();
    }

    public List<String> modifierRefs() {
        return isModifier() ? List.of() : function.modifiers();
    }

    public Location location() {
        Location location = isModifier() ? modifier.location() : function.location();
        return location != null ? location : Location.unknown(contract.file());
    }
}
