package io.github.trackidity.flow_finder.model;

import java.util.*;

/**
 * The flattened, override-resolved view of a contract.
 * {@code precedence} starts with the contract itself, followed by its ancestors in
 * most-derived-first order. Maps keep the precedence order of their winners.
 */
public record EffectiveContract(
        ContractFacts contract,
        List<ContractFacts> precedence,
        Map<String, Member<FunctionFacts>> functions,
        Map<String, Member<ModifierFacts>> modifiers,
        Map<String, Member<StateVariableFacts>> variables,
        List<String> warnings
) {

    public EffectiveContract {
        precedence = List.copyOf(precedence);
        functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
        modifiers = Collections.unmodifiableMap(new LinkedHashMap<>(modifiers));
        variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        warnings = List.copyOf(warnings);
    }

    public String name() {
        return contract.name();
    }

    public Optional<Member<FunctionFacts>> function(String signature) {
        return Optional.ofNullable(functions.get(signature));
    }

    /**
     * Looks a function up by bare name, for call edges that carry no parameter types.
     * The first winner in precedence order is taken when the name is overloaded.
     */
    public Optional<Member<FunctionFacts>> functionNamed(String name) {
        return functions.values().stream()
                .filter(m -> m.declaration().name().equals(name))
                .findFirst();
    }

    public Optional<Member<ModifierFacts>> modifier(String name) {
        return Optional.ofNullable(modifiers.get(name));
    }

    public Optional<Member<StateVariableFacts>> variable(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public boolean isAncestorOrSelf(ContractId id) {
        return precedence.stream().anyMatch(c -> c.id().equals(id));
    }

    /**
     * Ancestors only, most-derived first.
     */
    public List<ContractFacts> ancestors() {
        return precedence.subList(1, precedence.size());
    }
}
