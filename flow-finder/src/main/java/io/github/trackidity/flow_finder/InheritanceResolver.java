package io.github.trackidity.flow_finder;

import io.github.trackidity.flow_finder.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Linearizes every contract's inheritance chain and flattens it into an
 * {@link EffectiveContract}.
 * <p>
 * The precedence order is a C3 linearization of the base lists taken left to right: the
 * contract itself, then its ancestors with every contract ahead of its own bases and a
 * shared ancestor after all the contracts deriving from it. For every name the first
 * declaration in that order wins, so the most-derived declaration shadows the others and,
 * among unrelated bases, the first-listed base wins. An implemented function always beats
 * an unimplemented declaration of the same signature. When the front-end supplies its own
 * linearization, that order is used as is.
 */
public class InheritanceResolver {

    private static final Logger log = LoggerFactory.getLogger(InheritanceResolver.class);

    private final AnalysisContext context;
    private final Map<ContractId, List<ContractFacts>> directBases = new HashMap<>();
    private final Map<ContractId, List<String>> warnings = new HashMap<>();
    private final Map<ContractId, List<ContractFacts>> linearizations = new HashMap<>();

    public InheritanceResolver(AnalysisContext context) {
        this.context = context;
    }

    /**
     * Outcome of resolution: the effective contracts in input order, and an error for every
     * contract that could not be resolved because of an inheritance cycle.
     */
    public record Resolution(List<EffectiveContract> contracts, Map<ContractId, String> errors) {

        public boolean hasErrors() {
            return !errors.isEmpty();
        }
    }

    public Resolution resolve() {
        for (ContractFacts contract : context.contracts()) {
            directBases.put(contract.id(), resolveBases(contract));
        }
        Map<ContractId, String> errors = findCycles();
        List<EffectiveContract> resolved = new ArrayList<>();
        for (ContractFacts contract : context.contracts()) {
            if (errors.containsKey(contract.id())) {
                continue;
            }
            EffectiveContract effective = flatten(contract, precedenceOf(contract));
            context.putEffective(effective);
            resolved.add(effective);
        }
        log.info("Resolved inheritance for {} contracts ({} rejected)", resolved.size(), errors.size());
        return new Resolution(resolved, errors);
    }

    private List<ContractFacts> resolveBases(ContractFacts contract) {
        List<ContractFacts> bases = new ArrayList<>();
        for (String baseName : contract.bases()) {
            Optional<ContractFacts> base = context.resolveContract(baseName, contract.file(), contract.name());
            if (base.isPresent()) {
                ContractId id = base.get().id();
                if (bases.stream().noneMatch(b -> b.id().equals(id))) {
                    bases.add(base.get());
                }
            } else {
                addWarning(contract, "Base contract " + baseName + " not found, inheritance edge dropped");
            }
        }
        return bases;
    }

    /**
     * Depth-first search with an on-path set. Contracts on a cycle are rejected, and so is
     * every contract that inherits from a rejected one, since it has no valid linearization.
     */
    private Map<ContractId, String> findCycles() {
        Map<ContractId, String> errors = new LinkedHashMap<>();
        Set<ContractId> done = new HashSet<>();
        for (ContractFacts contract : context.contracts()) {
            findCycles(contract, new ArrayList<>(), new HashSet<>(), done, errors);
        }
        boolean changed = true;
        while (changed) {
            changed = false;
            for (ContractFacts contract : context.contracts()) {
                if (errors.containsKey(contract.id())) {
                    continue;
                }
                for (ContractFacts base : directBases.get(contract.id())) {
                    if (errors.containsKey(base.id())) {
                        errors.put(contract.id(), "Contract " + contract.name()
                                + " inherits from " + base.name() + ", which is part of an inheritance cycle");
                        changed = true;
                        break;
                    }
                }
            }
        }
        errors.forEach((id, message) -> log.error("{}: {}", id, message));
        return errors;
    }

    private void findCycles(ContractFacts contract, List<ContractFacts> path, Set<ContractId> onPath,
                            Set<ContractId> done, Map<ContractId, String> errors) {
        if (done.contains(contract.id())) {
            return;
        }
        if (onPath.contains(contract.id())) {
            List<ContractFacts> cycle = new ArrayList<>();
            for (int i = path.size() - 1; i >= 0; i--) {
                cycle.add(0, path.get(i));
                if (path.get(i).id().equals(contract.id())) {
                    break;
                }
            }
            StringJoiner chain = new StringJoiner(" -> ");
            cycle.forEach(c -> chain.add(c.name()));
            chain.add(contract.name());
            for (ContractFacts member : cycle) {
                errors.putIfAbsent(member.id(), "Inheritance cycle: " + chain);
            }
            return;
        }
        onPath.add(contract.id());
        path.add(contract);
        for (ContractFacts base : directBases.getOrDefault(contract.id(), List.of())) {
            findCycles(base, path, onPath, done, errors);
        }
        path.remove(path.size() - 1);
        onPath.remove(contract.id());
        done.add(contract.id());
    }

    /**
     * The contract itself followed by its ancestors, most-derived first.
     */
    List<ContractFacts> precedenceOf(ContractFacts contract) {
        if (contract.linearization() != null) {
            List<ContractFacts> order = new ArrayList<>();
            order.add(contract);
            for (String name : contract.linearization()) {
                if (name.equals(contract.name())) {
                    continue;
                }
                Optional<ContractFacts> ancestor = context.resolveContract(name, contract.file(), contract.name());
                if (ancestor.isPresent()) {
                    ContractId id = ancestor.get().id();
                    if (order.stream().noneMatch(c -> c.id().equals(id))) {
                        order.add(ancestor.get());
                    }
                } else {
                    addWarning(contract, "Linearized ancestor " + name + " not found, skipped");
                }
            }
            return order;
        }
        return linearize(contract);
    }

    private List<ContractFacts> linearize(ContractFacts contract) {
        List<ContractFacts> cached = linearizations.get(contract.id());
        if (cached != null) {
            return cached;
        }
        List<ContractFacts> bases = directBases.getOrDefault(contract.id(), List.of());
        List<List<ContractFacts>> sequences = new ArrayList<>();
        for (ContractFacts base : bases) {
            sequences.add(new ArrayList<>(linearize(base)));
        }
        sequences.add(new ArrayList<>(bases));
        List<ContractFacts> order = new ArrayList<>();
        order.add(contract);
        Optional<List<ContractFacts>> merged = merge(sequences);
        if (merged.isPresent()) {
            order.addAll(merged.get());
        } else {
            addWarning(contract, "No consistent linearization of the base contracts, using depth-first order");
            Map<ContractId, ContractFacts> walked = new LinkedHashMap<>();
            walk(contract, walked);
            order = new ArrayList<>(walked.values());
        }
        List<ContractFacts> result = List.copyOf(order);
        linearizations.put(contract.id(), result);
        return result;
    }

    /**
     * C3 merge: repeatedly takes the first head that does not appear in the tail of any sequence.
     */
    private static Optional<List<ContractFacts>> merge(List<List<ContractFacts>> sequences) {
        List<ContractFacts> merged = new ArrayList<>();
        while (true) {
            sequences.removeIf(List::isEmpty);
            if (sequences.isEmpty()) {
                return Optional.of(merged);
            }
            ContractFacts next = null;
            for (List<ContractFacts> sequence : sequences) {
                ContractId head = sequence.get(0).id();
                boolean inTail = sequences.stream()
                        .anyMatch(other -> other.subList(1, other.size()).stream().anyMatch(c -> c.id().equals(head)));
                if (!inTail) {
                    next = sequence.get(0);
                    break;
                }
            }
            if (next == null) {
                return Optional.empty();
            }
            merged.add(next);
            ContractId id = next.id();
            for (List<ContractFacts> sequence : sequences) {
                if (sequence.get(0).id().equals(id)) {
                    sequence.remove(0);
                }
            }
        }
    }

    private void walk(ContractFacts contract, Map<ContractId, ContractFacts> order) {
        if (order.putIfAbsent(contract.id(), contract) != null) {
            return;
        }
        for (ContractFacts base : directBases.getOrDefault(contract.id(), List.of())) {
            walk(base, order);
        }
    }

    private EffectiveContract flatten(ContractFacts contract, List<ContractFacts> precedence) {
        Map<String, Member<FunctionFacts>> functions = new LinkedHashMap<>();
        Map<String, Member<ModifierFacts>> modifiers = new LinkedHashMap<>();
        Map<String, Member<StateVariableFacts>> variables = new LinkedHashMap<>();
        for (ContractFacts declaring : precedence) {
            boolean inherited = !declaring.id().equals(contract.id());
            for (FunctionFacts function : declaring.functions()) {
                // Constructors belong to their own contract only
                if (inherited && function.constructor()) {
                    continue;
                }
                Member<FunctionFacts> current = functions.get(function.signature());
                if (current == null || (!current.declaration().implemented() && function.implemented())) {
                    functions.put(function.signature(), new Member<>(function, declaring, inherited));
                }
            }
            for (ModifierFacts modifier : declaring.modifiers()) {
                modifiers.putIfAbsent(modifier.name(), new Member<>(modifier, declaring, inherited));
            }
            for (StateVariableFacts variable : declaring.stateVariables()) {
                variables.putIfAbsent(variable.name(), new Member<>(variable, declaring, inherited));
            }
        }
        log.debug("{}: precedence {}, {} functions, {} modifiers, {} variables", contract.name(),
                precedence.stream().map(ContractFacts::name).toList(), functions.size(), modifiers.size(),
                variables.size());
        return new EffectiveContract(contract, precedence, functions, modifiers, variables,
                warnings.getOrDefault(contract.id(), List.of()));
    }

    private void addWarning(ContractFacts contract, String message) {
        warnings.computeIfAbsent(contract.id(), k -> new ArrayList<>()).add(message);
        context.warn(contract.name(), message);
    }
}
