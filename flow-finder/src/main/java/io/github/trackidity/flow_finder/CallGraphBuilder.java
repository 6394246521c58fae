package io.github.trackidity.flow_finder;

import io.github.trackidity.flow_finder.graph.CallEdge;
import io.github.trackidity.flow_finder.graph.CallableUnit;
import io.github.trackidity.flow_finder.graph.ContractCallGraph;
import io.github.trackidity.flow_finder.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Assembles the call graph of one concrete contract from the call edges supplied by the
 * front-end. The graph is built per concrete contract because internal calls to a virtual
 * function resolve to the override that wins in that contract's effective view.
 * <p>
 * Out-edges of a unit are, in order: its attached modifiers, the base constructors (for
 * the contract's own constructor), then the body calls in source order. Units declared in
 * dependency code stay in the graph; hiding them is left to presentation.
 */
public class CallGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(CallGraphBuilder.class);

    // Solidity built-in statements/functions that are not meaningful calls
    private static final Set<String> SOLIDITY_BUILTINS = Set.of(
            "require", "assert", "revert", "return",
            "abi.encode", "abi.encodePacked", "abi.encodeWithSelector",
            "abi.encodeWithSignature", "abi.encodeCall", "abi.decode",
            "keccak256", "sha256", "ripemd160",
            "bytes.concat", "string.concat",
            "ecrecover",
            "addmod", "mulmod",
            "blockhash",
            "tload", "tstore",
            "mload", "mstore", "calldataload", "sload", "sstore",
            "signextend",
            "gasleft", "type"
    );

    private final AnalysisContext context;

    public CallGraphBuilder(AnalysisContext context) {
        this.context = context;
    }

    /**
     * Builds the graph reachable from the given entry points.
     */
    public ContractCallGraph build(EffectiveContract effective, List<EntryPoint> entryPoints) {
        ContractCallGraph graph = new ContractCallGraph(effective.name());
        Deque<Integer> worklist = new ArrayDeque<>();
        Set<Integer> built = new HashSet<>();
        for (EntryPoint entryPoint : entryPoints) {
            worklist.add(graph.intern(entryPoint.declaringContract(), entryPoint.function()));
        }
        int unresolved = 0;
        while (!worklist.isEmpty()) {
            int handle = worklist.poll();
            if (!built.add(handle)) {
                continue;
            }
            List<CallEdge> out = edgesOf(graph, effective, graph.unit(handle));
            graph.setEdges(handle, out);
            for (CallEdge edge : out) {
                if (edge.isTraversable()) {
                    if (!built.contains(edge.target())) {
                        worklist.add(edge.target());
                    }
                } else if (!edge.kind().isLeaf()) {
                    unresolved++;
                }
            }
        }
        log.debug("{}: call graph with {} units, {} unresolved edges", graph.contractName(), graph.size(), unresolved);
        return graph;
    }

    private List<CallEdge> edgesOf(ContractCallGraph graph, EffectiveContract effective, CallableUnit unit) {
        List<CallEdge> out = new ArrayList<>();
        List<ContractFacts> baseConstructors = new ArrayList<>();
        for (String modifierName : unit.modifierRefs()) {
            addModifierEdge(graph, effective, unit, modifierName, out, baseConstructors);
        }
        boolean ownConstructor = unit.isConstructor() && unit.contract().id().equals(effective.contract().id());
        if (ownConstructor) {
            addBaseConstructorEdges(graph, effective, unit, out, baseConstructors);
        }
        for (CallRef call : unit.calls()) {
            if (ownConstructor && call.kind() == CallKind.BASE_CONSTRUCTOR) {
                // already covered by the base constructor block
                continue;
            }
            addCallEdge(graph, effective, unit, call, out);
        }
        return out;
    }

    private void addModifierEdge(ContractCallGraph graph, EffectiveContract effective, CallableUnit unit,
                                 String modifierName, List<CallEdge> out, List<ContractFacts> baseConstructors) {
        Optional<Member<ModifierFacts>> modifier = effective.modifier(modifierName);
        if (modifier.isEmpty()) {
            modifier = context.effective(unit.contract().id()).flatMap(e -> e.modifier(modifierName));
        }
        if (modifier.isPresent()) {
            Member<ModifierFacts> member = modifier.get();
            int target = graph.intern(member.declaringContract(), member.declaration());
            out.add(new CallEdge(CallKind.MODIFIER, target, modifierName, member.declaringContract().name(),
                    graph.unit(target).location()));
            return;
        }
        // base constructor invoked from the modifier list, e.g. `constructor() Ownable(msg.sender)`
        if (unit.isConstructor()) {
            Optional<ContractFacts> base = context.resolveContract(modifierName, unit.contract().file(),
                    effective.name());
            if (base.isPresent() && effective.isAncestorOrSelf(base.get().id())) {
                if (unit.contract().id().equals(effective.contract().id())) {
                    // ordered with the other base constructors
                    baseConstructors.add(base.get());
                } else {
                    addConstructorEdge(graph, base.get(), out);
                }
                return;
            }
        }
        context.warn(effective.name(), "Modifier " + modifierName + " used by " + unit.canonicalName()
                + " could not be resolved");
        out.add(new CallEdge(CallKind.MODIFIER, CallEdge.NO_TARGET, modifierName, null, unit.location()));
    }

    /**
     * The contract's own constructor runs every ancestor constructor, most-base first.
     */
    private void addBaseConstructorEdges(ContractCallGraph graph, EffectiveContract effective, CallableUnit unit,
                                         List<CallEdge> out, List<ContractFacts> explicitBases) {
        for (CallRef call : unit.calls()) {
            if (call.kind() == CallKind.BASE_CONSTRUCTOR) {
                context.resolveContract(call.contract() != null ? call.contract() : call.name(),
                        unit.contract().file(), effective.name()).ifPresent(explicitBases::add);
            }
        }
        List<ContractFacts> ancestors = new ArrayList<>(effective.ancestors());
        Collections.reverse(ancestors);
        for (ContractFacts ancestor : ancestors) {
            if (constructorOf(ancestor).isPresent()) {
                addConstructorEdge(graph, ancestor, out);
            } else if (explicitBases.stream().anyMatch(b -> b.id().equals(ancestor.id()))) {
                context.info(effective.name(), "Base constructor of " + ancestor.name() + " invoked but not declared");
            }
        }
    }

    private void addConstructorEdge(ContractCallGraph graph, ContractFacts base, List<CallEdge> out) {
        constructorOf(base).ifPresent(constructor -> {
            int target = graph.intern(base, constructor);
            out.add(new CallEdge(CallKind.BASE_CONSTRUCTOR, target, constructor.name(), base.name(),
                    graph.unit(target).location()));
        });
    }

    private static Optional<FunctionFacts> constructorOf(ContractFacts contract) {
        return contract.functions().stream().filter(FunctionFacts::constructor).findFirst();
    }

    private void addCallEdge(ContractCallGraph graph, EffectiveContract effective, CallableUnit unit,
                             CallRef call, List<CallEdge> out) {
        String name = call.name();
        if (name == null || name.startsWith("revert ")) {
            // custom error reverts are not calls
            return;
        }
        Location callsite = call.location() != null ? call.location() : unit.location();
        switch (call.kind()) {
            case SOLIDITY -> {
                if (!SOLIDITY_BUILTINS.contains(name.split("\\(")[0])) {
                    out.add(new CallEdge(CallKind.SOLIDITY, CallEdge.NO_TARGET, name, null, callsite));
                }
            }
            case EXTERNAL -> out.add(new CallEdge(CallKind.EXTERNAL, CallEdge.NO_TARGET, name, call.contract(),
                    callsite));
            case BASE_CONSTRUCTOR -> {
                Optional<ContractFacts> base = context.resolveContract(
                        call.contract() != null ? call.contract() : name, unit.contract().file(), effective.name());
                if (base.isPresent() && constructorOf(base.get()).isPresent()) {
                    addConstructorEdge(graph, base.get(), out);
                } else {
                    unresolved(effective, unit, call, callsite, out);
                }
            }
            case INTERNAL, SUPER, LIBRARY, MODIFIER -> {
                Optional<Member<FunctionFacts>> target = resolveTarget(effective, unit, call);
                if (target.isEmpty()) {
                    unresolved(effective, unit, call, callsite, out);
                    return;
                }
                Member<FunctionFacts> member = target.get();
                int handle = graph.intern(member.declaringContract(), member.declaration());
                out.add(new CallEdge(call.kind(), handle, member.declaration().name(),
                        member.declaringContract().name(), graph.unit(handle).location()));
            }
        }
    }

    /**
     * Finds the declaration a call names, then redirects virtual calls to the override that
     * wins in the concrete contract.
     */
    private Optional<Member<FunctionFacts>> resolveTarget(EffectiveContract effective, CallableUnit unit,
                                                          CallRef call) {
        Optional<ContractFacts> targetContract = call.contract() == null
                ? Optional.of(unit.contract())
                : context.resolveContract(call.contract(), unit.contract().file(), effective.name());
        if (targetContract.isEmpty()) {
            return Optional.empty();
        }
        Optional<Member<FunctionFacts>> named = lookup(targetContract.get(), call);
        if (named.isEmpty()) {
            return Optional.empty();
        }
        Member<FunctionFacts> member = named.get();
        if (call.kind().isVirtual()
                && member.declaration().visibility() != Visibility.PRIVATE
                && effective.isAncestorOrSelf(member.declaringContract().id())) {
            Optional<Member<FunctionFacts>> override = effective.function(member.declaration().signature());
            if (override.isPresent() && override.get().declaration().implemented()) {
                return override;
            }
        }
        return named;
    }

    private Optional<Member<FunctionFacts>> lookup(ContractFacts contract, CallRef call) {
        Optional<EffectiveContract> scope = context.effective(contract.id());
        if (scope.isPresent()) {
            String signature = call.signature();
            return signature != null ? scope.get().function(signature) : scope.get().functionNamed(call.name());
        }
        return contract.functions().stream()
                .filter(f -> call.signature() != null
                        ? f.signature().equals(call.signature())
                        : f.name().equals(call.name()))
                .findFirst()
                .map(f -> new Member<>(f, contract, false));
    }

    private void unresolved(EffectiveContract effective, CallableUnit unit, CallRef call, Location callsite,
                            List<CallEdge> out) {
        String target = call.contract() != null ? call.contract() + "." + call.name() : call.name();
        context.warn(effective.name(), "Call target " + target + " from " + unit.canonicalName()
                + " could not be resolved");
        out.add(new CallEdge(call.kind(), CallEdge.NO_TARGET, call.name(), call.contract(), callsite));
    }
}
