package io.github.trackidity.flow_finder;

import io.github.trackidity.flow_finder.graph.CallEdge;
import io.github.trackidity.flow_finder.graph.CallGraph;
import io.github.trackidity.flow_finder.graph.CallableUnit;
import io.github.trackidity.flow_finder.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Collects the state variables an entry point can write, directly or through internal
 * call chains.
 * <p>
 * The search is breadth-first with a visited set keyed by unit handle, so every unit is
 * entered once at its shortest call depth and the search terminates on any graph,
 * recursive ones included. Units beyond {@code max-depth} are still visited, but what
 * they write is reported as {@link WriteKind#TRUNCATED}: unknown past the bound rather
 * than written or absent. Unless dependencies are expanded, writes made on a call path
 * that lies entirely in dependency code are left out; an entry point listed under a
 * project contract is project surface, so this only applies to dependency contracts.
 */
public class WriteReachabilityTracer {

    private static final Logger log = LoggerFactory.getLogger(WriteReachabilityTracer.class);

    private final AnalysisContext context;

    public WriteReachabilityTracer(AnalysisContext context) {
        this.context = context;
    }

    public TraceResult trace(EntryPoint entryPoint, EffectiveContract effective, CallGraph graph) {
        int root = graph.handleOf(CallableUnit.idOf(entryPoint.declaringContract(), entryPoint.function()))
                .orElseThrow(() -> new IllegalStateException("Entry point " + entryPoint.flowId()
                        + " is not part of the call graph of " + effective.name()));
        int maxDepth = context.config().maxDepth();
        boolean suppressDependencyWrites = !context.config().expandDependencies();
        int[] depth = new int[graph.size()];
        int[] parent = new int[graph.size()];
        // units reached through dependency code only; the entry point counts as project
        // surface unless the contract it is listed under is itself dependency code
        boolean[] dependencyOnly = new boolean[graph.size()];
        Arrays.fill(depth, -1);
        Arrays.fill(parent, -1);
        Set<Integer> ownModifiers = new HashSet<>();
        for (CallEdge edge : graph.callsFrom(root)) {
            if (edge.kind() == CallKind.MODIFIER && edge.isTraversable()) {
                ownModifiers.add(edge.target());
            }
        }

        Map<VariableKey, WriteEdge> writes = new LinkedHashMap<>();
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(root);
        depth[root] = 0;
        dependencyOnly[root] = context.isDependency(entryPoint.contract())
                && context.isDependency(graph.unit(root).contract());
        int visited = 0;
        int deepest = 0;
        int cycleEdges = 0;
        boolean truncated = false;
        while (!queue.isEmpty()) {
            int current = queue.poll();
            int level = depth[current];
            visited++;
            deepest = Math.max(deepest, level);
            // attached modifiers run with the entry point and sit inside any bound
            boolean attached = current == root || ownModifiers.contains(current);
            if (!attached && level > maxDepth) {
                truncated = true;
            }
            CallableUnit unit = graph.unit(current);
            if (!(suppressDependencyWrites && dependencyOnly[current])) {
                WriteKind kind = attached ? WriteKind.DIRECT
                        : level > maxDepth ? WriteKind.TRUNCATED
                        : WriteKind.TRANSITIVE;
                for (WriteRef write : unit.writes()) {
                    Optional<VariableKey> variable = resolveVariable(effective, unit, write);
                    if (variable.isEmpty()) {
                        continue;
                    }
                    WriteEdge existing = writes.get(variable.get());
                    if (existing == null || WriteKind.strongest(existing.kind(), kind) != existing.kind()) {
                        writes.put(variable.get(), new WriteEdge(variable.get(), entryPoint, kind, level,
                                pathTo(graph, parent, current)));
                    }
                }
            }
            for (CallEdge edge : graph.callsFrom(current)) {
                if (!edge.isTraversable()) {
                    continue;
                }
                int next = edge.target();
                if (depth[next] == -1) {
                    depth[next] = level + 1;
                    parent[next] = current;
                    dependencyOnly[next] = dependencyOnly[current]
                            && context.isDependency(graph.unit(next).contract());
                    queue.add(next);
                } else if (isOnPath(parent, current, next)) {
                    cycleEdges++;
                }
            }
        }
        List<WriteEdge> ordered = new ArrayList<>(writes.values());
        ordered.sort(Comparator.comparing((WriteEdge w) -> w.variable().contract())
                .thenComparing(w -> w.variable().name()));
        log.debug("{}: {} units visited, {} variables written, deepest level {}{}", entryPoint.flowId(), visited,
                ordered.size(), deepest, truncated ? " (truncated)" : "");
        return new TraceResult(entryPoint, ordered, truncated, visited, deepest, cycleEdges);
    }

    /**
     * Resolves a write the way the writing unit sees it: an explicit contract first, then the
     * declaring contract's effective variables, then the concrete contract's.
     */
    private Optional<VariableKey> resolveVariable(EffectiveContract effective, CallableUnit unit, WriteRef write) {
        Optional<Member<StateVariableFacts>> variable = Optional.empty();
        if (write.contract() != null) {
            variable = context.resolveContract(write.contract(), unit.contract().file(), effective.name())
                    .flatMap(c -> context.effective(c.id()))
                    .flatMap(e -> e.variable(write.variable()));
        }
        if (variable.isEmpty()) {
            variable = context.effective(unit.contract().id()).flatMap(e -> e.variable(write.variable()));
        }
        if (variable.isEmpty()) {
            variable = effective.variable(write.variable());
        }
        if (variable.isEmpty()) {
            context.warn(effective.name(), "Write to unknown state variable " + write.variable() + " in "
                    + unit.canonicalName());
            return Optional.empty();
        }
        return Optional.of(new VariableKey(variable.get().declaringContract().id(), write.variable()));
    }

    /**
     * Whether {@code candidate} is {@code from} itself or one of its ancestors in the BFS tree.
     */
    private static boolean isOnPath(int[] parent, int from, int candidate) {
        for (int node = from; node != -1; node = parent[node]) {
            if (node == candidate) {
                return true;
            }
        }
        return false;
    }

    private static List<String> pathTo(CallGraph graph, int[] parent, int target) {
        LinkedList<String> path = new LinkedList<>();
        for (int node = target; node != -1; node = parent[node]) {
            path.addFirst(graph.unit(node).canonicalName());
        }
        return path;
    }
}
