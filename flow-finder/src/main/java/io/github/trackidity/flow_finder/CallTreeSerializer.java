package io.github.trackidity.flow_finder;

import io.github.trackidity.flow_finder.graph.CallEdge;
import io.github.trackidity.flow_finder.graph.CallGraph;
import io.github.trackidity.flow_finder.graph.CallableUnit;
import io.github.trackidity.flow_finder.model.CallTreeNode;
import io.github.trackidity.flow_finder.model.EntryPoint;
import io.github.trackidity.flow_finder.model.NodeStatus;

import java.util.*;

/**
 * Renders the call graph below an entry point as a finite tree for display.
 * <p>
 * A unit already on the path from the root is emitted as a cycle leaf, and children past
 * {@code max-depth} as truncated leaves, so every tree is finite even for recursive code.
 * The same unit may appear in several branches; every expansion after the first is
 * flagged as shared.
 */
public class CallTreeSerializer {

    private final AnalysisContext context;

    public CallTreeSerializer(AnalysisContext context) {
        this.context = context;
    }

    /**
     * The children of the entry point's root node.
     */
    public List<CallTreeNode> serialize(CallGraph graph, EntryPoint entryPoint) {
        int root = graph.handleOf(CallableUnit.idOf(entryPoint.declaringContract(), entryPoint.function()))
                .orElseThrow(() -> new IllegalStateException("Entry point " + entryPoint.flowId()
                        + " is not part of the call graph"));
        Deque<Integer> path = new ArrayDeque<>();
        path.push(root);
        return children(graph, root, 1, path, new HashSet<>());
    }

    private List<CallTreeNode> children(CallGraph graph, int handle, int depth, Deque<Integer> path,
                                        Set<Integer> expanded) {
        List<CallTreeNode> nodes = new ArrayList<>();
        for (CallEdge edge : graph.callsFrom(handle)) {
            nodes.add(node(graph, edge, depth, path, expanded));
        }
        return nodes;
    }

    private CallTreeNode node(CallGraph graph, CallEdge edge, int depth, Deque<Integer> path, Set<Integer> expanded) {
        String kindLabel = edge.kind().displayLabel();
        if (!edge.isTraversable()) {
            String tooltip = edge.contract() != null ? edge.contract() + "." + edge.label() : edge.label();
            return new CallTreeNode(edge.label(), edge.contract(), kindLabel, tooltip, edge.location(),
                    NodeStatus.LEAF, false, null, List.of());
        }
        int target = edge.target();
        CallableUnit unit = graph.unit(target);
        String label = unit.name();
        String contract = unit.contract().name();
        String tooltip = unit.canonicalName();
        if (path.contains(target)) {
            return new CallTreeNode(label, contract, kindLabel, tooltip, unit.location(), NodeStatus.CYCLE, false,
                    unit.id(), List.of());
        }
        if (depth > context.config().maxDepth()) {
            return new CallTreeNode(label, contract, kindLabel, tooltip, unit.location(), NodeStatus.TRUNCATED, false,
                    null, List.of());
        }
        if (context.config().collapseDependencies() && context.isDependency(unit.contract())) {
            return new CallTreeNode(label, contract, kindLabel, tooltip, unit.location(), NodeStatus.COLLAPSED, false,
                    null, List.of());
        }
        boolean shared = !expanded.add(target);
        path.push(target);
        List<CallTreeNode> calls = children(graph, target, depth + 1, path, expanded);
        path.pop();
        return new CallTreeNode(label, contract, kindLabel, tooltip, unit.location(), NodeStatus.EXPANDED, shared,
                null, calls);
    }
}
