package io.github.trackidity.flow_finder.model;

import java.util.List;
import java.util.Optional;

/**
 * Everything a single entry point can write, with the traversal statistics.
 *
 * @param truncated   some reachable unit lies beyond the depth bound
 * @param deepestLevel the largest call depth reached
 * @param cycleEdges  back-edges met during traversal
 */
public record TraceResult(
        EntryPoint entryPoint,
        List<WriteEdge> writes,
        boolean truncated,
        int visitedUnits,
        int deepestLevel,
        int cycleEdges
) {

    public TraceResult {
        writes = List.copyOf(writes);
    }

    public Optional<WriteEdge> writeOf(VariableKey variable) {
        return writes.stream().filter(w -> w.variable().equals(variable)).findFirst();
    }
}
