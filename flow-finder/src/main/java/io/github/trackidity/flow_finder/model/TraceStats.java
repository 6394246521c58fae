package io.github.trackidity.flow_finder.model;

/**
 * Statistics about the traversal from one entry point
 */
public record TraceStats(
        String flowId,
        int visitedUnits,
        int writes,
        int deepestLevel,
        boolean truncated,
        int cycleEdges
) {

    public static TraceStats of(TraceResult trace) {
        return new TraceStats(trace.entryPoint().flowId(), trace.visitedUnits(), trace.writes().size(),
                trace.deepestLevel(), trace.truncated(), trace.cycleEdges());
    }

    @Override
    public String toString() {
        return String.format("%s - Units: %d, Writes: %d, Deepest: %d, Truncated: %b, Cycles: %d",
                flowId, visitedUnits, writes, deepestLevel, truncated, cycleEdges);
    }
}
