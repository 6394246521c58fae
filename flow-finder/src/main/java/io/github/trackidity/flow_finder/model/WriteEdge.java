package io.github.trackidity.flow_finder.model;

import java.util.List;

/**
 * A state variable write reachable from an entry point. {@code path} lists the unit
 * labels from the entry point to the writing unit along the shortest path found.
 */
public record WriteEdge(
        VariableKey variable,
        EntryPoint entryPoint,
        WriteKind kind,
        int pathLength,
        List<String> path
) {

    public WriteEdge {
        path = List.copyOf(path);
    }
}
