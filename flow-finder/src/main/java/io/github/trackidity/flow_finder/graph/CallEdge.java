package io.github.trackidity.flow_finder.graph;

import io.github.trackidity.flow_finder.model.CallKind;
import io.github.trackidity.flow_finder.model.Location;

/**
 * An out-edge of a callable unit. {@code target} is the callee's handle, or
 * {@link #NO_TARGET} for external calls, built-ins and unresolved targets.
 */
public record CallEdge(CallKind kind, int target, String label, String contract, Location location) {

    public static final int NO_TARGET = -1;

    public boolean isTraversable() {
        return target != NO_TARGET;
    }
}
