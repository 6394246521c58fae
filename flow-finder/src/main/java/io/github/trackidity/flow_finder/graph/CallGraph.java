package io.github.trackidity.flow_finder.graph;

import java.util.List;
import java.util.OptionalInt;

/**
 * A read-only call graph of callable units addressed by integer handles.
 */
public interface CallGraph {

    CallableUnit unit(int handle);

    /**
     * Out-edges in execution order: attached modifiers, base constructors, then body calls.
     */
    List<CallEdge> callsFrom(int handle);

    OptionalInt handleOf(String unitId);

    int size();
}
