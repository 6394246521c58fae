package io.github.trackidity.flow_finder.model;

import java.util.List;

public record ModifierFacts(String name, List<CallRef> calls, List<WriteRef> writes, Location location) {

    public ModifierFacts {
        calls = calls == null ? List.of() : List.copyOf(calls);
        writes = writes == null ? List.of() : List.copyOf(writes);
    }
}
