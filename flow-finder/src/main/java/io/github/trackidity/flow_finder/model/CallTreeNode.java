package io.github.trackidity.flow_finder.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * One node of a serialized call tree. {@code ref} names the repeated unit of a cycle leaf.
 */
@JsonPropertyOrder({"label", "contract", "kindLabel", "tooltip", "location", "status", "cycle", "truncated",
        "shared", "ref", "calls"})
public record CallTreeNode(
        String label,
        String contract,
        String kindLabel,
        String tooltip,
        Location location,
        NodeStatus status,
        boolean shared,
        String ref,
        List<CallTreeNode> calls
) {

    public CallTreeNode {
        calls = List.copyOf(calls);
    }

    @JsonProperty("cycle")
    public boolean cycle() {
        return status == NodeStatus.CYCLE;
    }

    @JsonProperty("truncated")
    public boolean truncated() {
        return status == NodeStatus.TRUNCATED;
    }
}
