package io.github.trackidity.flow_finder.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Output form of an entry point, with its call tree.
 */
@JsonPropertyOrder({"flowId", "label", "contract", "inherited", "inheritedFrom", "tooltip", "location", "calls"})
public record EntryPointView(
        String flowId,
        String label,
        String contract,
        boolean inherited,
        String inheritedFrom,
        String tooltip,
        Location location,
        List<CallTreeNode> calls
) {
}
