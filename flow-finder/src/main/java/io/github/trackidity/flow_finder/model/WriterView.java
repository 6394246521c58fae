package io.github.trackidity.flow_finder.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * An entry point that writes a variable, as listed under that variable.
 */
@JsonPropertyOrder({"flowId", "label", "contract", "location", "write", "pathLength"})
public record WriterView(
        String flowId,
        String label,
        String contract,
        Location location,
        WriteKind write,
        int pathLength
) {
}
