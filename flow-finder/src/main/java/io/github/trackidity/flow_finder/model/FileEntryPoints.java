package io.github.trackidity.flow_finder.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"path", "entrypoints"})
public record FileEntryPoints(String path, List<EntryPointView> entrypoints) {
}
