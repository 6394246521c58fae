package io.github.trackidity.flow_finder.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"path", "contract", "vars"})
public record VariableGroup(String path, String contract, List<VariableView> vars) {
}
