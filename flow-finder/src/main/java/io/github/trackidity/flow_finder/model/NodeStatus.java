package io.github.trackidity.flow_finder.model;

public enum NodeStatus {
    EXPANDED,
    LEAF,
    CYCLE,
    TRUNCATED,
    COLLAPSED
}
