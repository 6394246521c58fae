package io.github.trackidity.flow_finder.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public record StateVariableFacts(
        String name,
        String type,
        @JsonProperty("isConstant") boolean constant,
        @JsonProperty("isImmutable") boolean immutable,
        Location location
) {

    /**
     * Constants and immutables cannot be written by any entry point after deployment.
     */
    @JsonIgnore
    public boolean isWritable() {
        return !constant && !immutable;
    }
}
