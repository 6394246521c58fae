package io.github.trackidity.flow_finder.model;

/**
 * A direct write of a state variable. The declaring contract is optional and
 * resolved through inheritance when absent.
 */
public record WriteRef(String variable, String contract) {

    public static WriteRef of(String variable) {
        return new WriteRef(variable, null);
    }
}
