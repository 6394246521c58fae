package io.github.trackidity.flow_finder.model;

/**
 * How a state variable write was reached from an entry point.
 */
public enum WriteKind {
    /** Written in the entry point body or one of its attached modifiers. */
    DIRECT,
    /** Written through an internal call chain within the depth bound. */
    TRANSITIVE,
    /** Only written beyond the depth bound, so the write is unknown rather than asserted. */
    TRUNCATED;

    /**
     * The stronger of two kinds for the same variable.
     */
    public static WriteKind strongest(WriteKind a, WriteKind b) {
        return a.ordinal() <= b.ordinal() ? a : b;
    }
}
