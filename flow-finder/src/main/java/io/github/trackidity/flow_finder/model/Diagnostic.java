package io.github.trackidity.flow_finder.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Comparator;

/**
 * A recoverable problem: an edge or reference was dropped and the run continued.
 */
@JsonPropertyOrder({"severity", "contract", "message"})
public record Diagnostic(Severity severity, String contract, String message) implements Comparable<Diagnostic> {

    public enum Severity { WARNING, INFO }

    private static final Comparator<Diagnostic> ORDER = Comparator
            .comparing(Diagnostic::severity)
            .thenComparing(d -> d.contract() == null ? "" : d.contract())
            .thenComparing(Diagnostic::message);

    public static Diagnostic warning(String contract, String message) {
        return new Diagnostic(Severity.WARNING, contract, message);
    }

    public static Diagnostic info(String contract, String message) {
        return new Diagnostic(Severity.INFO, contract, message);
    }

    @Override
    public int compareTo(Diagnostic other) {
        return ORDER.compare(this, other);
    }
}
