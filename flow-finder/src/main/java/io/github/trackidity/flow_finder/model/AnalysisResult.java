package io.github.trackidity.flow_finder.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * The result handed to the presentation layer. A failed run only carries the error.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"version", "ok", "error", "files", "variables", "diagnostics"})
public record AnalysisResult(
        int version,
        boolean ok,
        String error,
        List<FileEntryPoints> files,
        List<VariableGroup> variables,
        List<Diagnostic> diagnostics
) {

    public static final int FORMAT_VERSION = 1;

    public static AnalysisResult success(List<FileEntryPoints> files, List<VariableGroup> variables,
                                         List<Diagnostic> diagnostics) {
        return new AnalysisResult(FORMAT_VERSION, true, null, files, variables, diagnostics);
    }

    public static AnalysisResult failure(String error) {
        return new AnalysisResult(FORMAT_VERSION, false, error, null, null, null);
    }
}
