package io.github.trackidity.flow_finder.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Run configuration. Values absent from the input document fall back to the defaults below.
 *
 * @param excludeDependencies   hide dependency contracts and do not expand dependency calls
 * @param expandDependencies    expand dependency calls and keep writes made inside dependency code
 * @param maxDepth              call depth bound for tracing and call trees
 * @param filterPaths           globs of files dropped before analysis
 * @param dependencyDirectories path segments marking a file as dependency code, null for the bundled list
 * @param includeAbstract       list entry points and variables of abstract contracts too
 */
public record AnalysisConfig(
        boolean excludeDependencies,
        boolean expandDependencies,
        int maxDepth,
        List<String> filterPaths,
        List<String> dependencyDirectories,
        boolean includeAbstract
) {

    public static final int DEFAULT_MAX_DEPTH = 10;

    public AnalysisConfig {
        filterPaths = filterPaths == null ? List.of() : List.copyOf(filterPaths);
        dependencyDirectories = dependencyDirectories == null ? null : List.copyOf(dependencyDirectories);
    }

    @JsonCreator
    public static AnalysisConfig fromJson(
            @JsonProperty("excludeDependencies") Boolean excludeDependencies,
            @JsonProperty("expandDependencies") Boolean expandDependencies,
            @JsonProperty("maxDepth") Integer maxDepth,
            @JsonProperty("filterPaths") List<String> filterPaths,
            @JsonProperty("dependencyDirectories") List<String> dependencyDirectories,
            @JsonProperty("includeAbstract") Boolean includeAbstract) {
        AnalysisConfig defaults = defaults();
        return new AnalysisConfig(
                excludeDependencies != null ? excludeDependencies : defaults.excludeDependencies(),
                expandDependencies != null ? expandDependencies : defaults.expandDependencies(),
                maxDepth != null ? maxDepth : defaults.maxDepth(),
                filterPaths,
                dependencyDirectories,
                includeAbstract != null ? includeAbstract : defaults.includeAbstract());
    }

    public static AnalysisConfig defaults() {
        return new AnalysisConfig(true, false, DEFAULT_MAX_DEPTH, List.of(), null, false);
    }

    /**
     * Dependency code is only hidden and collapsed when it is excluded and not explicitly expanded.
     */
    public boolean collapseDependencies() {
        return excludeDependencies && !expandDependencies;
    }

    public AnalysisConfig withExcludeDependencies(boolean value) {
        return new AnalysisConfig(value, expandDependencies, maxDepth,
                filterPaths, dependencyDirectories, includeAbstract);
    }

    public AnalysisConfig withExpandDependencies(boolean value) {
        return new AnalysisConfig(excludeDependencies, value, maxDepth,
                filterPaths, dependencyDirectories, includeAbstract);
    }

    public AnalysisConfig withMaxDepth(int value) {
        return new AnalysisConfig(excludeDependencies, expandDependencies, value,
                filterPaths, dependencyDirectories, includeAbstract);
    }

    public AnalysisConfig withFilterPaths(List<String> value) {
        return new AnalysisConfig(excludeDependencies, expandDependencies, maxDepth,
                value, dependencyDirectories, includeAbstract);
    }

    public AnalysisConfig withIncludeAbstract(boolean value) {
        return new AnalysisConfig(excludeDependencies, expandDependencies, maxDepth,
                filterPaths, dependencyDirectories, value);
    }
}

