package io.github.trackidity.flow_finder.utils;

import io.github.trackidity.flow_finder.model.ContractFacts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.*;

/**
 * This class decides which source files are dropped before analysis (filter paths) and
 * which ones hold dependency code. A file is dependency code when one of its path
 * segments is a dependency directory such as {@code lib} or {@code node_modules}.
 */
public class PathClassifier {

    private static final Logger log = LoggerFactory.getLogger(PathClassifier.class);
    private static final String DEFAULT_DEPENDENCY_FILE = "dependency_directories.txt";
    private static final List<String> builtinDependencyDirectories = Arrays.asList(
            "lib", "node_modules"
    );

    private final Set<String> dependencyDirectories;
    private final List<String> filterPatterns;
    private final List<PathMatcher> filterMatchers;

    public PathClassifier(Collection<String> dependencyDirectories, List<String> filterPaths) {
        this.dependencyDirectories = new LinkedHashSet<>(dependencyDirectories);
        this.filterPatterns = List.copyOf(filterPaths);
        this.filterMatchers = new ArrayList<>();
        for (String pattern : filterPatterns) {
            if (isGlob(pattern)) {
                filterMatchers.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
            }
        }
    }

    /**
     * Creates a classifier with the given directories, or with the bundled list when
     * {@code dependencyDirectories} is null.
     */
    public static PathClassifier create(List<String> dependencyDirectories, List<String> filterPaths) {
        Collection<String> directories = dependencyDirectories != null
                ? dependencyDirectories
                : loadDependencyDirectories();
        return new PathClassifier(directories, filterPaths);
    }

    /**
     * Loads dependency directory names from the bundled resource file.
     *
     * @return A set of directory names that mark dependency code.
     */
    public static Set<String> loadDependencyDirectories() {
        Set<String> directories = new LinkedHashSet<>(builtinDependencyDirectories);
        try (InputStream in = PathClassifier.class.getClassLoader().getResourceAsStream(DEFAULT_DEPENDENCY_FILE)) {
            if (in != null) {
                try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                    reader.lines()
                            .map(String::trim)
                            // # is to allow comments
                            .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                            .forEach(directories::add);
                }
            } else {
                log.warn("Dependency directories file not found: {}", DEFAULT_DEPENDENCY_FILE);
            }
        } catch (IOException e) {
            log.error("Error reading dependency directories file: {}", DEFAULT_DEPENDENCY_FILE, e);
        }
        return directories;
    }

    /**
     * Checks whether a file holds dependency code.
     *
     * @param file The file path, relative to the workspace root or absolute.
     * @return true if any path segment is a dependency directory.
     */
    public boolean isDependencyFile(String file) {
        if (file == null || file.isEmpty()) {
            return false;
        }
        for (String part : normalize(file).split("/")) {
            if (dependencyDirectories.contains(part)) {
                return true;
            }
        }
        return false;
    }

    /**
     * A contract is dependency code when the front-end says so or its file says so.
     */
    public boolean isDependency(ContractFacts contract) {
        return contract.dependency() || isDependencyFile(contract.file());
    }

    /**
     * Checks whether a file matches one of the filter paths and must be dropped.
     * Glob patterns are matched against the whole path, plain patterns as substrings.
     */
    public boolean isFiltered(String file) {
        if (file == null || filterPatterns.isEmpty()) {
            return false;
        }
        String normalized = normalize(file);
        Path path = Path.of(normalized);
        for (PathMatcher matcher : filterMatchers) {
            if (matcher.matches(path)) {
                return true;
            }
        }
        for (String pattern : filterPatterns) {
            if (!isGlob(pattern) && normalized.contains(normalize(pattern))) {
                return true;
            }
        }
        return false;
    }

    public Set<String> dependencyDirectories() {
        return Collections.unmodifiableSet(dependencyDirectories);
    }

    private static boolean isGlob(String pattern) {
        return pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0 || pattern.indexOf('{') >= 0
                || pattern.indexOf('[') >= 0;
    }

    private static String normalize(String file) {
        return file.replace('\\', '/');
    }
}
