package io.github.trackidity.flow_finder.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Comparator;

/**
 * A source position as reported by the front-end. Lines are 0-based.
 */
@JsonPropertyOrder({"file", "line", "character"})
public record Location(String file, int line, @JsonAlias("column") int character) {

    public static final Comparator<Location> ORDER = Comparator
            .comparing((Location l) -> l.file() == null ? "" : l.file())
            .thenComparingInt(Location::line)
            .thenComparingInt(Location::character);

    public static Location unknown(String file) {
        return new Location(file, 0, 0);
    }

    /**
     * Null-safe comparison, unknown locations sort last.
     */
    public static int compare(Location a, Location b) {
        if (a == null || b == null) {
            return a == null ? (b == null ? 0 : 1) : -1;
        }
        return ORDER.compare(a, b);
    }
}
