package io.flowdeck.core.graph;

import java.util.Locale;

/// Rendering path of a canvas edge.
public enum EdgeType {
    STRAIGHT,
    BEZIER;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// @throws IllegalArgumentException if the name is not a known edge type
    public static EdgeType fromWireName(String wireName) {
        return valueOf(wireName.trim().toUpperCase(Locale.ROOT));
    }
}
