package io.flowdeck.core.graph;

import java.util.Locale;

/// Side of a node where an edge is attached (the canvas "handle").
public enum AnchorSide {
    TOP,
    RIGHT,
    BOTTOM,
    LEFT;

    /// @return lowercase handle id used on the canvas, never null
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// Resolves a canvas handle id.
    ///
    /// @param wireName lowercase handle id, not null
    /// @return matching side, never null
    /// @throws IllegalArgumentException if the id is not a known side
    public static AnchorSide fromWireName(String wireName) {
        return valueOf(wireName.trim().toUpperCase(Locale.ROOT));
    }
}
