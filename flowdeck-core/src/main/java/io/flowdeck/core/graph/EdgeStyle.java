package io.flowdeck.core.graph;

import java.util.Objects;

/// Stroke styling of a canvas edge.
///
/// @param stroke CSS color of the line, not null
/// @param strokeWidth line width in pixels, positive
public record EdgeStyle(String stroke, double strokeWidth) {

    /// Style used for every synthesized sequence edge.
    public static final EdgeStyle SEQUENCE = new EdgeStyle("#00bcd4", 2);

    public EdgeStyle {
        Objects.requireNonNull(stroke, "stroke");
    }
}
