package io.flowdeck.core.graph;

/// Canvas coordinates of a node's top-left corner.
///
/// @param x horizontal offset in canvas units
/// @param y vertical offset in canvas units
public record Position(double x, double y) {

    public static final Position ORIGIN = new Position(0, 0);
}
