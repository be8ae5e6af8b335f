package io.flowdeck.core.graph;

import java.util.Objects;

/// Directed connection between two canvas nodes.
///
/// Edges only ever connect nodes whose sequence numbers differ by exactly one; branching is
/// configured inside a task, never drawn.
///
/// @param id unique edge identifier, not null
/// @param source id of the upstream node, not null
/// @param target id of the downstream node, not null
/// @param sourceHandle attachment side on the source node, null for the canvas default
/// @param targetHandle attachment side on the target node, null for the canvas default
/// @param animated whether the canvas animates the edge
/// @param type rendering path, not null
/// @param style stroke styling, not null
public record GraphEdge(
        String id,
        String source,
        String target,
        AnchorSide sourceHandle,
        AnchorSide targetHandle,
        boolean animated,
        EdgeType type,
        EdgeStyle style) {

    public GraphEdge {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(style, "style");
    }

    /// Creates an animated straight sequence edge without explicit handles.
    public static GraphEdge straight(String id, String source, String target) {
        return new GraphEdge(
                id, source, target, null, null, true, EdgeType.STRAIGHT, EdgeStyle.SEQUENCE);
    }

    /// Creates an animated straight sequence edge attached to the given sides.
    public static GraphEdge anchored(
            String id,
            String source,
            String target,
            AnchorSide sourceHandle,
            AnchorSide targetHandle) {
        return new GraphEdge(
                id,
                source,
                target,
                sourceHandle,
                targetHandle,
                true,
                EdgeType.STRAIGHT,
                EdgeStyle.SEQUENCE);
    }

    /// Creates the animated bezier edge drawn by hand between two neighbours.
    public static GraphEdge drawn(
            String id,
            String source,
            String target,
            AnchorSide sourceHandle,
            AnchorSide targetHandle) {
        return new GraphEdge(
                id,
                source,
                target,
                sourceHandle,
                targetHandle,
                true,
                EdgeType.BEZIER,
                EdgeStyle.SEQUENCE);
    }

    /// Whether this edge touches the given node.
    public boolean touches(String nodeId) {
        return source.equals(nodeId) || target.equals(nodeId);
    }
}
