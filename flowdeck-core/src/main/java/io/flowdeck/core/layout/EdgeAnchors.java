package io.flowdeck.core.layout;

import io.flowdeck.core.graph.AnchorSide;

/// Pair of attachment sides for one sequence edge.
///
/// @param source side of the upstream node
/// @param target side of the downstream node
public record EdgeAnchors(AnchorSide source, AnchorSide target) {

    public static final EdgeAnchors SAME_ROW = new EdgeAnchors(AnchorSide.RIGHT, AnchorSide.LEFT);
    public static final EdgeAnchors ROW_TRANSITION =
            new EdgeAnchors(AnchorSide.BOTTOM, AnchorSide.TOP);
}
