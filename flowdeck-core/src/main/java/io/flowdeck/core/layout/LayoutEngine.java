package io.flowdeck.core.layout;

import io.flowdeck.core.graph.GraphEdge;
import io.flowdeck.core.graph.GraphNode;
import io.flowdeck.core.graph.Position;
import io.flowdeck.core.graph.WorkflowGraph;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Deterministic snake (boustrophedon) layout for the designer canvas.
///
/// Nodes are placed left-to-right on even rows and right-to-left on odd rows, so consecutive
/// tasks always sit next to each other and the reading direction "snakes" down the canvas:
///
/// ```
///  1 → 2 → 3 → 4 → 5
///                  ↓
/// 10 ← 9 ← 8 ← 7 ← 6
/// ↓
/// 11 → ...
/// ```
///
/// Edges inside a row connect right→left handles; the edge that turns a row connects
/// bottom→top.
///
/// @implNote Stateless and thread-safe. Inputs are never mutated; every call returns new node
/// and edge lists.
public class LayoutEngine {

    private static final Logger logger = Logger.getLogger(LayoutEngine.class.getName());

    private static final Comparator<GraphNode> BY_SEQUENCE =
            Comparator.comparingInt(GraphNode::sequenceOrZero);

    private final LayoutConfig config;

    public LayoutEngine() {
        this(LayoutConfig.DEFAULTS);
    }

    public LayoutEngine(LayoutConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public LayoutConfig getConfig() {
        return config;
    }

    /// Lays out the nodes on the snake grid and synthesizes the sequence edges.
    ///
    /// Nodes are stable-sorted by sequence number (missing numbers first, ties keep input
    /// order) and renumbered `1..n` in that order.
    ///
    /// @param nodes nodes to arrange, not null
    /// @return positioned nodes in sequence order plus their connecting edges, never null
    public WorkflowGraph arrange(List<GraphNode> nodes) {
        Objects.requireNonNull(nodes, "nodes");
        if (nodes.isEmpty()) {
            return WorkflowGraph.empty();
        }

        List<GraphNode> sorted = sortBySequence(nodes);
        List<GraphNode> arranged = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            arranged.add(
                    sorted.get(i).toBuilder().position(positionFor(i)).sequenceNo(i + 1).build());
        }

        logger.fine("Arranged " + arranged.size() + " nodes in snake layout");
        return new WorkflowGraph(arranged, linkEdges(arranged));
    }

    /// Computes the snake-grid slot for a 0-based sequence index.
    ///
    /// @param index 0-based position in sequence order, not negative
    /// @return canvas position, never null
    public Position positionFor(int index) {
        int row = index / config.nodesPerRow();
        int col = index % config.nodesPerRow();
        int actualCol = row % 2 == 1 ? config.nodesPerRow() - 1 - col : col;
        return new Position(
                config.originX() + actualCol * config.horizontalSpacing(),
                config.originY() + row * config.verticalSpacing());
    }

    /// Picks handles for the edge from index `sourceIndex` to `sourceIndex + 1`.
    ///
    /// @param sourceIndex 0-based index of the upstream node
    /// @return right→left within a row, bottom→top when the edge turns a row
    public EdgeAnchors anchorsFor(int sourceIndex) {
        int sourceRow = sourceIndex / config.nodesPerRow();
        int targetRow = (sourceIndex + 1) / config.nodesPerRow();
        return sourceRow == targetRow ? EdgeAnchors.SAME_ROW : EdgeAnchors.ROW_TRANSITION;
    }

    /// Builds the minimal edge set joining consecutive nodes of an already ordered list.
    ///
    /// @param orderedNodes nodes in sequence order, not null
    /// @return `n - 1` edges, never null
    public List<GraphEdge> linkEdges(List<GraphNode> orderedNodes) {
        List<GraphEdge> edges = new ArrayList<>(Math.max(0, orderedNodes.size() - 1));
        for (int i = 0; i < orderedNodes.size() - 1; i++) {
            edges.add(edgeBetween(orderedNodes.get(i), orderedNodes.get(i + 1), i));
        }
        return edges;
    }

    /// Creates the sequence edge between two neighbours.
    ///
    /// @param source upstream node, not null
    /// @param target downstream node, not null
    /// @param sourceIndex 0-based sequence index of the upstream node
    /// @return edge with id `{source}-{target}`, never null
    public GraphEdge edgeBetween(GraphNode source, GraphNode target, int sourceIndex) {
        EdgeAnchors anchors = anchorsFor(sourceIndex);
        return GraphEdge.anchored(
                source.getId() + "-" + target.getId(),
                source.getId(),
                target.getId(),
                anchors.source(),
                anchors.target());
    }

    /// Detects whether nodes still sit in the initial single-row placement produced by
    /// projection, i.e. every node `i` is at `x = first.x + i * linearSpacing` and `y = 0`.
    ///
    /// Only such graphs are auto-arranged on load; anything else is a layout the user (or a
    /// previous save) chose and must be left alone.
    ///
    /// @param nodes nodes in list order, not null
    /// @return true if the placement is linear; always false for fewer than two nodes
    public boolean isLinearLayout(List<GraphNode> nodes) {
        Objects.requireNonNull(nodes, "nodes");
        if (nodes.size() <= 1) {
            return false;
        }
        double firstX = nodes.get(0).getPosition().x();
        for (int i = 0; i < nodes.size(); i++) {
            Position p = nodes.get(i).getPosition();
            if (p.x() != firstX + i * config.linearSpacing() || p.y() != 0) {
                return false;
            }
        }
        return true;
    }

    /// Stable sort by sequence number; the input list is left untouched.
    ///
    /// @param nodes nodes to sort, not null
    /// @return new sorted list, never null
    public static List<GraphNode> sortBySequence(List<GraphNode> nodes) {
        List<GraphNode> sorted = new ArrayList<>(nodes);
        sorted.sort(BY_SEQUENCE);
        return sorted;
    }
}
