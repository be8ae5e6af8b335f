package io.flowdeck.core.graph;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Flat canvas representation of a workflow: top-level task nodes plus the sequence edges
/// that join them.
///
/// @param nodes canvas nodes, not null
/// @param edges canvas edges, not null
public record WorkflowGraph(List<GraphNode> nodes, List<GraphEdge> edges) {

    private static final WorkflowGraph EMPTY = new WorkflowGraph(List.of(), List.of());

    public WorkflowGraph {
        nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
        edges = List.copyOf(Objects.requireNonNull(edges, "edges"));
    }

    public static WorkflowGraph empty() {
        return EMPTY;
    }

    /// Finds a node by id.
    ///
    /// @param id node id, not null
    /// @return the node, or empty if no node has this id
    public Optional<GraphNode> findNode(String id) {
        for (GraphNode node : nodes) {
            if (node.getId().equals(id)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
