package io.flowdeck.core.validation;

import io.flowdeck.core.graph.GraphEdge;
import io.flowdeck.core.graph.GraphNode;
import io.flowdeck.core.graph.WorkflowGraph;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/// Checks a canvas graph against the round-trip invariants.
///
/// ### Checks
/// - node ids are unique
/// - every node has a sequence number and together they are exactly `1..n`
/// - every edge references existing nodes
/// - every edge joins nodes whose sequence numbers differ by exactly +1
/// - a node's config, when present, carries the node id as its `taskReferenceName`
public class GraphValidator {

    /// Returns every issue in the graph without throwing.
    ///
    /// @param graph the graph, not null
    /// @return issues in discovery order, empty if the graph is valid
    public List<ValidationIssue> findIssues(WorkflowGraph graph) {
        Objects.requireNonNull(graph, "graph");
        List<ValidationIssue> issues = new ArrayList<>();
        Map<String, GraphNode> byId = new HashMap<>();
        TreeSet<Integer> sequenceNumbers = new TreeSet<>();
        int sequenced = 0;

        List<GraphNode> nodes = graph.nodes();
        for (int i = 0; i < nodes.size(); i++) {
            GraphNode node = nodes.get(i);
            String path = "nodes[" + i + "]";
            if (byId.putIfAbsent(node.getId(), node) != null) {
                issues.add(
                        new ValidationIssue(
                                IssueType.DUPLICATE_NODE_ID,
                                path,
                                "node id '" + node.getId() + "' is not unique"));
            }
            if (node.getSequenceNo() == null) {
                issues.add(
                        new ValidationIssue(
                                IssueType.MISSING_SEQUENCE_NO,
                                path,
                                "node '" + node.getId() + "' has no sequenceNo"));
            } else {
                sequenceNumbers.add(node.getSequenceNo());
                sequenced++;
            }
            if (node.getConfig() != null
                    && node.getConfig().getTaskReferenceName() != null
                    && !node.getId().equals(node.getConfig().getTaskReferenceName())) {
                issues.add(
                        new ValidationIssue(
                                IssueType.CONFIG_ID_MISMATCH,
                                path,
                                "node '"
                                        + node.getId()
                                        + "' wraps task '"
                                        + node.getConfig().getTaskReferenceName()
                                        + "'"));
            }
        }

        if (sequenced > 0 && !isContiguousFromOne(sequenceNumbers, sequenced)) {
            issues.add(
                    new ValidationIssue(
                            IssueType.NON_CONTIGUOUS_SEQUENCE,
                            "nodes",
                            "sequence numbers "
                                    + sequenceNumbers
                                    + " are not exactly 1.."
                                    + sequenced));
        }

        List<GraphEdge> edges = graph.edges();
        for (int i = 0; i < edges.size(); i++) {
            checkEdge(edges.get(i), "edges[" + i + "]", byId, issues);
        }
        return issues;
    }

    /// Validates the graph.
    ///
    /// @param graph the graph, not null
    /// @throws WorkflowValidationException listing every issue, if any
    public void validate(WorkflowGraph graph) {
        List<ValidationIssue> issues = findIssues(graph);
        if (!issues.isEmpty()) {
            throw new WorkflowValidationException(issues);
        }
    }

    private static void checkEdge(
            GraphEdge edge,
            String path,
            Map<String, GraphNode> byId,
            List<ValidationIssue> issues) {
        GraphNode source = byId.get(edge.source());
        GraphNode target = byId.get(edge.target());
        if (source == null || target == null) {
            issues.add(
                    new ValidationIssue(
                            IssueType.DANGLING_EDGE,
                            path,
                            "edge '"
                                    + edge.id()
                                    + "' references unknown node '"
                                    + (source == null ? edge.source() : edge.target())
                                    + "'"));
            return;
        }
        if (source.getSequenceNo() == null || target.getSequenceNo() == null) {
            return; // already reported as MISSING_SEQUENCE_NO
        }
        if (target.getSequenceNo() != source.getSequenceNo() + 1) {
            issues.add(
                    new ValidationIssue(
                            IssueType.NON_SEQUENTIAL_EDGE,
                            path,
                            "edge '"
                                    + edge.id()
                                    + "' joins sequence "
                                    + source.getSequenceNo()
                                    + " to "
                                    + target.getSequenceNo()));
        }
    }

    // Duplicates collapse in the set, so a size mismatch also catches repeats.
    private static boolean isContiguousFromOne(TreeSet<Integer> numbers, int expectedCount) {
        return numbers.size() == expectedCount
                && numbers.first() == 1
                && numbers.last() == expectedCount;
    }
}
