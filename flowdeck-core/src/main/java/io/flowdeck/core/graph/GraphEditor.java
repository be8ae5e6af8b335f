package io.flowdeck.core.graph;

import io.flowdeck.core.layout.EdgeAnchors;
import io.flowdeck.core.layout.LayoutEngine;
import io.flowdeck.core.task.Task;
import io.flowdeck.core.task.TaskType;
import io.flowdeck.core.validation.InvalidConnectionException;
import io.flowdeck.core.validation.IssueType;
import io.flowdeck.core.validation.ValidationIssue;
import io.flowdeck.core.validation.WorkflowValidationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Canvas editing operations.
///
/// Every operation takes a graph and returns a new one; nodes are addressed by id and replaced
/// rather than modified. New nodes are appended at the end of the sequence and placed on the
/// snake grid slot of their index.
///
/// @implNote Stateless apart from its collaborators; safe to share between threads.
public class GraphEditor {

    private static final Logger logger = Logger.getLogger(GraphEditor.class.getName());

    static final String OUT_OF_SEQUENCE_MESSAGE =
            "Tasks can only be connected in sequence order. Use Auto Arrange to reorganize.";

    private final GraphProjector projector;
    private final LayoutEngine layoutEngine;

    public GraphEditor() {
        this(new GraphProjector(), new LayoutEngine());
    }

    /// @param projector builds nodes from tasks, not null
    /// @param layoutEngine supplies grid slots and edge anchors, not null
    public GraphEditor(GraphProjector projector, LayoutEngine layoutEngine) {
        this.projector = Objects.requireNonNull(projector, "projector");
        this.layoutEngine = Objects.requireNonNull(layoutEngine, "layoutEngine");
    }

    /// Appends a configured task after the current last node.
    ///
    /// @param graph current graph, not null
    /// @param task configured task, not null
    /// @return graph with the new node and its incoming sequence edge
    /// @throws WorkflowValidationException if the task has no reference name or it is taken
    public WorkflowGraph addTask(WorkflowGraph graph, Task task) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(task, "task");

        String ref = task.getTaskReferenceName();
        if (ref == null || ref.isBlank()) {
            throw new WorkflowValidationException(
                    new ValidationIssue(
                            IssueType.MISSING_REFERENCE_NAME,
                            "task",
                            "taskReferenceName is required"));
        }
        requireUnusedId(graph, ref);

        int index = graph.nodes().size();
        GraphNode node =
                projector.toNode(task, index).withPosition(layoutEngine.positionFor(index));
        return append(graph, node);
    }

    /// Appends a node that has not been configured yet, such as a palette drop waiting for its
    /// form to be filled in. The reducer skips it until {@link #reconfigure} gives it a task.
    ///
    /// @param graph current graph, not null
    /// @param id node id, not null
    /// @param taskType palette type of the node, may be null
    /// @return graph with the placeholder appended
    /// @throws WorkflowValidationException if the id is taken
    public WorkflowGraph addPlaceholder(WorkflowGraph graph, String id, String taskType) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(id, "id");
        requireUnusedId(graph, id);

        int index = graph.nodes().size();
        GraphNode node =
                GraphNode.builder(id)
                        .position(layoutEngine.positionFor(index))
                        .sequenceNo(index + 1)
                        .taskType(taskType)
                        .taskName(id)
                        .color(TaskType.colorOf(taskType))
                        .build();
        return append(graph, node);
    }

    /// Deletes a node.
    ///
    /// Incident edges go with it, the remaining nodes are renumbered `1..n` in sequence order,
    /// and the former neighbours are joined so the chain stays connected. Positions are kept.
    ///
    /// @param graph current graph, not null
    /// @param id node to delete, not null
    /// @return graph without the node; the same graph if no node has that id
    public WorkflowGraph deleteNode(WorkflowGraph graph, String id) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(id, "id");

        List<GraphNode> ordered = LayoutEngine.sortBySequence(graph.nodes());
        int removedAt = -1;
        for (int i = 0; i < ordered.size(); i++) {
            if (ordered.get(i).getId().equals(id)) {
                removedAt = i;
                break;
            }
        }
        if (removedAt < 0) {
            logger.fine("Nothing to delete, no node '" + id + "'");
            return graph;
        }

        GraphNode previous = removedAt > 0 ? ordered.get(removedAt - 1) : null;
        GraphNode next = removedAt < ordered.size() - 1 ? ordered.get(removedAt + 1) : null;

        List<GraphNode> nodes = new ArrayList<>(ordered.size() - 1);
        for (GraphNode node : ordered) {
            if (!node.getId().equals(id)) {
                nodes.add(node.withSequenceNo(nodes.size() + 1));
            }
        }

        List<GraphEdge> edges = new ArrayList<>();
        for (GraphEdge edge : graph.edges()) {
            if (!edge.touches(id)) {
                edges.add(edge);
            }
        }
        if (previous != null && next != null) {
            edges.add(layoutEngine.edgeBetween(previous, next, removedAt - 1));
        }

        logger.fine("Deleted node '" + id + "', " + nodes.size() + " nodes remain");
        return new WorkflowGraph(nodes, edges);
    }

    /// Replaces the config of a node and refreshes the display fields derived from it.
    ///
    /// Id, position and sequence number are kept. A task without a reference name takes the
    /// node id as its reference name.
    ///
    /// @param graph current graph, not null
    /// @param id node to update, not null
    /// @param task the new config, not null
    /// @return graph with the node replaced
    /// @throws WorkflowValidationException if no node has that id, or the task's reference
    ///     name differs from it
    public WorkflowGraph reconfigure(WorkflowGraph graph, String id, Task task) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(task, "task");

        GraphNode current = requireNode(graph, id, "node");
        String ref = task.getTaskReferenceName();
        if (ref != null && !ref.equals(id)) {
            throw new WorkflowValidationException(
                    new ValidationIssue(
                            IssueType.CONFIG_ID_MISMATCH,
                            id,
                            "node '" + id + "' cannot hold task '" + ref + "'"));
        }
        Task config = ref == null ? task.toBuilder().taskReferenceName(id).build() : task;

        GraphNode updated =
                current.toBuilder()
                        .label(id)
                        .taskType(config.getType())
                        .taskName(config.getTaskReferenceName())
                        .taskDescription(config.getDescription())
                        .color(TaskType.colorOf(config.getType()))
                        .config(projector.decodeEmbeddedFields(config))
                        .build();
        return replace(graph, updated);
    }

    public WorkflowGraph connect(WorkflowGraph graph, String sourceId, String targetId) {
        return connect(graph, sourceId, targetId, null, null);
    }

    /// Draws an edge between two nodes.
    ///
    /// Only a node and its immediate successor may be joined. An existing edge between the same
    /// pair is replaced.
    ///
    /// @param graph current graph, not null
    /// @param sourceId upstream node, not null
    /// @param targetId downstream node, not null
    /// @param sourceHandle side on the source, null for right
    /// @param targetHandle side on the target, null for left
    /// @return graph with the edge added
    /// @throws InvalidConnectionException if the target is not the source's successor
    /// @throws WorkflowValidationException if either node does not exist
    public WorkflowGraph connect(
            WorkflowGraph graph,
            String sourceId,
            String targetId,
            AnchorSide sourceHandle,
            AnchorSide targetHandle) {
        Objects.requireNonNull(graph, "graph");
        GraphNode source = requireNode(graph, sourceId, "source");
        GraphNode target = requireNode(graph, targetId, "target");

        if (target.sequenceOrZero() != source.sequenceOrZero() + 1) {
            throw new InvalidConnectionException(
                    new ValidationIssue(
                            IssueType.NON_SEQUENTIAL_EDGE,
                            sourceId + "->" + targetId,
                            OUT_OF_SEQUENCE_MESSAGE));
        }

        GraphEdge edge =
                GraphEdge.drawn(
                        sourceId + "-" + targetId,
                        sourceId,
                        targetId,
                        sourceHandle != null ? sourceHandle : EdgeAnchors.SAME_ROW.source(),
                        targetHandle != null ? targetHandle : EdgeAnchors.SAME_ROW.target());

        List<GraphEdge> edges = new ArrayList<>(graph.edges().size() + 1);
        for (GraphEdge existing : graph.edges()) {
            boolean samePair =
                    existing.source().equals(sourceId) && existing.target().equals(targetId);
            if (!samePair) {
                edges.add(existing);
            }
        }
        edges.add(edge);
        return new WorkflowGraph(graph.nodes(), edges);
    }

    /// Builds a fresh, auto-arranged graph from imported tasks.
    ///
    /// @param tasks tasks in execution order, not null
    /// @return arranged graph, never null
    public WorkflowGraph importTasks(List<Task> tasks) {
        Objects.requireNonNull(tasks, "tasks");
        WorkflowGraph projected = projector.project(tasks);
        logger.info("Imported " + tasks.size() + " tasks");
        return layoutEngine.arrange(projected.nodes());
    }

    private WorkflowGraph append(WorkflowGraph graph, GraphNode node) {
        List<GraphNode> ordered = LayoutEngine.sortBySequence(graph.nodes());
        List<GraphNode> nodes = new ArrayList<>(graph.nodes());
        nodes.add(node);

        List<GraphEdge> edges = new ArrayList<>(graph.edges());
        if (!ordered.isEmpty()) {
            int lastIndex = ordered.size() - 1;
            edges.add(layoutEngine.edgeBetween(ordered.get(lastIndex), node, lastIndex));
        }
        logger.fine("Appended node '" + node.getId() + "' at sequence " + node.getSequenceNo());
        return new WorkflowGraph(nodes, edges);
    }

    private static WorkflowGraph replace(WorkflowGraph graph, GraphNode updated) {
        List<GraphNode> nodes = new ArrayList<>(graph.nodes().size());
        for (GraphNode node : graph.nodes()) {
            nodes.add(node.getId().equals(updated.getId()) ? updated : node);
        }
        return new WorkflowGraph(nodes, graph.edges());
    }

    private static GraphNode requireNode(WorkflowGraph graph, String id, String role) {
        Objects.requireNonNull(id, role);
        return graph.findNode(id)
                .orElseThrow(
                        () ->
                                new WorkflowValidationException(
                                        new ValidationIssue(
                                                IssueType.UNKNOWN_NODE,
                                                role,
                                                "no node with id '" + id + "'")));
    }

    private static void requireUnusedId(WorkflowGraph graph, String id) {
        if (graph.findNode(id).isPresent()) {
            throw new WorkflowValidationException(
                    new ValidationIssue(
                            IssueType.DUPLICATE_NODE_ID,
                            "nodes",
                            "node id '" + id + "' is already in use"));
        }
    }
}
