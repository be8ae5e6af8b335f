package io.flowdeck.core.graph;

import io.flowdeck.core.layout.LayoutConfig;
import io.flowdeck.core.task.Task;
import io.flowdeck.core.task.TaskType;
import io.flowdeck.core.task.spi.EmbeddedJsonException;
import io.flowdeck.core.task.spi.StructuralFieldParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Projects an ordered task list onto the flat canvas graph.
///
/// Each top-level task becomes exactly one node; nested branches stay inside the node's
/// config. Nodes are placed on a single row (`x = i * linearSpacing`, `y = 0`) and joined by
/// straight animated sequence edges. The {@link io.flowdeck.core.layout.LayoutEngine} may
/// later replace this placement.
///
/// ### String-encoded structural fields
/// A task whose `decisionCases`, `defaultCase`, `forkTasks` or `loopOver` arrived as JSON
/// text gets a config with those fields decoded via the configured
/// {@link StructuralFieldParser}. A field that does not decode is kept as the original
/// string; projection never fails because of it.
///
/// @implNote Pure and thread-safe: no shared state, input tasks are not modified.
/// @see GraphToTreeReducer for the inverse transform
public class GraphProjector {

    private static final Logger logger = Logger.getLogger(GraphProjector.class.getName());

    private final StructuralFieldParser parser;
    private final LayoutConfig layoutConfig;

    public GraphProjector() {
        this(StructuralFieldParser.UNSUPPORTED, LayoutConfig.DEFAULTS);
    }

    public GraphProjector(StructuralFieldParser parser) {
        this(parser, LayoutConfig.DEFAULTS);
    }

    /// @param parser decoder for string-encoded structural fields, not null
    /// @param layoutConfig source of the linear placement spacing, not null
    public GraphProjector(StructuralFieldParser parser, LayoutConfig layoutConfig) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.layoutConfig = Objects.requireNonNull(layoutConfig, "layoutConfig");
    }

    /// Projects tasks to nodes and sequence edges.
    ///
    /// @param tasks top-level tasks in execution order, not null
    /// @return graph with one node per task and `n - 1` edges, never null
    public WorkflowGraph project(List<Task> tasks) {
        Objects.requireNonNull(tasks, "tasks");

        List<GraphNode> nodes = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            nodes.add(toNode(tasks.get(i), i));
        }

        List<GraphEdge> edges = new ArrayList<>(Math.max(0, nodes.size() - 1));
        for (int i = 0; i < nodes.size() - 1; i++) {
            edges.add(
                    GraphEdge.straight(
                            "edge-" + i, nodes.get(i).getId(), nodes.get(i + 1).getId()));
        }

        logger.fine("Projected " + nodes.size() + " tasks to " + edges.size() + " edges");
        return new WorkflowGraph(nodes, edges);
    }

    /// Builds the canvas node for a single task.
    ///
    /// @param task the task, not null
    /// @param index 0-based position among top-level tasks
    /// @return node with `sequenceNo = index + 1`, never null
    public GraphNode toNode(Task task, int index) {
        String ref = task.getTaskReferenceName();
        String id = ref != null ? ref : "task-" + index;
        String label =
                ref != null ? ref : task.getName() != null ? task.getName() : "Task " + (index + 1);

        return GraphNode.builder(id)
                .position(index * layoutConfig.linearSpacing(), 0)
                .sequenceNo(index + 1)
                .label(label)
                .taskType(task.getType())
                .taskName(ref != null ? ref : task.getName())
                .taskDescription(task.getDescription())
                .color(TaskType.colorOf(task.getType()))
                .config(decodeEmbeddedFields(task))
                .build();
    }

    /// Returns a copy of the task with string-encoded structural fields decoded where possible.
    ///
    /// @param task the task, not null
    /// @return the same instance if nothing needed decoding, otherwise a decoded copy
    public Task decodeEmbeddedFields(Task task) {
        if (!hasRawStructuralField(task)) {
            return task;
        }

        Task.Builder b = task.toBuilder();
        boolean changed = false;

        if (rawString(task, Task.DECISION_CASES) instanceof String json) {
            try {
                Map<String, List<Task>> cases = parser.parseCaseMap(json);
                b.removeAttribute(Task.DECISION_CASES).decisionCases(cases);
                changed = true;
            } catch (EmbeddedJsonException e) {
                keepRaw(task, Task.DECISION_CASES, e);
            }
        }
        if (rawString(task, Task.DEFAULT_CASE) instanceof String json) {
            try {
                List<Task> defaults = parser.parseTaskList(json);
                b.removeAttribute(Task.DEFAULT_CASE).defaultCase(defaults);
                changed = true;
            } catch (EmbeddedJsonException e) {
                keepRaw(task, Task.DEFAULT_CASE, e);
            }
        }
        if (rawString(task, Task.FORK_TASKS) instanceof String json) {
            try {
                List<List<Task>> branches = parser.parseBranches(json);
                b.removeAttribute(Task.FORK_TASKS).forkTasks(branches);
                changed = true;
            } catch (EmbeddedJsonException e) {
                keepRaw(task, Task.FORK_TASKS, e);
            }
        }
        if (rawString(task, Task.LOOP_OVER) instanceof String json) {
            try {
                List<Task> body = parser.parseTaskList(json);
                b.removeAttribute(Task.LOOP_OVER).loopOver(body);
                changed = true;
            } catch (EmbeddedJsonException e) {
                keepRaw(task, Task.LOOP_OVER, e);
            }
        }

        if (!changed) {
            return task;
        }
        try {
            return b.build();
        } catch (IllegalStateException e) {
            // Decoded fields disagree with each other (e.g. both forkTasks and loopOver).
            logger.fine(
                    "Keeping raw structural fields of task '"
                            + task.getTaskReferenceName()
                            + "': "
                            + e.getMessage());
            return task;
        }
    }

    private static boolean hasRawStructuralField(Task task) {
        for (String field : Task.STRUCTURAL_FIELDS) {
            if (task.getAttribute(field) instanceof String) {
                return true;
            }
        }
        return false;
    }

    private static Object rawString(Task task, String field) {
        Object value = task.getAttribute(field);
        return value instanceof String ? value : null;
    }

    private static void keepRaw(Task task, String field, EmbeddedJsonException e) {
        logger.fine(
                "Field '"
                        + field
                        + "' of task '"
                        + task.getTaskReferenceName()
                        + "' is not valid task JSON, keeping raw value: "
                        + e.getMessage());
    }
}
