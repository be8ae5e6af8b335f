package io.flowdeck.core.graph;

import io.flowdeck.core.layout.LayoutEngine;
import io.flowdeck.core.task.Task;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Rebuilds the ordered task list from an edited canvas graph.
///
/// ### Reduction steps
/// 1. Stable-sort nodes by sequence number (missing numbers sort first, ties keep input order).
/// 2. Drop nodes without a config: they are drops that were never configured.
/// 3. When the source definition's tasks are supplied, let a {@link ReconciliationPolicy}
///    choose between the node's config and the original task with the same reference name.
/// 4. Strip UI-only keys (`sequenceNo`) that configs imported from JSON may carry.
///
/// Edges are ignored: order comes from sequence numbers alone.
///
/// @implNote Pure and thread-safe. Inputs are not modified.
/// @see GraphProjector for the forward transform
public class GraphToTreeReducer {

    private static final Logger logger = Logger.getLogger(GraphToTreeReducer.class.getName());

    /// Keys that belong to the canvas and must never reach a persisted task.
    public static final Set<String> UI_ONLY_KEYS = Set.of("sequenceNo");

    private final ReconciliationPolicy defaultPolicy;

    public GraphToTreeReducer() {
        this(ReconciliationPolicy.preferRicherStructure());
    }

    /// @param defaultPolicy policy applied when original tasks are supplied without one, not null
    public GraphToTreeReducer(ReconciliationPolicy defaultPolicy) {
        this.defaultPolicy = Objects.requireNonNull(defaultPolicy, "defaultPolicy");
    }

    /// Reduces nodes to tasks using only the node configs.
    ///
    /// @param nodes canvas nodes in any order, not null
    /// @return tasks in sequence order, never null
    public List<Task> reduce(List<GraphNode> nodes) {
        return reduce(nodes, null, defaultPolicy);
    }

    /// Reduces nodes to tasks, reconciling with the source definition via the default policy.
    ///
    /// @param nodes canvas nodes in any order, not null
    /// @param originalTasks top-level tasks of the source definition, may be null
    /// @return tasks in sequence order, never null
    public List<Task> reduce(List<GraphNode> nodes, List<Task> originalTasks) {
        return reduce(nodes, originalTasks, defaultPolicy);
    }

    /// Reduces nodes to tasks, reconciling with the source definition via the given policy.
    ///
    /// @param nodes canvas nodes in any order, not null
    /// @param originalTasks top-level tasks of the source definition, may be null
    /// @param policy chooses between local and original copies, not null
    /// @return tasks in sequence order without UI-only keys, never null
    public List<Task> reduce(
            List<GraphNode> nodes, List<Task> originalTasks, ReconciliationPolicy policy) {
        Objects.requireNonNull(nodes, "nodes");
        Objects.requireNonNull(policy, "policy");

        Map<String, Task> originalsByRef = indexByReference(originalTasks);
        List<Task> tasks = new ArrayList<>(nodes.size());

        for (GraphNode node : LayoutEngine.sortBySequence(nodes)) {
            Task local = node.getConfig();
            if (local == null) {
                logger.fine("Skipping unconfigured node '" + node.getId() + "'");
                continue;
            }

            Task chosen = local;
            Task original = originalsByRef.get(refOf(node, local));
            if (original != null) {
                chosen = Objects.requireNonNull(
                        policy.choose(node, local, original),
                        "ReconciliationPolicy returned null for node " + node.getId());
            }
            tasks.add(stripUiKeys(chosen));
        }
        return tasks;
    }

    /// Removes canvas-only keys from a task.
    ///
    /// @param task the task, not null
    /// @return task without UI-only attributes, the same instance if none were present
    public static Task stripUiKeys(Task task) {
        Task clean = task;
        for (String key : UI_ONLY_KEYS) {
            clean = clean.withoutAttribute(key);
        }
        return clean;
    }

    private static String refOf(GraphNode node, Task config) {
        return config.getTaskReferenceName() != null ? config.getTaskReferenceName() : node.getId();
    }

    private static Map<String, Task> indexByReference(List<Task> originalTasks) {
        Map<String, Task> byRef = new HashMap<>();
        if (originalTasks == null) {
            return byRef;
        }
        for (Task task : originalTasks) {
            if (task.getTaskReferenceName() != null) {
                byRef.putIfAbsent(task.getTaskReferenceName(), task);
            }
        }
        return byRef;
    }
}
