package io.flowdeck.core.graph;

import io.flowdeck.core.task.Task;

/// Decides which copy of a task wins when an edited graph is reduced against the definition
/// it was loaded from.
///
/// The canvas only surfaces part of a task, so a definition fetched from the server can hold
/// fields (or whole nested branches) that the node's config lacks. Whether the original or the
/// locally edited copy is the source of truth is a caller decision; the built-in policies
/// cover the common cases.
///
/// @see GraphToTreeReducer#reduce(java.util.List, java.util.List, ReconciliationPolicy)
@FunctionalInterface
public interface ReconciliationPolicy {

    /// Chooses between the node's config and the original task with the same reference name.
    ///
    /// @param node the canvas node being reduced, not null
    /// @param local the node's config, not null
    /// @param original the task from the source definition, not null
    /// @return the task to emit, never null
    Task choose(GraphNode node, Task local, Task original);

    /// Always keeps the canvas copy.
    static ReconciliationPolicy preferLocal() {
        return (node, local, original) -> local;
    }

    /// Always keeps the source definition's copy.
    static ReconciliationPolicy preferOriginal() {
        return (node, local, original) -> original;
    }

    /// Keeps the original when its structural content is richer than the local copy: more
    /// nested tasks, or as many nested tasks but more fields. Otherwise keeps the local copy,
    /// so edits made on the canvas win whenever they lose nothing.
    static ReconciliationPolicy preferRicherStructure() {
        return (node, local, original) -> {
            int localDepth = local.descendantCount();
            int originalDepth = original.descendantCount();
            if (originalDepth != localDepth) {
                return originalDepth > localDepth ? original : local;
            }
            return original.fieldCount() > local.fieldCount() ? original : local;
        };
    }
}
