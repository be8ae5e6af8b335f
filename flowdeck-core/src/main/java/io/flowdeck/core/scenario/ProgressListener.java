package io.flowdeck.core.scenario;

/// Receives progress reports while a {@link ScenarioTraversal} runs.
///
/// `current` counts visits made so far, nested tasks included, while `total` is the number of
/// top-level tasks. `current` may therefore exceed `total` for workflows with nested branches.
@FunctionalInterface
public interface ProgressListener {

    /// Called once per visit, before the visitor runs.
    ///
    /// @param message human-readable step description, not null
    /// @param current visits so far including this one
    /// @param total number of top-level tasks
    void onProgress(String message, int current, int total);

    /// Listener that ignores all reports.
    ProgressListener NOOP = (message, current, total) -> {};
}
