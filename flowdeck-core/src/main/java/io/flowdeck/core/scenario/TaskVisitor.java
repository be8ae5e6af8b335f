package io.flowdeck.core.scenario;

import io.flowdeck.core.task.Task;
import java.util.List;
import java.util.concurrent.CompletionStage;

/// Produces the scenarios for a single task during a {@link ScenarioTraversal}.
///
/// Implementations typically call out to an external generator (a model endpoint, a rules
/// service) and complete the returned stage when the answer arrives. The traversal awaits each
/// stage before visiting the next task, so implementations never see overlapping calls from
/// the same traversal.
///
/// @see DefaultScenarioPolicy for the built-in, synchronous policy
@FunctionalInterface
public interface TaskVisitor {

    /// Generates scenarios for one task.
    ///
    /// @param task the visited task, not null
    /// @param visitIndex 0-based position of this visit in traversal order
    /// @return stage completing with the task's scenarios, not null
    CompletionStage<List<Scenario>> visit(Task task, int visitIndex);
}
