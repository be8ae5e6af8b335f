package io.flowdeck.core.scenario;

import io.flowdeck.core.task.Task;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Walks a task tree and collects scenarios from a {@link TaskVisitor}, one task at a time.
///
/// ### Visit order
/// Depth-first pre-order: a task, then its decision cases in insertion order, then its
/// `defaultCase`, then its fork branches in order, then its loop body. Siblings follow all
/// descendants of the previous sibling.
///
/// ### Sequencing
/// Each visit's stage completes before the next visit starts. Scenario numbering, progress
/// reports and any rate-limited generator behind the visitor rely on this.
///
/// ### Failures
/// A visit that throws, completes exceptionally, returns `null` or exceeds the visit timeout is
/// replaced by a single {@link ScenarioStatus#FAILED} scenario carrying the cause in `error`.
/// The traversal then moves on; it never completes exceptionally because of a visitor. A
/// progress listener that throws is logged and otherwise ignored.
///
/// The result always ends with two end-to-end scenarios targeting {@link
/// Scenario#END_TO_END_TARGET}.
public class ScenarioTraversal {

    private static final Logger logger = Logger.getLogger(ScenarioTraversal.class.getName());

    public static final String E2E_HAPPY_PATH_ID = "e2e-happy-path";
    public static final String E2E_ERROR_RECOVERY_ID = "e2e-error-recovery";

    private final Duration visitTimeout;

    public ScenarioTraversal() {
        this(null);
    }

    /// @param visitTimeout upper bound for a single visit, null for no limit
    public ScenarioTraversal(Duration visitTimeout) {
        if (visitTimeout != null && (visitTimeout.isNegative() || visitTimeout.isZero())) {
            throw new IllegalArgumentException("visitTimeout must be positive: " + visitTimeout);
        }
        this.visitTimeout = visitTimeout;
    }

    /// Flattens the tree into visit order.
    ///
    /// @param tasks top-level tasks, not null
    /// @return every task in the order the traversal visits them, never null
    public static List<Task> visitOrder(List<Task> tasks) {
        Objects.requireNonNull(tasks, "tasks");
        List<Task> order = new ArrayList<>();
        for (Task task : tasks) {
            collect(task, order);
        }
        return order;
    }

    public CompletableFuture<List<Scenario>> traverse(List<Task> tasks, TaskVisitor visitor) {
        return traverse(tasks, visitor, ProgressListener.NOOP);
    }

    public CompletableFuture<List<Scenario>> traverse(
            List<Task> tasks, TaskVisitor visitor, ProgressListener progress) {
        return traverse(null, tasks, visitor, progress);
    }

    /// Visits every task and appends the end-to-end scenarios.
    ///
    /// @param workflowName name used in the end-to-end descriptions, may be null
    /// @param tasks top-level tasks, not null
    /// @param visitor per-task generator, not null
    /// @param progress progress sink, null for none
    /// @return future completing with all scenarios in visit order, never completes
    ///     exceptionally because of the visitor
    public CompletableFuture<List<Scenario>> traverse(
            String workflowName, List<Task> tasks, TaskVisitor visitor, ProgressListener progress) {
        Objects.requireNonNull(visitor, "visitor");
        List<Task> order = visitOrder(tasks);
        ProgressListener listener = progress != null ? progress : ProgressListener.NOOP;
        int total = tasks.size();

        logger.info(
                "Generating scenarios for " + order.size() + " tasks (" + total + " top-level)");

        List<Scenario> collected = new ArrayList<>();
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (int i = 0; i < order.size(); i++) {
            Task task = order.get(i);
            int visitIndex = i;
            chain =
                    chain.thenCompose(
                            ignored -> {
                                report(listener, task, visitIndex, total);
                                return visitSafely(visitor, task, visitIndex);
                            })
                            .thenAccept(collected::addAll);
        }

        return chain.thenApply(
                ignored -> {
                    collected.addAll(endToEndScenarios(workflowName));
                    logger.info("Generated " + collected.size() + " scenarios");
                    return List.copyOf(collected);
                });
    }

    /// @param workflowName name used in the happy-path description, may be null
    /// @return the two trailing whole-workflow scenarios
    public static List<Scenario> endToEndScenarios(String workflowName) {
        String subject = workflowName != null ? workflowName + " workflow" : "workflow";
        return List.of(
                Scenario.pending(
                        E2E_HAPPY_PATH_ID,
                        "End-to-End Happy Path",
                        "Complete workflow execution with all tasks succeeding. Validates the"
                                + " entire "
                                + subject
                                + " from start to finish.",
                        Scenario.END_TO_END_TARGET,
                        TestType.HAPPY_PATH),
                Scenario.pending(
                        E2E_ERROR_RECOVERY_ID,
                        "End-to-End Error Recovery",
                        "Tests workflow error handling and recovery mechanisms across multiple task"
                                + " failures.",
                        Scenario.END_TO_END_TARGET,
                        TestType.ERROR_CASE));
    }

    private static void report(ProgressListener listener, Task task, int visitIndex, int total) {
        String name = TaskSummary.of(task).displayName(visitIndex);
        try {
            listener.onProgress("Analyzing task \"" + name + "\"", visitIndex + 1, total);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Progress listener failed on task '" + name + "'", e);
        }
    }

    private CompletableFuture<List<Scenario>> visitSafely(
            TaskVisitor visitor, Task task, int visitIndex) {
        CompletableFuture<List<Scenario>> stage;
        try {
            CompletionStage<List<Scenario>> result = visitor.visit(task, visitIndex);
            if (result == null) {
                return CompletableFuture.completedFuture(
                        List.of(failure(task, visitIndex, "visitor returned no result")));
            }
            stage = result.toCompletableFuture().copy();
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(
                    List.of(failure(task, visitIndex, messageOf(e))));
        }

        if (visitTimeout != null) {
            stage = stage.orTimeout(visitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        return stage.handle(
                (scenarios, error) -> {
                    if (error != null) {
                        return List.of(failure(task, visitIndex, messageOf(error)));
                    }
                    if (scenarios == null) {
                        return List.of(failure(task, visitIndex, "visitor returned no scenarios"));
                    }
                    return scenarios;
                });
    }

    private Scenario failure(Task task, int visitIndex, String message) {
        TaskSummary summary = TaskSummary.of(task);
        String target = summary.target(visitIndex);
        logger.log(
                Level.WARNING,
                "Scenario generation failed for task ''{0}'': {1}",
                new Object[] {target, message});
        return new Scenario(
                "task-" + visitIndex + "-scenario-0",
                summary.displayName(visitIndex) + " - Scenario Generation Failed",
                "Scenarios could not be generated for this task.",
                target,
                TestType.ERROR_CASE,
                null,
                ScenarioStatus.FAILED,
                null,
                message);
    }

    private String messageOf(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException && visitTimeout != null) {
            return "visit timed out after " + visitTimeout.toMillis() + " ms";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static void collect(Task task, List<Task> order) {
        order.add(task);
        for (Task child : task.getStructure().children()) {
            collect(child, order);
        }
    }
}
