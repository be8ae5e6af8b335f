package io.flowdeck.core.validation;

import io.flowdeck.core.task.Task;
import io.flowdeck.core.task.TaskStructure;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Checks a task tree for the invariants the designer depends on.
///
/// ### Checks
/// - every task (nested ones included) has a non-blank `taskReferenceName` and `type`
/// - no `taskReferenceName` appears twice anywhere in the tree
///
/// All issues are collected before anything is thrown, so callers can show them together.
public class TaskTreeValidator {

    /// Returns every issue in the tree without throwing.
    ///
    /// @param tasks top-level tasks, not null
    /// @return issues in document order, empty if the tree is valid
    public List<ValidationIssue> findIssues(List<Task> tasks) {
        Objects.requireNonNull(tasks, "tasks");
        List<ValidationIssue> issues = new ArrayList<>();
        Map<String, String> firstSeenAt = new HashMap<>();
        for (int i = 0; i < tasks.size(); i++) {
            check(tasks.get(i), "tasks[" + i + "]", firstSeenAt, issues);
        }
        return issues;
    }

    /// Validates the tree.
    ///
    /// @param tasks top-level tasks, not null
    /// @throws WorkflowValidationException listing every issue, if any
    public void validate(List<Task> tasks) {
        List<ValidationIssue> issues = findIssues(tasks);
        if (!issues.isEmpty()) {
            throw new WorkflowValidationException(issues);
        }
    }

    private void check(
            Task task, String path, Map<String, String> firstSeenAt, List<ValidationIssue> issues) {
        String ref = task.getTaskReferenceName();
        if (ref == null || ref.isBlank()) {
            issues.add(
                    new ValidationIssue(
                            IssueType.MISSING_REFERENCE_NAME,
                            path,
                            "taskReferenceName is required"));
        } else {
            String previous = firstSeenAt.putIfAbsent(ref, path);
            if (previous != null) {
                issues.add(
                        new ValidationIssue(
                                IssueType.DUPLICATE_REFERENCE_NAME,
                                path,
                                "taskReferenceName '" + ref + "' already used at " + previous));
            }
        }
        if (task.getType() == null || task.getType().isBlank()) {
            issues.add(new ValidationIssue(IssueType.MISSING_TYPE, path, "type is required"));
        }

        TaskStructure structure = task.getStructure();
        if (structure instanceof TaskStructure.Decision decision) {
            decision.cases()
                    .forEach(
                            (label, children) ->
                                    checkAll(
                                            children,
                                            path + "." + Task.DECISION_CASES + "." + label,
                                            firstSeenAt,
                                            issues));
            checkAll(decision.defaultCase(), path + "." + Task.DEFAULT_CASE, firstSeenAt, issues);
        } else if (structure instanceof TaskStructure.ForkJoin fork) {
            for (int b = 0; b < fork.branches().size(); b++) {
                checkAll(
                        fork.branches().get(b),
                        path + "." + Task.FORK_TASKS + "[" + b + "]",
                        firstSeenAt,
                        issues);
            }
        } else if (structure instanceof TaskStructure.Loop loop) {
            checkAll(loop.body(), path + "." + Task.LOOP_OVER, firstSeenAt, issues);
        }
    }

    private void checkAll(
            List<Task> children,
            String path,
            Map<String, String> firstSeenAt,
            List<ValidationIssue> issues) {
        for (int i = 0; i < children.size(); i++) {
            check(children.get(i), path + "[" + i + "]", firstSeenAt, issues);
        }
    }
}
