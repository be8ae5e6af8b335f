package io.flowdeck.core.payload;

import io.flowdeck.core.task.Task;
import io.flowdeck.core.task.TaskStructure;
import io.flowdeck.core.task.TaskType;
import io.flowdeck.core.task.WorkflowDefinition;
import io.flowdeck.core.validation.IssueType;
import io.flowdeck.core.validation.ValidationIssue;
import io.flowdeck.core.validation.WorkflowValidationException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Prepares a definition for submission to a Conductor server.
///
/// Exported definitions keep whatever their tasks carried, including keys that only make sense
/// on the canvas, and leave out fields Conductor expects every task or operator to have. This
/// normalizer fixes both, at every nesting depth:
///
/// - removes canvas keys ({@link #INTERNAL_TASK_KEYS}) from tasks
/// - fills task defaults: `name` from the reference name, `optional` and `asyncComplete`
///   false, empty `inputParameters`, `startDelay` 0
/// - fills operator fields: an empty body and `loopCondition` for `DO_WHILE`, one empty
///   branch for `FORK_JOIN`, empty cases and an `expression` for `SWITCH`, and
///   `dynamicTaskNameParam` for `DYNAMIC`
/// - fills definition defaults: version 1, `schemaVersion` 2, one hour timeout with
///   `TIME_OUT_WF`, restartable, empty input and output parameters
///
/// A field counts as missing when it is absent or null. Values that are present are never
/// replaced, so normalizing twice gives the same result.
///
/// @implNote Stateless and thread-safe.
public class ConductorPayloadNormalizer {

    private static final Logger logger =
            Logger.getLogger(ConductorPayloadNormalizer.class.getName());

    /// Task keys that belong to the canvas model and are never sent to the server.
    public static final Set<String> INTERNAL_TASK_KEYS =
            Set.of(
                    "__typename",
                    "id",
                    "nodeId",
                    "taskRefId",
                    "label",
                    "taskName",
                    "taskType",
                    "workflowTaskType",
                    "x",
                    "y",
                    "position",
                    "data",
                    "config",
                    "sequenceNo");

    /// Definition keys that belong to a saved canvas rather than to the workflow.
    public static final Set<String> INTERNAL_DEFINITION_KEYS =
            Set.of("__typename", "nodes", "edges");

    static final String UNNAMED_WORKFLOW = "Unnamed Workflow";
    static final int DEFAULT_VERSION = 1;
    static final int DEFAULT_SCHEMA_VERSION = 2;
    static final int DEFAULT_TIMEOUT_SECONDS = 3600;
    static final String DEFAULT_TIMEOUT_POLICY = "TIME_OUT_WF";
    static final String DEFAULT_LOOP_CONDITION = "True";
    static final String DEFAULT_SWITCH_EXPRESSION = "${workflow.input}";
    static final String DEFAULT_DYNAMIC_TASK_NAME_PARAM = "taskName";

    /// Normalizes a whole definition.
    ///
    /// @param definition the definition, not null
    /// @return normalized copy, never null
    /// @throws WorkflowValidationException if any task, nested ones included, has no type
    public WorkflowDefinition normalize(WorkflowDefinition definition) {
        Objects.requireNonNull(definition, "definition");

        List<ValidationIssue> issues = new ArrayList<>();
        List<Task> tasks = normalizeAll(definition.getTasks(), "tasks", issues);
        if (!issues.isEmpty()) {
            throw new WorkflowValidationException(issues);
        }

        String name = isBlank(definition.getName()) ? UNNAMED_WORKFLOW : definition.getName();
        WorkflowDefinition.Builder b =
                definition.toBuilder()
                        .name(name)
                        .description(
                                definition.getDescription() != null
                                        ? definition.getDescription()
                                        : "")
                        .version(
                                definition.getVersion() != null
                                        ? definition.getVersion()
                                        : DEFAULT_VERSION)
                        .tasks(tasks);
        INTERNAL_DEFINITION_KEYS.forEach(b::removeAttribute);

        Map<String, Object> attributes = definition.getAttributes();
        fillAttribute(b, attributes, "inputParameters", List.of());
        fillAttribute(b, attributes, "outputParameters", Map.of());
        fillAttribute(b, attributes, "schemaVersion", DEFAULT_SCHEMA_VERSION);
        fillAttribute(b, attributes, "restartable", true);
        fillAttribute(b, attributes, "workflowStatusListenerEnabled", false);
        fillAttribute(b, attributes, "timeoutSeconds", DEFAULT_TIMEOUT_SECONDS);
        fillAttribute(b, attributes, "timeoutPolicy", DEFAULT_TIMEOUT_POLICY);

        logger.fine("Normalized workflow '" + definition.getName() + "' for submission");
        return b.build();
    }

    /// Normalizes one task and everything nested below it.
    ///
    /// @param task the task, not null
    /// @return normalized copy, never null
    /// @throws WorkflowValidationException if the task or a descendant has no type
    public Task normalize(Task task) {
        Objects.requireNonNull(task, "task");
        List<ValidationIssue> issues = new ArrayList<>();
        Task normalized = normalizeTask(task, "task", issues);
        if (!issues.isEmpty()) {
            throw new WorkflowValidationException(issues);
        }
        return normalized;
    }

    private List<Task> normalizeAll(List<Task> tasks, String path, List<ValidationIssue> issues) {
        List<Task> normalized = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            normalized.add(normalizeTask(tasks.get(i), path + "[" + i + "]", issues));
        }
        return normalized;
    }

    private Task normalizeTask(Task task, String path, List<ValidationIssue> issues) {
        String type = task.getType();
        if (isBlank(type)) {
            issues.add(
                    new ValidationIssue(
                            IssueType.MISSING_TYPE,
                            path,
                            "Task '"
                                    + task.getTaskReferenceName()
                                    + "' is missing a required 'type' field"));
        }

        Task.Builder b = task.toBuilder();
        INTERNAL_TASK_KEYS.forEach(b::removeAttribute);

        if (task.getName() == null && !task.getAttributes().containsKey("name")) {
            b.name(task.getTaskReferenceName());
        }
        if (task.getOptional() == null && !task.getAttributes().containsKey("optional")) {
            b.optional(false);
        }
        if (task.getAsyncComplete() == null && !task.getAttributes().containsKey("asyncComplete")) {
            b.asyncComplete(false);
        }
        if (task.getInputParameters() == null
                && !task.getAttributes().containsKey("inputParameters")) {
            b.inputParameters(Map.of());
        }
        Map<String, Object> attributes = task.getAttributes();
        fillAttribute(b, attributes, "startDelay", 0);

        normalizeChildren(b, task, path, issues);
        fillOperatorFields(b, task, attributes);
        return b.build();
    }

    // Setters leave alone any structural field the task holds as a raw attribute.
    private void normalizeChildren(
            Task.Builder b, Task task, String path, List<ValidationIssue> issues) {
        TaskStructure structure = task.getStructure();
        Map<String, Object> attributes = task.getAttributes();
        if (structure instanceof TaskStructure.Decision decision) {
            if (!attributes.containsKey(Task.DECISION_CASES)) {
                Map<String, List<Task>> cases = new LinkedHashMap<>();
                for (Map.Entry<String, List<Task>> entry : decision.cases().entrySet()) {
                    String casePath = path + "." + Task.DECISION_CASES + "." + entry.getKey();
                    cases.put(entry.getKey(), normalizeAll(entry.getValue(), casePath, issues));
                }
                b.decisionCases(cases);
            }
            if (!attributes.containsKey(Task.DEFAULT_CASE)) {
                b.defaultCase(
                        normalizeAll(
                                decision.defaultCase(), path + "." + Task.DEFAULT_CASE, issues));
            }
        } else if (structure instanceof TaskStructure.ForkJoin fork) {
            List<List<Task>> branches = new ArrayList<>(fork.branches().size());
            for (int i = 0; i < fork.branches().size(); i++) {
                branches.add(
                        normalizeAll(
                                fork.branches().get(i),
                                path + "." + Task.FORK_TASKS + "[" + i + "]",
                                issues));
            }
            b.forkTasks(branches);
        } else if (structure instanceof TaskStructure.Loop loop) {
            b.loopOver(normalizeAll(loop.body(), path + "." + Task.LOOP_OVER, issues));
        }
    }

    // Typed structure is only added to leaves whose field is not held raw.
    private void fillOperatorFields(Task.Builder b, Task task, Map<String, Object> attributes) {
        boolean leaf = !task.isStructural();
        switch (TaskType.of(task.getType()).orElse(TaskType.SIMPLE)) {
            case DO_WHILE -> {
                fillAttribute(b, attributes, "loopCondition", DEFAULT_LOOP_CONDITION);
                if (leaf && !attributes.containsKey(Task.LOOP_OVER)) {
                    b.loopOver(List.of());
                }
            }
            case FORK_JOIN -> {
                if (leaf && !attributes.containsKey(Task.FORK_TASKS)) {
                    b.forkTasks(List.of(List.of()));
                }
            }
            case SWITCH -> {
                fillAttribute(b, attributes, "expression", DEFAULT_SWITCH_EXPRESSION);
                if (leaf && !attributes.containsKey(Task.DECISION_CASES)) {
                    b.decisionCases(Map.of());
                }
            }
            case DYNAMIC ->
                    fillAttribute(
                            b, attributes, "dynamicTaskNameParam", DEFAULT_DYNAMIC_TASK_NAME_PARAM);
            default -> {}
        }
    }

    private static void fillAttribute(
            Task.Builder b, Map<String, Object> attributes, String key, Object value) {
        if (attributes.get(key) == null) {
            b.attribute(key, value);
        }
    }

    private static void fillAttribute(
            WorkflowDefinition.Builder b,
            Map<String, Object> attributes,
            String key,
            Object value) {
        if (attributes.get(key) == null) {
            b.attribute(key, value);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
