package io.flowdeck.core.scenario;

import io.flowdeck.core.task.Task;
import java.util.Objects;

/// Concise digest of a task, suitable for prompting an external scenario generator without
/// sending the whole task tree.
///
/// @param name display name, may be null
/// @param taskReferenceName reference name, may be null
/// @param type task type, may be null
/// @param description free text, may be null
/// @param inputParameterCount number of declared input parameters
/// @param optional whether the task is optional
public record TaskSummary(
        String name,
        String taskReferenceName,
        String type,
        String description,
        int inputParameterCount,
        boolean optional) {

    /// @param task the task, not null
    /// @return summary of the task's own fields, nested tasks are not included
    public static TaskSummary of(Task task) {
        Objects.requireNonNull(task, "task");
        return new TaskSummary(
                task.getName(),
                task.getTaskReferenceName(),
                task.getType(),
                task.getDescription(),
                task.getInputParameters() == null ? 0 : task.getInputParameters().size(),
                Boolean.TRUE.equals(task.getOptional()));
    }

    /// Identifier that scenarios of this task point at.
    ///
    /// @param visitIndex 0-based visit position, used when the task has no usable name
    /// @return reference name, else name, else `task_{visitIndex}`
    public String target(int visitIndex) {
        if (taskReferenceName != null && !taskReferenceName.isBlank()) {
            return taskReferenceName;
        }
        if (name != null && !name.isBlank()) {
            return name;
        }
        return "task_" + visitIndex;
    }

    /// @param visitIndex 0-based visit position
    /// @return name, else {@link #target(int)}
    public String displayName(int visitIndex) {
        return name != null ? name : target(visitIndex);
    }
}
