package io.flowdeck.core.task;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Declarative workflow definition as exchanged with the orchestration server.
///
/// Only the fields the designer edits are typed. Everything else (timeouts, ownership,
/// schema version, access policy, ...) is kept in an ordered attribute map and written back
/// unchanged.
///
/// @implNote Immutable and thread-safe.
public final class WorkflowDefinition {

    private final String name;
    private final String description;
    private final Integer version;
    private final List<Task> tasks;
    private final Map<String, Object> attributes;

    private WorkflowDefinition(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Workflow name required");
        this.description = builder.description;
        this.version = builder.version;
        this.tasks = List.copyOf(builder.tasks);
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /// @return definition version, or null for a definition never published
    public Integer getVersion() {
        return version;
    }

    /// @return top-level tasks in execution order, never null
    public List<Task> getTasks() {
        return tasks;
    }

    /// @return unmodifiable pass-through fields, never null
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    /// Returns a copy of this definition with a different task list.
    ///
    /// @param newTasks replacement top-level tasks, not null
    /// @return new definition, never null
    public WorkflowDefinition withTasks(List<Task> newTasks) {
        return toBuilder().tasks(newTasks).build();
    }

    public Builder toBuilder() {
        Builder b = new Builder().name(name).description(description).version(version).tasks(tasks);
        b.attributes.putAll(attributes);
        return b;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private String description;
        private Integer version;
        private List<Task> tasks = List.of();
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder version(Integer version) {
            this.version = version;
            return this;
        }

        public Builder tasks(List<Task> tasks) {
            this.tasks = Objects.requireNonNull(tasks, "tasks");
            return this;
        }

        public Builder attribute(String key, Object value) {
            attributes.put(Objects.requireNonNull(key, "key"), value);
            return this;
        }

        public Builder removeAttribute(String key) {
            attributes.remove(key);
            return this;
        }

        /// @throws NullPointerException if name is not set
        public WorkflowDefinition build() {
            return new WorkflowDefinition(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkflowDefinition that)) return false;
        return name.equals(that.name)
                && Objects.equals(description, that.description)
                && Objects.equals(version, that.version)
                && tasks.equals(that.tasks)
                && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, version, tasks, attributes);
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{name='" + name + "', version=" + version + ", tasks="
                + tasks.size() + "}";
    }
}
