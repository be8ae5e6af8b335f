package io.flowdeck.core.graph;

import io.flowdeck.core.task.Task;
import java.util.Objects;

/// One top-level task as drawn on the designer canvas.
///
/// The node wraps the complete task definition in {@link #getConfig()}, including its nested
/// branches verbatim, because a flat graph cannot display nested control flow. Everything else
/// on the node is canvas metadata: position, display fields and the UI-only sequence number
/// that orders nodes and is never written into the task itself.
///
/// ### Identity
/// The node id equals the task's `taskReferenceName` and never changes once the node exists;
/// reconfiguring a task replaces the config, not the id.
///
/// @implNote Immutable. Editing operations return modified copies via {@link #toBuilder()}.
/// @see WorkflowGraph
public final class GraphNode {

    /// Canvas component type used for every task node.
    public static final String NODE_TYPE = "custom";

    private final String id;
    private final Position position;
    private final Integer sequenceNo;
    private final String label;
    private final String taskType;
    private final String taskName;
    private final String taskDescription;
    private final String color;
    private final Task config;

    private GraphNode(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Node id required");
        this.position = builder.position != null ? builder.position : Position.ORIGIN;
        this.sequenceNo = builder.sequenceNo;
        this.label = builder.label != null ? builder.label : builder.id;
        this.taskType = builder.taskType;
        this.taskName = builder.taskName;
        this.taskDescription = builder.taskDescription;
        this.color = builder.color;
        this.config = builder.config;
    }

    /// @return node id, equal to the task reference name, never null
    public String getId() {
        return id;
    }

    /// @return canvas position, never null
    public Position getPosition() {
        return position;
    }

    /// Returns the 1-based ordering index among top-level nodes.
    ///
    /// @return sequence number, or null for a node that was never sequenced
    public Integer getSequenceNo() {
        return sequenceNo;
    }

    /// Sequence number with missing values ordered first.
    ///
    /// @return sequence number, or 0 when absent
    public int sequenceOrZero() {
        return sequenceNo != null ? sequenceNo : 0;
    }

    public String getLabel() {
        return label;
    }

    public String getTaskType() {
        return taskType;
    }

    public String getTaskName() {
        return taskName;
    }

    public String getTaskDescription() {
        return taskDescription;
    }

    public String getColor() {
        return color;
    }

    /// Returns the wrapped task definition.
    ///
    /// @return task config, or null for a node dropped on the canvas but never configured
    public Task getConfig() {
        return config;
    }

    public boolean isConfigured() {
        return config != null;
    }

    public GraphNode withPosition(Position newPosition) {
        return toBuilder().position(newPosition).build();
    }

    public GraphNode withSequenceNo(Integer newSequenceNo) {
        return toBuilder().sequenceNo(newSequenceNo).build();
    }

    public Builder toBuilder() {
        return new Builder(id)
                .position(position)
                .sequenceNo(sequenceNo)
                .label(label)
                .taskType(taskType)
                .taskName(taskName)
                .taskDescription(taskDescription)
                .color(color)
                .config(config);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static final class Builder {
        private final String id;
        private Position position;
        private Integer sequenceNo;
        private String label;
        private String taskType;
        private String taskName;
        private String taskDescription;
        private String color;
        private Task config;

        private Builder(String id) {
            this.id = id;
        }

        public Builder position(Position position) {
            this.position = position;
            return this;
        }

        public Builder position(double x, double y) {
            this.position = new Position(x, y);
            return this;
        }

        public Builder sequenceNo(Integer sequenceNo) {
            this.sequenceNo = sequenceNo;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder taskType(String taskType) {
            this.taskType = taskType;
            return this;
        }

        public Builder taskName(String taskName) {
            this.taskName = taskName;
            return this;
        }

        public Builder taskDescription(String taskDescription) {
            this.taskDescription = taskDescription;
            return this;
        }

        public Builder color(String color) {
            this.color = color;
            return this;
        }

        public Builder config(Task config) {
            this.config = config;
            return this;
        }

        /// @throws NullPointerException if the id is null
        public GraphNode build() {
            return new GraphNode(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GraphNode node)) return false;
        return id.equals(node.id)
                && position.equals(node.position)
                && Objects.equals(sequenceNo, node.sequenceNo)
                && Objects.equals(label, node.label)
                && Objects.equals(taskType, node.taskType)
                && Objects.equals(taskName, node.taskName)
                && Objects.equals(taskDescription, node.taskDescription)
                && Objects.equals(color, node.color)
                && Objects.equals(config, node.config);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                id,
                position,
                sequenceNo,
                label,
                taskType,
                taskName,
                taskDescription,
                color,
                config);
    }

    @Override
    public String toString() {
        return "GraphNode{id='" + id + "', seq=" + sequenceNo + ", position=" + position + "}";
    }
}
