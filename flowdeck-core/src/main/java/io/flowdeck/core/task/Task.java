package io.flowdeck.core.task;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// One step of a workflow definition.
///
/// A task carries the common Conductor fields as typed properties, its nested children as a
/// {@link TaskStructure}, and every other field opaquely in an ordered attribute map so that
/// fields the designer does not understand survive a load/save cycle untouched.
///
/// ### Structural fields
/// The structure is derived from the structural fields set on the builder:
/// - `decisionCases` / `defaultCase` → {@link TaskStructure.Decision}
/// - `forkTasks` → {@link TaskStructure.ForkJoin}
/// - `loopOver` → {@link TaskStructure.Loop}
/// - none → {@link TaskStructure.Leaf}
///
/// A structural field whose value could not be interpreted (for example a JSON string that has
/// not been parsed yet) is kept verbatim as an attribute under its wire name and does not
/// contribute to the structure.
///
/// Definitions exported by Conductor carry every structural field on every task, empty when
/// unused. When fields of more than one variant are set, the empty ones are kept as plain
/// attributes and the variant is taken from the fields that hold tasks, or from the task type
/// when all of them are empty.
///
/// @implNote Immutable and thread-safe. Use {@link #toBuilder()} to derive modified copies.
/// @see TaskStructure
public final class Task {

    public static final String DECISION_CASES = "decisionCases";
    public static final String DEFAULT_CASE = "defaultCase";
    public static final String FORK_TASKS = "forkTasks";
    public static final String LOOP_OVER = "loopOver";

    /// Wire names of the fields that hold nested task lists.
    public static final Set<String> STRUCTURAL_FIELDS =
            Set.of(DECISION_CASES, DEFAULT_CASE, FORK_TASKS, LOOP_OVER);

    private final String name;
    private final String taskReferenceName;
    private final String type;
    private final String description;
    private final Map<String, Object> inputParameters;
    private final Boolean optional;
    private final Boolean asyncComplete;
    private final Integer retryCount;
    private final TaskStructure structure;
    private final Map<String, Object> attributes;

    private Task(Builder builder) {
        this.name = builder.name;
        this.taskReferenceName = builder.taskReferenceName;
        this.type = builder.type;
        this.description = builder.description;
        this.inputParameters =
                builder.inputParameters != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.inputParameters))
                        : null;
        this.optional = builder.optional;
        this.asyncComplete = builder.asyncComplete;
        this.retryCount = builder.retryCount;
        this.structure = builder.resolveStructure();
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
    }

    /// @return display name of the task definition, may be null
    public String getName() {
        return name;
    }

    /// @return stable unique key of this task instance, may be null for unvalidated input
    public String getTaskReferenceName() {
        return taskReferenceName;
    }

    /// @return wire type name (e.g. `HTTP`, `SWITCH`), may be null for unvalidated input
    public String getType() {
        return type;
    }

    public String getDescription() {
        return description;
    }

    /// @return unmodifiable input parameter map, or null if the definition had none
    public Map<String, Object> getInputParameters() {
        return inputParameters;
    }

    public Boolean getOptional() {
        return optional;
    }

    public Boolean getAsyncComplete() {
        return asyncComplete;
    }

    public Integer getRetryCount() {
        return retryCount;
    }

    /// Returns the nested-children shape of this task.
    ///
    /// @return structure variant, never null
    public TaskStructure getStructure() {
        return structure;
    }

    /// Returns the pass-through fields in their original order.
    ///
    /// @return unmodifiable attribute map, never null
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    /// Looks up a pass-through field.
    ///
    /// @param key wire field name, not null
    /// @return attribute value, or null if absent
    public Object getAttribute(String key) {
        return attributes.get(key);
    }

    /// Whether this task nests child tasks.
    public boolean isStructural() {
        return !(structure instanceof TaskStructure.Leaf);
    }

    /// Number of tasks nested below this one at any depth.
    public int descendantCount() {
        return structure.descendantCount();
    }

    /// Number of fields this task carries: non-null common fields plus attributes. Used to
    /// compare how much of a definition two copies of the same task preserve.
    public int fieldCount() {
        int count = attributes.size();
        for (Object field :
                new Object[] {
                    name, taskReferenceName, type, description,
                    inputParameters, optional, asyncComplete, retryCount
                }) {
            if (field != null) {
                count++;
            }
        }
        if (isStructural()) {
            count++;
        }
        return count;
    }

    /// Returns a copy without the given pass-through field, or this instance if absent.
    ///
    /// @param key wire field name, not null
    /// @return task without the attribute, never null
    public Task withoutAttribute(String key) {
        if (!attributes.containsKey(key)) {
            return this;
        }
        return toBuilder().removeAttribute(key).build();
    }

    /// Creates a builder pre-populated with every field of this task.
    ///
    /// @return new builder, never null
    public Builder toBuilder() {
        Builder b =
                new Builder()
                        .name(name)
                        .taskReferenceName(taskReferenceName)
                        .type(type)
                        .description(description)
                        .inputParameters(inputParameters)
                        .optional(optional)
                        .asyncComplete(asyncComplete)
                        .retryCount(retryCount)
                        .structure(structure);
        b.attributes.putAll(attributes);
        b.dropTypedFieldsShadowedByAttributes();
        return b;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Shorthand for a leaf task with a reference name and type.
    ///
    /// @param taskReferenceName unique reference name, not null
    /// @param type wire type name, not null
    /// @return new leaf task, never null
    public static Task of(String taskReferenceName, String type) {
        return builder()
                .name(taskReferenceName)
                .taskReferenceName(taskReferenceName)
                .type(type)
                .build();
    }

    /// Builder for {@link Task}. Structural setters may be combined only within one variant.
    public static final class Builder {
        private String name;
        private String taskReferenceName;
        private String type;
        private String description;
        private Map<String, Object> inputParameters;
        private Boolean optional;
        private Boolean asyncComplete;
        private Integer retryCount;
        private Map<String, List<Task>> decisionCases;
        private List<Task> defaultCase;
        private List<List<Task>> forkTasks;
        private List<Task> loopOver;
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder taskReferenceName(String taskReferenceName) {
            this.taskReferenceName = taskReferenceName;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder inputParameters(Map<String, Object> inputParameters) {
            this.inputParameters = inputParameters;
            return this;
        }

        public Builder optional(Boolean optional) {
            this.optional = optional;
            return this;
        }

        public Builder asyncComplete(Boolean asyncComplete) {
            this.asyncComplete = asyncComplete;
            return this;
        }

        public Builder retryCount(Integer retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder decisionCases(Map<String, List<Task>> decisionCases) {
            this.decisionCases = decisionCases;
            return this;
        }

        public Builder defaultCase(List<Task> defaultCase) {
            this.defaultCase = defaultCase;
            return this;
        }

        public Builder forkTasks(List<List<Task>> forkTasks) {
            this.forkTasks = forkTasks;
            return this;
        }

        public Builder loopOver(List<Task> loopOver) {
            this.loopOver = loopOver;
            return this;
        }

        /// Replaces all structural fields with those of the given structure.
        ///
        /// @param structure structure to copy, not null
        /// @return this builder for chaining
        public Builder structure(TaskStructure structure) {
            Objects.requireNonNull(structure, "structure");
            decisionCases = null;
            defaultCase = null;
            forkTasks = null;
            loopOver = null;
            if (structure instanceof TaskStructure.Decision d) {
                decisionCases = d.cases();
                defaultCase = d.defaultCase();
            } else if (structure instanceof TaskStructure.ForkJoin f) {
                forkTasks = f.branches();
            } else if (structure instanceof TaskStructure.Loop l) {
                loopOver = l.body();
            }
            return this;
        }

        /// Adds a pass-through field. Insertion order is preserved.
        ///
        /// @param key wire field name, not null
        /// @param value field value, may be null
        /// @return this builder for chaining
        public Builder attribute(String key, Object value) {
            attributes.put(Objects.requireNonNull(key, "key"), value);
            return this;
        }

        public Builder attributes(Map<String, Object> values) {
            values.forEach(this::attribute);
            return this;
        }

        public Builder removeAttribute(String key) {
            attributes.remove(key);
            return this;
        }

        /// Builds the immutable task.
        ///
        /// @return new task, never null
        /// @throws IllegalStateException if structural fields of different variants are set, or
        ///     a structural field is set both typed and as a raw attribute
        public Task build() {
            return new Task(this);
        }

        // A raw structural attribute means the typed field was absent when this task was built.
        private void dropTypedFieldsShadowedByAttributes() {
            if (attributes.containsKey(DECISION_CASES)) decisionCases = null;
            if (attributes.containsKey(DEFAULT_CASE)) defaultCase = null;
            if (attributes.containsKey(FORK_TASKS)) forkTasks = null;
            if (attributes.containsKey(LOOP_OVER)) loopOver = null;
        }

        private TaskStructure resolveStructure() {
            demoteUnusedEmptyFields();
            boolean decision = decisionCases != null || defaultCase != null;
            boolean fork = forkTasks != null;
            boolean loop = loopOver != null;
            int variants = (decision ? 1 : 0) + (fork ? 1 : 0) + (loop ? 1 : 0);
            if (variants > 1) {
                throw new IllegalStateException(
                        "Task '"
                                + taskReferenceName
                                + "' mixes structural fields of different kinds (decision="
                                + decision
                                + ", fork="
                                + fork
                                + ", loop="
                                + loop
                                + ")");
            }
            rejectShadowedAttribute(DECISION_CASES, decisionCases != null);
            rejectShadowedAttribute(DEFAULT_CASE, defaultCase != null);
            rejectShadowedAttribute(FORK_TASKS, fork);
            rejectShadowedAttribute(LOOP_OVER, loop);

            if (decision) {
                return new TaskStructure.Decision(
                        decisionCases != null ? decisionCases : Map.of(),
                        defaultCase != null ? defaultCase : List.of());
            }
            if (fork) {
                return new TaskStructure.ForkJoin(forkTasks);
            }
            if (loop) {
                return new TaskStructure.Loop(loopOver);
            }
            return TaskStructure.LEAF;
        }

        private void demoteUnusedEmptyFields() {
            boolean decision = decisionCases != null || defaultCase != null;
            boolean fork = forkTasks != null;
            boolean loop = loopOver != null;
            if ((decision ? 1 : 0) + (fork ? 1 : 0) + (loop ? 1 : 0) < 2) {
                return;
            }

            boolean decisionFilled = !isEmpty(decisionCases) || !isEmpty(defaultCase);
            boolean forkFilled = fork && forkTasks.stream().anyMatch(branch -> !branch.isEmpty());
            boolean loopFilled = !isEmpty(loopOver);
            int filled = (decisionFilled ? 1 : 0) + (forkFilled ? 1 : 0) + (loopFilled ? 1 : 0);
            if (filled > 1) {
                return; // genuinely mixed, reported by resolveStructure
            }

            StructureKind keep =
                    filled == 1
                            ? decisionFilled
                                    ? StructureKind.DECISION
                                    : forkFilled ? StructureKind.FORK : StructureKind.LOOP
                            : StructureKind.expectedFor(type);
            if (keep != StructureKind.DECISION) {
                if (demote(DECISION_CASES, decisionCases)) decisionCases = null;
                if (demote(DEFAULT_CASE, defaultCase)) defaultCase = null;
            }
            if (keep != StructureKind.FORK && demote(FORK_TASKS, forkTasks)) {
                forkTasks = null;
            }
            if (keep != StructureKind.LOOP && demote(LOOP_OVER, loopOver)) {
                loopOver = null;
            }
        }

        // Moves an empty typed field to the attributes; a raw value already there wins the
        // shadowing check instead.
        private boolean demote(String field, Object emptyValue) {
            if (emptyValue == null || attributes.containsKey(field)) {
                return false;
            }
            attributes.put(field, plainEmpty(emptyValue));
            return true;
        }

        // Fork branches can only get here when every one of them is empty.
        private static Object plainEmpty(Object emptyValue) {
            if (emptyValue instanceof Map<?, ?>) {
                return Map.of();
            }
            return Collections.nCopies(((List<?>) emptyValue).size(), List.of());
        }

        private static boolean isEmpty(Map<?, ?> value) {
            return value == null || value.isEmpty();
        }

        private static boolean isEmpty(List<?> value) {
            return value == null || value.isEmpty();
        }

        private enum StructureKind {
            NONE,
            DECISION,
            FORK,
            LOOP;

            static StructureKind expectedFor(String type) {
                return TaskType.of(type)
                        .map(
                                t ->
                                        switch (t) {
                                            case SWITCH, DECISION -> StructureKind.DECISION;
                                            case FORK_JOIN, FORK -> StructureKind.FORK;
                                            case DO_WHILE -> StructureKind.LOOP;
                                            default -> StructureKind.NONE;
                                        })
                        .orElse(NONE);
            }
        }

        private void rejectShadowedAttribute(String field, boolean typedValuePresent) {
            if (typedValuePresent && attributes.containsKey(field)) {
                throw new IllegalStateException(
                        "Task '"
                                + taskReferenceName
                                + "' has field '"
                                + field
                                + "' both as nested tasks and as a raw attribute");
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Task task)) return false;
        return Objects.equals(name, task.name)
                && Objects.equals(taskReferenceName, task.taskReferenceName)
                && Objects.equals(type, task.type)
                && Objects.equals(description, task.description)
                && Objects.equals(inputParameters, task.inputParameters)
                && Objects.equals(optional, task.optional)
                && Objects.equals(asyncComplete, task.asyncComplete)
                && Objects.equals(retryCount, task.retryCount)
                && structure.equals(task.structure)
                && attributes.equals(task.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                name,
                taskReferenceName,
                type,
                description,
                inputParameters,
                optional,
                asyncComplete,
                retryCount,
                structure,
                attributes);
    }

    @Override
    public String toString() {
        return "Task{ref='" + taskReferenceName + "', type='" + type + "', structure="
                + structure.getClass().getSimpleName() + "}";
    }
}
