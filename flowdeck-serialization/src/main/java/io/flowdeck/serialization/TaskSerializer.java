package io.flowdeck.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.flowdeck.core.task.Task;
import io.flowdeck.core.task.TaskStructure;
import java.io.IOException;
import java.io.Serial;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Serializes a `Task` to the Conductor task shape.
///
/// Field order: common fields (`name`, `taskReferenceName`, `type`, `description`,
/// `inputParameters`, `optional`, `asyncComplete`, `retryCount`), then the structural fields of
/// the task's variant, then pass-through attributes in their original order. Null common fields
/// are omitted; null attribute values are written as `null`.
///
/// Every key is written once. A raw attribute holding a structural key (such as
/// `"defaultCase": null` next to typed cases) replaces the typed field, since the typed value
/// was only defaulted. An attribute that repeats a typed common field is dropped.
///
/// ```
/// Structure   Fields written
/// ------------+-------------------------------
/// Decision    | decisionCases, defaultCase
/// ForkJoin    | forkTasks
/// Loop        | loopOver
/// Leaf        | (none)
/// ```
///
/// @implNote Package-private. Registered by {@link FlowdeckJacksonModule}.
/// @see TaskDeserializer for the inverse operation
class TaskSerializer extends StdSerializer<Task> {

    @Serial private static final long serialVersionUID = 3056021914486117523L;

    TaskSerializer() {
        super(Task.class);
    }

    @Override
    public void serialize(Task task, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        Set<String> written = new HashSet<>();
        gen.writeStartObject();
        writeIfNotNull(gen, written, "name", task.getName());
        writeIfNotNull(gen, written, "taskReferenceName", task.getTaskReferenceName());
        writeIfNotNull(gen, written, "type", task.getType());
        writeIfNotNull(gen, written, "description", task.getDescription());
        if (task.getInputParameters() != null) {
            provider.defaultSerializeField("inputParameters", task.getInputParameters(), gen);
            written.add("inputParameters");
        }
        if (task.getOptional() != null) {
            gen.writeBooleanField("optional", task.getOptional());
            written.add("optional");
        }
        if (task.getAsyncComplete() != null) {
            gen.writeBooleanField("asyncComplete", task.getAsyncComplete());
            written.add("asyncComplete");
        }
        if (task.getRetryCount() != null) {
            gen.writeNumberField("retryCount", task.getRetryCount());
            written.add("retryCount");
        }

        Map<String, Object> attributes = task.getAttributes();
        TaskStructure structure = task.getStructure();
        if (structure instanceof TaskStructure.Decision decision) {
            if (!attributes.containsKey(Task.DECISION_CASES)) {
                writeCases(decision.cases(), gen, provider);
            }
            if (!attributes.containsKey(Task.DEFAULT_CASE)) {
                writeTaskList(Task.DEFAULT_CASE, decision.defaultCase(), gen, provider);
            }
        } else if (structure instanceof TaskStructure.ForkJoin fork
                && !attributes.containsKey(Task.FORK_TASKS)) {
            gen.writeArrayFieldStart(Task.FORK_TASKS);
            for (List<Task> branch : fork.branches()) {
                gen.writeStartArray();
                for (Task child : branch) {
                    serialize(child, gen, provider);
                }
                gen.writeEndArray();
            }
            gen.writeEndArray();
        } else if (structure instanceof TaskStructure.Loop loop
                && !attributes.containsKey(Task.LOOP_OVER)) {
            writeTaskList(Task.LOOP_OVER, loop.body(), gen, provider);
        }

        for (Map.Entry<String, Object> attribute : attributes.entrySet()) {
            if (!written.contains(attribute.getKey())) {
                provider.defaultSerializeField(attribute.getKey(), attribute.getValue(), gen);
            }
        }
        gen.writeEndObject();
    }

    private void writeCases(
            Map<String, List<Task>> cases, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeObjectFieldStart(Task.DECISION_CASES);
        for (Map.Entry<String, List<Task>> entry : cases.entrySet()) {
            writeTaskList(entry.getKey(), entry.getValue(), gen, provider);
        }
        gen.writeEndObject();
    }

    private void writeTaskList(
            String field, List<Task> tasks, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeArrayFieldStart(field);
        for (Task child : tasks) {
            serialize(child, gen, provider);
        }
        gen.writeEndArray();
    }

    private static void writeIfNotNull(
            JsonGenerator gen, Set<String> written, String field, String value)
            throws IOException {
        if (value != null) {
            gen.writeStringField(field, value);
            written.add(field);
        }
    }
}
