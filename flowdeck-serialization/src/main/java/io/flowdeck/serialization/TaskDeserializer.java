package io.flowdeck.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.flowdeck.core.task.Task;
import java.io.IOException;
import java.io.Serial;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/// Deserializes the Conductor task shape into a `Task`.
///
/// ### Field handling
/// - Common fields with the expected JSON type become typed properties; with any other type
///   they are kept as pass-through attributes.
/// - `decisionCases`, `defaultCase`, `forkTasks` and `loopOver` become nested tasks when they
///   have the expected shape. Anything else, including JSON text that has not been parsed yet,
///   is kept verbatim as an attribute.
/// - `sequenceNo` is a canvas field and is dropped.
/// - Every other field is kept as an attribute, in document order.
///
/// @implNote Package-private. Registered by {@link FlowdeckJacksonModule}.
/// @see TaskSerializer for the inverse operation
class TaskDeserializer extends StdDeserializer<Task> {

    @Serial private static final long serialVersionUID = -7469118703914523318L;

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    static final String SEQUENCE_NO = "sequenceNo";

    TaskDeserializer() {
        super(Task.class);
    }

    @Override
    public Task deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        if (!root.isObject()) {
            throw JsonMappingException.from(
                    p, "Task must be a JSON object, got " + root.getNodeType());
        }

        Task.Builder b = Task.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            readField(mapper, b, field.getKey(), field.getValue());
        }

        try {
            return b.build();
        } catch (IllegalStateException e) {
            throw JsonMappingException.from(p, e.getMessage(), e);
        }
    }

    private void readField(ObjectMapper mapper, Task.Builder b, String key, JsonNode value)
            throws IOException {
        switch (key) {
            case "name" -> {
                if (!readText(value, b::name)) b.attribute(key, plain(mapper, value));
            }
            case "taskReferenceName" -> {
                if (!readText(value, b::taskReferenceName)) b.attribute(key, plain(mapper, value));
            }
            case "type" -> {
                if (!readText(value, b::type)) b.attribute(key, plain(mapper, value));
            }
            case "description" -> {
                if (!readText(value, b::description)) b.attribute(key, plain(mapper, value));
            }
            case "inputParameters" -> {
                if (value.isObject()) {
                    b.inputParameters(mapper.convertValue(value, OBJECT_MAP));
                } else if (!value.isNull()) {
                    b.attribute(key, plain(mapper, value));
                }
            }
            case "optional" -> {
                if (value.isBoolean()) {
                    b.optional(value.booleanValue());
                } else if (!value.isNull()) {
                    b.attribute(key, plain(mapper, value));
                }
            }
            case "asyncComplete" -> {
                if (value.isBoolean()) {
                    b.asyncComplete(value.booleanValue());
                } else if (!value.isNull()) {
                    b.attribute(key, plain(mapper, value));
                }
            }
            case "retryCount" -> {
                if (value.isIntegralNumber()) {
                    b.retryCount(value.intValue());
                } else if (!value.isNull()) {
                    b.attribute(key, plain(mapper, value));
                }
            }
            case Task.DECISION_CASES -> {
                Map<String, List<Task>> cases = TaskTrees.readCaseMap(mapper, value);
                if (cases != null) {
                    b.decisionCases(cases);
                } else {
                    b.attribute(key, plain(mapper, value));
                }
            }
            case Task.DEFAULT_CASE -> {
                List<Task> defaults = TaskTrees.readTaskList(mapper, value);
                if (defaults != null) {
                    b.defaultCase(defaults);
                } else {
                    b.attribute(key, plain(mapper, value));
                }
            }
            case Task.FORK_TASKS -> {
                List<List<Task>> branches = TaskTrees.readBranches(mapper, value);
                if (branches != null) {
                    b.forkTasks(branches);
                } else {
                    b.attribute(key, plain(mapper, value));
                }
            }
            case Task.LOOP_OVER -> {
                List<Task> body = TaskTrees.readTaskList(mapper, value);
                if (body != null) {
                    b.loopOver(body);
                } else {
                    b.attribute(key, plain(mapper, value));
                }
            }
            case SEQUENCE_NO -> {} // canvas-only
            default -> b.attribute(key, plain(mapper, value));
        }
    }

    private static boolean readText(JsonNode value, Consumer<String> setter) {
        if (value.isNull()) {
            return true;
        }
        if (value.isTextual()) {
            setter.accept(value.textValue());
            return true;
        }
        return false;
    }

    private static Object plain(ObjectMapper mapper, JsonNode value) {
        return TaskTrees.toPlainValue(mapper, value);
    }
}
