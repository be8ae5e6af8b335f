package io.flowdeck.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.flowdeck.core.task.Task;
import io.flowdeck.core.task.WorkflowDefinition;
import java.io.IOException;
import java.io.Serial;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/// Deserializes a workflow definition envelope.
///
/// `name` is required. `tasks` must be an array of task objects when present. Every other
/// field (`timeoutSeconds`, `ownerEmail`, `schemaVersion`, ...) is kept as a pass-through
/// attribute in document order.
///
/// @implNote Package-private. Registered by {@link FlowdeckJacksonModule}.
class WorkflowDefinitionDeserializer extends StdDeserializer<WorkflowDefinition> {

    @Serial private static final long serialVersionUID = -1960479216326307752L;

    WorkflowDefinitionDeserializer() {
        super(WorkflowDefinition.class);
    }

    @Override
    public WorkflowDefinition deserialize(JsonParser p, DeserializationContext ctxt)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        JsonNode name = root.get("name");
        if (name == null || !name.isTextual()) {
            throw JsonMappingException.from(p, "Workflow definition requires a string 'name'");
        }

        WorkflowDefinition.Builder b = WorkflowDefinition.builder().name(name.textValue());
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode value = field.getValue();
            switch (key) {
                case "name" -> {}
                case "description" -> b.description(value.isNull() ? null : value.asText());
                case "version" -> {
                    if (value.isIntegralNumber()) {
                        b.version(value.intValue());
                    } else {
                        b.attribute(key, TaskTrees.toPlainValue(mapper, value));
                    }
                }
                case "tasks" -> {
                    List<Task> tasks = TaskTrees.readTaskList(mapper, value);
                    if (tasks == null && !value.isNull()) {
                        throw JsonMappingException.from(
                                p, "'tasks' must be an array of task objects");
                    }
                    b.tasks(tasks != null ? tasks : List.of());
                }
                default -> b.attribute(key, TaskTrees.toPlainValue(mapper, value));
            }
        }
        return b.build();
    }
}
