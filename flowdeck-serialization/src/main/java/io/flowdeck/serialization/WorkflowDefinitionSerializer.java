package io.flowdeck.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.flowdeck.core.task.WorkflowDefinition;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Serializes a `WorkflowDefinition` as `{name, description?, version?, tasks, ...attributes}`.
///
/// @implNote Package-private. Registered by {@link FlowdeckJacksonModule}.
class WorkflowDefinitionSerializer extends StdSerializer<WorkflowDefinition> {

    @Serial private static final long serialVersionUID = 8125360998712050874L;

    WorkflowDefinitionSerializer() {
        super(WorkflowDefinition.class);
    }

    @Override
    public void serialize(
            WorkflowDefinition definition, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("name", definition.getName());
        if (definition.getDescription() != null) {
            gen.writeStringField("description", definition.getDescription());
        }
        if (definition.getVersion() != null) {
            gen.writeNumberField("version", definition.getVersion());
        }
        provider.defaultSerializeField("tasks", definition.getTasks(), gen);
        for (Map.Entry<String, Object> attribute : definition.getAttributes().entrySet()) {
            provider.defaultSerializeField(attribute.getKey(), attribute.getValue(), gen);
        }
        gen.writeEndObject();
    }
}
