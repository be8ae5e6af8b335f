package io.flowdeck.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.flowdeck.core.graph.GraphNode;
import java.io.IOException;
import java.io.Serial;

/// Serializes a `GraphNode` in the canvas node shape:
///
/// ```json
/// {"id": "fetch", "type": "custom", "position": {"x": 50, "y": 50}, "draggable": false,
///  "data": {"label": "fetch", "taskType": "HTTP", "taskName": "fetch", "sequenceNo": 1,
///           "color": "#0066cc", "config": {...}}}
/// ```
///
/// `taskDescription`, `sequenceNo` and `config` are omitted when null. Whole-number coordinates
/// are written without a fraction.
///
/// @implNote Package-private. Registered by {@link FlowdeckJacksonModule}.
/// @see GraphNodeDeserializer for the inverse operation
class GraphNodeSerializer extends StdSerializer<GraphNode> {

    @Serial private static final long serialVersionUID = 4711937820254461201L;

    GraphNodeSerializer() {
        super(GraphNode.class);
    }

    @Override
    public void serialize(GraphNode node, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", node.getId());
        gen.writeStringField("type", GraphNode.NODE_TYPE);

        gen.writeObjectFieldStart("position");
        writeNumber(gen, "x", node.getPosition().x());
        writeNumber(gen, "y", node.getPosition().y());
        gen.writeEndObject();

        gen.writeBooleanField("draggable", false);

        gen.writeObjectFieldStart("data");
        writeNullable(gen, "label", node.getLabel());
        writeNullable(gen, "taskType", node.getTaskType());
        writeNullable(gen, "taskName", node.getTaskName());
        if (node.getTaskDescription() != null) {
            gen.writeStringField("taskDescription", node.getTaskDescription());
        }
        if (node.getSequenceNo() != null) {
            gen.writeNumberField("sequenceNo", node.getSequenceNo());
        }
        writeNullable(gen, "color", node.getColor());
        if (node.getConfig() != null) {
            provider.defaultSerializeField("config", node.getConfig(), gen);
        }
        gen.writeEndObject();

        gen.writeEndObject();
    }

    static void writeNumber(JsonGenerator gen, String field, double value) throws IOException {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            gen.writeNumberField(field, (long) value);
        } else {
            gen.writeNumberField(field, value);
        }
    }

    private static void writeNullable(JsonGenerator gen, String field, String value)
            throws IOException {
        if (value != null) {
            gen.writeStringField(field, value);
        } else {
            gen.writeNullField(field);
        }
    }
}
