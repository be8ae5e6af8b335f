package io.flowdeck.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.flowdeck.core.graph.GraphNode;
import io.flowdeck.core.graph.Position;
import io.flowdeck.core.task.Task;
import java.io.IOException;
import java.io.Serial;

/// Deserializes the canvas node shape into a `GraphNode`.
///
/// `type` and `draggable` are fixed on the canvas and ignored on read. A missing `position`
/// reads as the origin. When `data.sequenceNo` is absent but the config still carries one (as
/// older saved graphs do), the config's value is used.
///
/// @implNote Package-private. Registered by {@link FlowdeckJacksonModule}.
/// @see GraphNodeSerializer for the inverse operation
class GraphNodeDeserializer extends StdDeserializer<GraphNode> {

    @Serial private static final long serialVersionUID = -3324179950823360415L;

    GraphNodeDeserializer() {
        super(GraphNode.class);
    }

    @Override
    public GraphNode deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        JsonNode id = root.get("id");
        if (id == null || !id.isTextual()) {
            throw JsonMappingException.from(p, "Node requires a string 'id'");
        }

        GraphNode.Builder b = GraphNode.builder(id.textValue()).position(readPosition(root));

        JsonNode data = root.path("data");
        b.label(textOrNull(data, "label"))
                .taskType(textOrNull(data, "taskType"))
                .taskName(textOrNull(data, "taskName"))
                .taskDescription(textOrNull(data, "taskDescription"))
                .color(textOrNull(data, "color"));

        JsonNode config = data.get("config");
        if (config != null && config.isObject()) {
            b.config(mapper.treeToValue(config, Task.class));
        }

        JsonNode sequenceNo = data.get("sequenceNo");
        if (sequenceNo == null || !sequenceNo.isIntegralNumber()) {
            sequenceNo = config != null ? config.get(TaskDeserializer.SEQUENCE_NO) : null;
        }
        if (sequenceNo != null && sequenceNo.isIntegralNumber()) {
            b.sequenceNo(sequenceNo.intValue());
        }
        return b.build();
    }

    private static Position readPosition(JsonNode root) {
        JsonNode position = root.get("position");
        if (position == null || !position.isObject()) {
            return Position.ORIGIN;
        }
        return new Position(position.path("x").asDouble(0), position.path("y").asDouble(0));
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.textValue() : null;
    }
}
