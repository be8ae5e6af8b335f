package io.flowdeck.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.flowdeck.core.graph.AnchorSide;
import io.flowdeck.core.graph.EdgeStyle;
import io.flowdeck.core.graph.EdgeType;
import io.flowdeck.core.graph.GraphEdge;
import java.io.IOException;
import java.io.Serial;

/// Deserializes the canvas edge shape into a `GraphEdge`.
///
/// `id`, `source` and `target` are required. Missing `type` reads as straight, missing `style`
/// as the sequence style, and missing `animated` as `false`.
///
/// @implNote Package-private. Registered by {@link FlowdeckJacksonModule}.
/// @see GraphEdgeSerializer for the inverse operation
class GraphEdgeDeserializer extends StdDeserializer<GraphEdge> {

    @Serial private static final long serialVersionUID = -7486979218489765844L;

    GraphEdgeDeserializer() {
        super(GraphEdge.class);
    }

    @Override
    public GraphEdge deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        try {
            return new GraphEdge(
                    requiredText(p, root, "id"),
                    requiredText(p, root, "source"),
                    requiredText(p, root, "target"),
                    root.hasNonNull("sourceHandle")
                            ? AnchorSide.fromWireName(root.get("sourceHandle").asText())
                            : null,
                    root.hasNonNull("targetHandle")
                            ? AnchorSide.fromWireName(root.get("targetHandle").asText())
                            : null,
                    root.path("animated").asBoolean(false),
                    root.hasNonNull("type")
                            ? EdgeType.fromWireName(root.get("type").asText())
                            : EdgeType.STRAIGHT,
                    readStyle(root.get("style")));
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, "Invalid edge: " + e.getMessage(), e);
        }
    }

    private static EdgeStyle readStyle(JsonNode style) {
        if (style == null || !style.isObject()) {
            return EdgeStyle.SEQUENCE;
        }
        return new EdgeStyle(
                style.path("stroke").asText(EdgeStyle.SEQUENCE.stroke()),
                style.path("strokeWidth").asDouble(EdgeStyle.SEQUENCE.strokeWidth()));
    }

    private static String requiredText(JsonParser p, JsonNode root, String field)
            throws JsonMappingException {
        JsonNode value = root.get(field);
        if (value == null || !value.isTextual()) {
            throw JsonMappingException.from(p, "Edge requires a string '" + field + "'");
        }
        return value.textValue();
    }
}
