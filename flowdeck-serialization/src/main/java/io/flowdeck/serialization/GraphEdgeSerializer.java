package io.flowdeck.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.flowdeck.core.graph.GraphEdge;
import java.io.IOException;
import java.io.Serial;

/// Serializes a `GraphEdge` as
/// `{id, source, target, sourceHandle?, targetHandle?, animated, type, style: {stroke,
/// strokeWidth}}`.
///
/// @implNote Package-private. Registered by {@link FlowdeckJacksonModule}.
/// @see GraphEdgeDeserializer for the inverse operation
class GraphEdgeSerializer extends StdSerializer<GraphEdge> {

    @Serial private static final long serialVersionUID = 1527169275425311225L;

    GraphEdgeSerializer() {
        super(GraphEdge.class);
    }

    @Override
    public void serialize(GraphEdge edge, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", edge.id());
        gen.writeStringField("source", edge.source());
        gen.writeStringField("target", edge.target());
        if (edge.sourceHandle() != null) {
            gen.writeStringField("sourceHandle", edge.sourceHandle().wireName());
        }
        if (edge.targetHandle() != null) {
            gen.writeStringField("targetHandle", edge.targetHandle().wireName());
        }
        gen.writeBooleanField("animated", edge.animated());
        gen.writeStringField("type", edge.type().wireName());
        gen.writeObjectFieldStart("style");
        gen.writeStringField("stroke", edge.style().stroke());
        GraphNodeSerializer.writeNumber(gen, "strokeWidth", edge.style().strokeWidth());
        gen.writeEndObject();
        gen.writeEndObject();
    }
}
