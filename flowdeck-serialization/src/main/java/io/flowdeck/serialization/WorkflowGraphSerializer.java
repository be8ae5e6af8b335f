package io.flowdeck.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.flowdeck.core.graph.WorkflowGraph;
import java.io.IOException;
import java.io.Serial;

/// Serializes a `WorkflowGraph` as `{"nodes": [...], "edges": [...]}`.
///
/// @implNote Package-private. Registered by {@link FlowdeckJacksonModule}.
class WorkflowGraphSerializer extends StdSerializer<WorkflowGraph> {

    @Serial private static final long serialVersionUID = 5926464585665818420L;

    WorkflowGraphSerializer() {
        super(WorkflowGraph.class);
    }

    @Override
    public void serialize(WorkflowGraph graph, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        provider.defaultSerializeField("nodes", graph.nodes(), gen);
        provider.defaultSerializeField("edges", graph.edges(), gen);
        gen.writeEndObject();
    }
}
