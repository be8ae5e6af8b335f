package io.flowdeck.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.flowdeck.core.graph.GraphEdge;
import io.flowdeck.core.graph.GraphNode;
import io.flowdeck.core.graph.WorkflowGraph;
import java.io.IOException;
import java.io.Serial;
import java.util.List;

/// Deserializes `{"nodes": [...], "edges": [...]}`; either list may be missing.
///
/// @implNote Package-private. Registered by {@link FlowdeckJacksonModule}.
class WorkflowGraphDeserializer extends StdDeserializer<WorkflowGraph> {

    @Serial private static final long serialVersionUID = -8332644676416592815L;

    private static final TypeReference<List<GraphNode>> NODE_LIST = new TypeReference<>() {};
    private static final TypeReference<List<GraphEdge>> EDGE_LIST = new TypeReference<>() {};

    WorkflowGraphDeserializer() {
        super(WorkflowGraph.class);
    }

    @Override
    public WorkflowGraph deserialize(JsonParser p, DeserializationContext ctxt)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        return new WorkflowGraph(
                readList(mapper, root, "nodes", NODE_LIST),
                readList(mapper, root, "edges", EDGE_LIST));
    }

    private static <T> List<T> readList(
            ObjectMapper mapper, JsonNode root, String field, TypeReference<List<T>> type)
            throws IOException {
        JsonNode value = root.get(field);
        if (value == null || value.isNull()) {
            return List.of();
        }
        return mapper.readValue(mapper.treeAsTokens(value), type);
    }
}
