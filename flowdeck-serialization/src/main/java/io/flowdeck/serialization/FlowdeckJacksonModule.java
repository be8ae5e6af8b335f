package io.flowdeck.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.flowdeck.core.graph.GraphEdge;
import io.flowdeck.core.graph.GraphNode;
import io.flowdeck.core.graph.WorkflowGraph;
import io.flowdeck.core.scenario.Scenario;
import io.flowdeck.core.task.Task;
import io.flowdeck.core.task.WorkflowDefinition;
import java.io.Serial;

/// Jackson `SimpleModule` that registers every Flowdeck serializer/deserializer pair.
///
/// - `Task`: Conductor task shape, unknown fields passed through in order
/// - `WorkflowDefinition`: definition envelope, unknown fields passed through in order
/// - `GraphNode`: canvas node shape (`type: "custom"`, `data {...}`)
/// - `GraphEdge`: canvas edge shape
/// - `WorkflowGraph`: `{nodes, edges}`
/// - `Scenario`: test scenario with snake-case enum values
///
/// The core types are annotation-free immutables, so every pair is hand-written; nothing is
/// bound by reflection.
///
/// @see FlowdeckSerializer for the convenience factory API
public class FlowdeckJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 2208713405316527418L;

    public FlowdeckJacksonModule() {
        super("FlowdeckJacksonModule");

        addSerializer(Task.class, new TaskSerializer());
        addDeserializer(Task.class, new TaskDeserializer());

        addSerializer(WorkflowDefinition.class, new WorkflowDefinitionSerializer());
        addDeserializer(WorkflowDefinition.class, new WorkflowDefinitionDeserializer());

        addSerializer(GraphNode.class, new GraphNodeSerializer());
        addDeserializer(GraphNode.class, new GraphNodeDeserializer());

        addSerializer(GraphEdge.class, new GraphEdgeSerializer());
        addDeserializer(GraphEdge.class, new GraphEdgeDeserializer());

        addSerializer(WorkflowGraph.class, new WorkflowGraphSerializer());
        addDeserializer(WorkflowGraph.class, new WorkflowGraphDeserializer());

        addSerializer(Scenario.class, new ScenarioSerializer());
        addDeserializer(Scenario.class, new ScenarioDeserializer());
    }
}
