package io.flowdeck.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.flowdeck.core.graph.WorkflowGraph;
import io.flowdeck.core.scenario.Scenario;
import io.flowdeck.core.task.Task;
import io.flowdeck.core.task.WorkflowDefinition;
import java.util.List;
import java.util.Map;

/// Utility class for reading and writing Flowdeck types as JSON.
///
/// ### Usage
/// ```java
/// WorkflowDefinition definition = FlowdeckSerializer.definitionFromJson(json);
/// WorkflowGraph graph = designer.open(definition);
/// String saved = FlowdeckSerializer.graphToJson(graph);
/// ```
///
/// Every method wraps Jackson failures in `IllegalArgumentException`.
///
/// @implNote Thread-safe. The shared mapper is configured once and never modified.
/// @see FlowdeckJacksonModule for the registered type handlers
public final class FlowdeckSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private static final TypeReference<List<Task>> TASK_LIST = new TypeReference<>() {};
    private static final TypeReference<List<Scenario>> SCENARIO_LIST = new TypeReference<>() {};

    private FlowdeckSerializer() {}

    /// Reads a JSON array of tasks, as pasted into the import dialog.
    ///
    /// @param json JSON array, not null
    /// @return tasks in document order, never null
    /// @throws IllegalArgumentException if the JSON is malformed or not an array of tasks
    public static List<Task> tasksFromJson(String json) {
        return read(json, TASK_LIST, "tasks");
    }

    public static String tasksToJson(List<Task> tasks) {
        return write(tasks, "tasks");
    }

    /// @param json definition object, not null
    /// @return deserialized definition, never null
    /// @throws IllegalArgumentException if the JSON is malformed or has no `name`
    public static WorkflowDefinition definitionFromJson(String json) {
        return read(json, WorkflowDefinition.class, "workflow definition");
    }

    public static String definitionToJson(WorkflowDefinition definition) {
        return write(definition, "workflow definition");
    }

    public static WorkflowGraph graphFromJson(String json) {
        return read(json, WorkflowGraph.class, "graph");
    }

    public static String graphToJson(WorkflowGraph graph) {
        return write(graph, "graph");
    }

    public static List<Scenario> scenariosFromJson(String json) {
        return read(json, SCENARIO_LIST, "scenarios");
    }

    public static String scenariosToJson(List<Scenario> scenarios) {
        return write(scenarios, "scenarios");
    }

    /// Writes a synthesized scenario input (see
    /// {@link io.flowdeck.core.scenario.ScenarioInputSynthesizer}) as JSON text, ready for
    /// {@link Scenario#withInput(String)}.
    ///
    /// @param input the input map, not null
    /// @return JSON object text, never null
    public static String inputToJson(Map<String, Object> input) {
        return write(input, "scenario input");
    }

    /// Creates an ObjectMapper configured for Flowdeck types.
    ///
    /// Registers:
    /// - `FlowdeckJacksonModule` for the task, graph and scenario types
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - indented output
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new FlowdeckJacksonModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    private static <T> T read(String json, Class<T> type, String what) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize " + what + ": " + e.getMessage(), e);
        }
    }

    private static <T> T read(String json, TypeReference<T> type, String what) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize " + what + ": " + e.getMessage(), e);
        }
    }

    private static String write(Object value, String what) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize " + what + ": " + e.getMessage(), e);
        }
    }
}
