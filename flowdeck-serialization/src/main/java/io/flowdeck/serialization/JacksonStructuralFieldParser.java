package io.flowdeck.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.flowdeck.core.task.Task;
import io.flowdeck.core.task.spi.EmbeddedJsonException;
import io.flowdeck.core.task.spi.StructuralFieldParser;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Jackson-based implementation of {@link StructuralFieldParser}.
///
/// Decodes structural fields that arrived as JSON text, for example a `forkTasks` value
/// stored as `"[[{\"taskReferenceName\": \"a\", ...}]]"` by an editor form.
///
/// @implNote Thread-safe if the supplied {@link ObjectMapper} is thread-safe.
/// @see io.flowdeck.core.graph.GraphProjector#decodeEmbeddedFields(Task) for the caller
public class JacksonStructuralFieldParser implements StructuralFieldParser {

    private final ObjectMapper objectMapper;

    public JacksonStructuralFieldParser() {
        this(FlowdeckSerializer.createMapper());
    }

    /// @param objectMapper mapper with {@link FlowdeckJacksonModule} registered, not null
    public JacksonStructuralFieldParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public List<Task> parseTaskList(String json) throws EmbeddedJsonException {
        List<Task> tasks = decode(json, node -> TaskTrees.readTaskList(objectMapper, node));
        return requireShape(tasks, "an array of task objects");
    }

    @Override
    public Map<String, List<Task>> parseCaseMap(String json) throws EmbeddedJsonException {
        Map<String, List<Task>> cases =
                decode(json, node -> TaskTrees.readCaseMap(objectMapper, node));
        return requireShape(cases, "an object of task arrays");
    }

    @Override
    public List<List<Task>> parseBranches(String json) throws EmbeddedJsonException {
        List<List<Task>> branches =
                decode(json, node -> TaskTrees.readBranches(objectMapper, node));
        return requireShape(branches, "an array of task arrays");
    }

    private <T> T decode(String json, TreeReader<T> reader) throws EmbeddedJsonException {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return reader.read(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new EmbeddedJsonException(
                    "Malformed embedded JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static <T> T requireShape(T value, String expected) throws EmbeddedJsonException {
        if (value == null) {
            throw new EmbeddedJsonException("Embedded JSON is not " + expected);
        }
        return value;
    }

    @FunctionalInterface
    private interface TreeReader<T> {
        T read(JsonNode node) throws JsonProcessingException;
    }
}
