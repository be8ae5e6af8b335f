package io.flowdeck.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.flowdeck.core.scenario.Scenario;
import io.flowdeck.core.scenario.ScenarioStatus;
import io.flowdeck.core.scenario.TestType;
import java.io.IOException;
import java.io.Serial;

/// Deserializes a `Scenario`. A missing `status` reads as `pending`; `inputJson` and
/// `executionResult` given as JSON objects are stored as their JSON text.
///
/// @implNote Package-private. Registered by {@link FlowdeckJacksonModule}.
/// @see ScenarioSerializer for the inverse operation
class ScenarioDeserializer extends StdDeserializer<Scenario> {

    @Serial private static final long serialVersionUID = 8261657684473197625L;

    ScenarioDeserializer() {
        super(Scenario.class);
    }

    @Override
    public Scenario deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        try {
            return new Scenario(
                    requiredText(p, root, "id"),
                    requiredText(p, root, "name"),
                    root.path("description").asText(""),
                    requiredText(p, root, "targetNode"),
                    TestType.fromWireName(requiredText(p, root, "testType")),
                    jsonText(mapper, root.get("inputJson")),
                    root.hasNonNull("status")
                            ? ScenarioStatus.fromWireName(root.get("status").asText())
                            : ScenarioStatus.PENDING,
                    jsonText(mapper, root.get("executionResult")),
                    root.hasNonNull("error") ? root.get("error").asText() : null);
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, "Invalid scenario: " + e.getMessage(), e);
        }
    }

    private static String jsonText(ObjectMapper mapper, JsonNode value) throws IOException {
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isTextual() ? value.textValue() : mapper.writeValueAsString(value);
    }

    private static String requiredText(JsonParser p, JsonNode root, String field)
            throws JsonMappingException {
        JsonNode value = root.get(field);
        if (value == null || !value.isTextual()) {
            throw JsonMappingException.from(p, "Scenario requires a string '" + field + "'");
        }
        return value.textValue();
    }
}
