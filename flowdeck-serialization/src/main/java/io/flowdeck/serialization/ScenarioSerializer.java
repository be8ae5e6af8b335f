package io.flowdeck.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.flowdeck.core.scenario.Scenario;
import java.io.IOException;
import java.io.Serial;

/// Serializes a `Scenario` with snake-case `testType` and `status` values. `inputJson`,
/// `executionResult` and `error` are omitted when null.
///
/// @implNote Package-private. Registered by {@link FlowdeckJacksonModule}.
/// @see ScenarioDeserializer for the inverse operation
class ScenarioSerializer extends StdSerializer<Scenario> {

    @Serial private static final long serialVersionUID = -1940164072735634120L;

    ScenarioSerializer() {
        super(Scenario.class);
    }

    @Override
    public void serialize(Scenario scenario, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", scenario.id());
        gen.writeStringField("name", scenario.name());
        gen.writeStringField("description", scenario.description());
        gen.writeStringField("targetNode", scenario.targetNode());
        gen.writeStringField("testType", scenario.testType().wireName());
        writeIfNotNull(gen, "inputJson", scenario.inputJson());
        gen.writeStringField("status", scenario.status().wireName());
        writeIfNotNull(gen, "executionResult", scenario.executionResult());
        writeIfNotNull(gen, "error", scenario.error());
        gen.writeEndObject();
    }

    private static void writeIfNotNull(JsonGenerator gen, String field, String value)
            throws IOException {
        if (value != null) {
            gen.writeStringField(field, value);
        }
    }
}
