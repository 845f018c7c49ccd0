package io.vatic.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.vatic.core.context.LoopValue;
import io.vatic.core.context.MemoryEntry;
import java.io.IOException;
import java.io.Serial;

/// Deserializes the `LoopValue` sealed hierarchy using a `"type"` discriminator field.
///
/// Handles two subtypes:
/// - **`"index"`**: constructs `LoopValue.Index` from the integral `value`
/// - **`"memory"`**: constructs `LoopValue.Memory`, reading `entry` through the registered
///   {@link MemoryEntryDeserializer}
///
/// @implNote Package-private. Registered by {@link VaticJacksonModule}.
/// @see LoopValueSerializer for the inverse operation
class LoopValueDeserializer extends StdDeserializer<LoopValue> {

    @Serial private static final long serialVersionUID = -3352907841109236512L;

    LoopValueDeserializer() {
        super(LoopValue.class);
    }

    /// Reads the `"type"` field and dispatches to the matching `LoopValue` subtype.
    ///
    /// @param p the JSON parser positioned at the start of the value object, not null
    /// @param ctx the deserialization context, not null
    /// @return the deserialized value, never null
    /// @throws IOException if `"type"` is missing or unknown, or a required field is absent
    @Override
    public LoopValue deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        JsonNode typeNode = root.get("type");
        if (typeNode == null) {
            throw new IOException("Loop value requires a 'type' field");
        }
        String type = typeNode.asText();

        return switch (type) {
            case "index" -> {
                JsonNode value = root.get("value");
                if (value == null || !value.isIntegralNumber()) {
                    throw new IOException("Index loop value requires an integral 'value'");
                }
                yield new LoopValue.Index(value.asLong());
            }
            case "memory" -> {
                JsonNode entry = root.get("entry");
                if (entry == null) {
                    throw new IOException("Memory loop value requires an 'entry'");
                }
                yield new LoopValue.Memory(mapper.treeToValue(entry, MemoryEntry.class));
            }
            default -> throw new IOException("Unknown LoopValue type: " + type);
        };
    }
}
