package io.vatic.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.vatic.core.context.LoopValue;
import java.io.IOException;
import java.io.Serial;

/// Serializes the `LoopValue` sealed hierarchy with a `"type"` discriminator field.
///
/// Emitted JSON shape per subtype:
/// - **`LoopValue.Index`**: `{"type":"index","value":2}`
/// - **`LoopValue.Memory`**: `{"type":"memory","entry":{...}}`, the entry written by
///   {@link MemoryEntrySerializer}
///
/// @implNote Package-private. Registered by {@link VaticJacksonModule}.
/// @see LoopValueDeserializer for the inverse operation
class LoopValueSerializer extends StdSerializer<LoopValue> {

    @Serial private static final long serialVersionUID = 7761206004839132750L;

    LoopValueSerializer() {
        super(LoopValue.class);
    }

    @Override
    public void serialize(LoopValue value, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();

        if (value instanceof LoopValue.Index index) {
            gen.writeStringField("type", "index");
            gen.writeNumberField("value", index.value());
        } else if (value instanceof LoopValue.Memory memory) {
            gen.writeStringField("type", "memory");
            provider.defaultSerializeField("entry", memory.entry(), gen);
        }

        gen.writeEndObject();
    }
}
