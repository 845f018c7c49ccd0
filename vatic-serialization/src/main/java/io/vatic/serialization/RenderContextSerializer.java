package io.vatic.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.vatic.core.context.LoopValue;
import io.vatic.core.context.MemoryEntry;
import io.vatic.core.context.RenderContext;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Writes the per-run part of a `RenderContext`:
/// `{"result":..., "message":..., "sender":..., "memories":[...], "loopVars":{...}}`.
///
/// Absent optional values and empty loop bindings are omitted. The dictionary and the
/// secrets are never written; both come from their own files.
///
/// @implNote Package-private. Registered by {@link VaticJacksonModule}.
class RenderContextSerializer extends StdSerializer<RenderContext> {

    @Serial private static final long serialVersionUID = 1904526843375921057L;

    RenderContextSerializer() {
        super(RenderContext.class);
    }

    @Override
    public void serialize(RenderContext context, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();

        if (context.result().isPresent()) {
            gen.writeStringField(ContextSerializer.RESULT, context.result().get());
        }
        if (context.message().isPresent()) {
            gen.writeStringField(ContextSerializer.MESSAGE, context.message().get());
        }
        if (context.sender().isPresent()) {
            gen.writeStringField(ContextSerializer.SENDER, context.sender().get());
        }

        gen.writeArrayFieldStart(ContextSerializer.MEMORIES);
        for (MemoryEntry entry : context.memories()) {
            provider.defaultSerializeValue(entry, gen);
        }
        gen.writeEndArray();

        if (!context.loopVars().isEmpty()) {
            gen.writeObjectFieldStart(ContextSerializer.LOOP_VARS);
            for (Map.Entry<String, LoopValue> binding : context.loopVars().entrySet()) {
                gen.writeFieldName(binding.getKey());
                provider.findValueSerializer(LoopValue.class)
                        .serialize(binding.getValue(), gen, provider);
            }
            gen.writeEndObject();
        }

        gen.writeEndObject();
    }
}
