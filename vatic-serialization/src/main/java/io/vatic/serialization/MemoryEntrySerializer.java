package io.vatic.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.vatic.core.context.MemoryEntry;
import java.io.IOException;
import java.io.Serial;

/// Writes a `MemoryEntry` as `{"date":"...","datetime":"...","result":"..."}`.
///
/// @implNote Package-private. Registered by {@link VaticJacksonModule}.
/// @see MemoryEntryDeserializer for the inverse operation
class MemoryEntrySerializer extends StdSerializer<MemoryEntry> {

    @Serial private static final long serialVersionUID = -6120934387713542279L;

    MemoryEntrySerializer() {
        super(MemoryEntry.class);
    }

    @Override
    public void serialize(MemoryEntry entry, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("date", entry.date());
        gen.writeStringField("datetime", entry.datetime());
        gen.writeStringField("result", entry.result());
        gen.writeEndObject();
    }
}
