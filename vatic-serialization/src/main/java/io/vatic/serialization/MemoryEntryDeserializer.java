package io.vatic.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.vatic.core.context.MemoryEntry;
import java.io.IOException;
import java.io.Serial;

/// Reads a `MemoryEntry` from either of two shapes:
/// - **rendered**: `{"date":"2025-01-01","datetime":"2025-01-01 08:00","result":"..."}`
/// - **stored**: `{"created_at":"2025-01-01 08:00:00","result":"..."}`, as kept by the job
///   store. `createdAt` is accepted as an alias. The date is derived from the timestamp.
///
/// An explicit `date` always wins over the derived one.
///
/// @implNote Package-private. Registered by {@link VaticJacksonModule}.
/// @see MemoryEntrySerializer for the inverse operation
class MemoryEntryDeserializer extends StdDeserializer<MemoryEntry> {

    @Serial private static final long serialVersionUID = 2871905361270944112L;

    MemoryEntryDeserializer() {
        super(MemoryEntry.class);
    }

    @Override
    public MemoryEntry deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        JsonNode root = p.readValueAsTree();

        JsonNode result = root.get("result");
        if (result == null || !result.isTextual()) {
            throw new IOException("Memory entry requires a string 'result'");
        }

        String timestamp = text(root, "datetime");
        if (timestamp == null) {
            timestamp = text(root, "created_at");
        }
        if (timestamp == null) {
            timestamp = text(root, "createdAt");
        }
        String date = text(root, "date");

        if (timestamp == null && date == null) {
            throw new IOException("Memory entry requires 'datetime', 'created_at' or 'date'");
        }
        if (timestamp == null) {
            return new MemoryEntry(date, date, result.asText());
        }

        return date != null
                ? new MemoryEntry(date, timestamp, result.asText())
                : MemoryEntry.fromTimestamp(timestamp, result.asText());
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }
}
