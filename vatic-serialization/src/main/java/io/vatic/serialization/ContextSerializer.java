package io.vatic.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.vatic.core.context.Dictionary;
import io.vatic.core.context.LoopValue;
import io.vatic.core.context.MemoryEntry;
import io.vatic.core.context.RenderContext;
import io.vatic.core.context.Secrets;
import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Utility class for reading and writing the per-run part of a {@link RenderContext} as JSON.
///
/// ### JSON shape
/// ```
/// {
///   "result": "output of the current run",
///   "message": "inbound message text",
///   "sender": "who sent it",
///   "memories": [ {"date": "2025-01-01", "datetime": "2025-01-01 08:00", "result": "..."} ],
///   "loopVars": { "i": {"type": "index", "value": 2} }
/// }
/// ```
/// Every field is optional. `memories` are newest first. Unknown properties are ignored.
///
/// ### Usage
/// {@snippet :
/// Dictionary dictionary = DictionaryLoader.load(Path.of("dictionary.toml"));
/// Secrets secrets = SecretsLoader.load(Path.of("secrets.toml"));
/// RenderContext context = ContextSerializer.fromJson(json, dictionary, secrets);
/// }
///
/// @implNote Thread-safe. The internal ObjectMapper is created per call via
/// `createMapper()`. For high-throughput scenarios, cache the mapper.
///
/// @see VaticJacksonModule for the registered type handlers
public final class ContextSerializer {

    static final String RESULT = "result";
    static final String MESSAGE = "message";
    static final String SENDER = "sender";
    static final String MEMORIES = "memories";
    static final String LOOP_VARS = "loopVars";

    private ContextSerializer() {}

    /// Serializes the per-run values of a context to pretty-printed JSON.
    ///
    /// @param context the context to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(RenderContext context) {
        Objects.requireNonNull(context, "context must not be null");
        try {
            return createMapper().writeValueAsString(context);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize context: " + e.getMessage(), e);
        }
    }

    /// Deserializes a context without dictionary or secrets.
    ///
    /// @param json JSON string, not null
    /// @return deserialized context, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static RenderContext fromJson(String json) {
        return fromJson(json, Dictionary.empty(), Secrets.empty());
    }

    /// Deserializes a context and attaches the given dictionary and secrets.
    ///
    /// @param json JSON string, not null
    /// @param dictionary lookup table for `custom:` tags, not null
    /// @param secrets secrets for `proxy:` tags, not null
    /// @return deserialized context, never null
    /// @throws IllegalArgumentException if the JSON is malformed, is not an object, or holds
    ///                                  a value of the wrong type
    public static RenderContext fromJson(String json, Dictionary dictionary, Secrets secrets) {
        Objects.requireNonNull(json, "json must not be null");
        ObjectMapper mapper = createMapper();
        try {
            JsonNode root = mapper.readTree(json);
            if (root == null || !root.isObject()) {
                throw new IllegalArgumentException("Context JSON must be an object");
            }

            RenderContext.Builder builder =
                    RenderContext.builder()
                            .dictionary(dictionary)
                            .secrets(secrets)
                            .result(optionalText(root, RESULT))
                            .message(optionalText(root, MESSAGE))
                            .sender(optionalText(root, SENDER));

            JsonNode memories = root.get(MEMORIES);
            if (memories != null && !memories.isNull()) {
                if (!memories.isArray()) {
                    throw new IllegalArgumentException("'memories' must be an array");
                }
                List<MemoryEntry> entries =
                        mapper.readerForListOf(MemoryEntry.class).readValue(memories);
                builder.memories(entries);
            }

            JsonNode loopVars = root.get(LOOP_VARS);
            if (loopVars != null && !loopVars.isNull()) {
                if (!loopVars.isObject()) {
                    throw new IllegalArgumentException("'loopVars' must be an object");
                }
                Iterator<Map.Entry<String, JsonNode>> fields = loopVars.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    builder.loopVar(
                            field.getKey(), mapper.treeToValue(field.getValue(), LoopValue.class));
                }
            }

            return builder.build();
        } catch (IOException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize context: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for context serialization.
    ///
    /// Registers:
    /// - `VaticJacksonModule` for memory entries, loop values and contexts
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - indented output
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new VaticJacksonModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    private static String optionalText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new IllegalArgumentException("'" + field + "' must be a string");
        }
        return node.asText();
    }
}
