package io.vatic.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import io.vatic.core.context.Dictionary;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Loads a {@link Dictionary} from a TOML file.
///
/// Every top-level table is a section and every value in it must be a string:
/// ```
/// [general]
/// name = "Franz"
/// city = "Vienna"
/// ```
/// Templates read the `general` section through `{% custom:<key> %}`.
public final class DictionaryLoader {

    private static final Logger logger = Logger.getLogger(DictionaryLoader.class.getName());

    private static final TomlMapper TOML = new TomlMapper();

    private DictionaryLoader() {}

    /// Reads a dictionary file.
    ///
    /// @param path location of the TOML file, not null
    /// @return the dictionary; empty if the file does not exist, never null
    /// @throws IOException if the file exists but cannot be read
    /// @throws IllegalArgumentException if the content is not a valid dictionary
    public static Dictionary load(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        if (!Files.exists(path)) {
            logger.fine(() -> "No dictionary at " + path + ", using an empty one");
            return Dictionary.empty();
        }
        return parse(Files.readString(path));
    }

    /// Parses dictionary TOML.
    ///
    /// @param toml TOML document, not null
    /// @return the dictionary, never null
    /// @throws IllegalArgumentException if the TOML is malformed, a top-level entry is not a
    ///                                  table, or a value is not a string
    public static Dictionary parse(String toml) {
        Objects.requireNonNull(toml, "toml must not be null");
        JsonNode root;
        try {
            root = TOML.readTree(toml);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid dictionary TOML: " + e.getMessage(), e);
        }

        Dictionary.Builder builder = Dictionary.builder();
        Iterator<Map.Entry<String, JsonNode>> sections = root.fields();
        while (sections.hasNext()) {
            Map.Entry<String, JsonNode> section = sections.next();
            String name = section.getKey();
            if (!section.getValue().isObject()) {
                throw new IllegalArgumentException(
                        "dictionary section '" + name + "' must be a table");
            }
            builder.section(name);

            Iterator<Map.Entry<String, JsonNode>> values = section.getValue().fields();
            while (values.hasNext()) {
                Map.Entry<String, JsonNode> value = values.next();
                if (!value.getValue().isTextual()) {
                    throw new IllegalArgumentException(
                            "dictionary value '"
                                    + name
                                    + "."
                                    + value.getKey()
                                    + "' must be a string");
                }
                builder.put(name, value.getKey(), value.getValue().asText());
            }
        }
        return builder.build();
    }
}
