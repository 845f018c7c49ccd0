package io.vatic.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import io.vatic.core.context.Secret;
import io.vatic.core.context.Secrets;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Loads {@link Secrets} from a TOML file.
///
/// Each top-level table is one secret:
/// ```
/// [github]
/// key = "ghp_..."
/// header = "basic"
/// match = "https://api.github.com"
/// ```
/// `header` defaults to `bearer`, `key` and `match` to the empty string. Top-level
/// entries that are not tables are skipped.
///
/// @implNote Secret keys are never logged. A file readable by group or others is loaded
/// anyway, with a warning.
public final class SecretsLoader {

    private static final Logger logger = Logger.getLogger(SecretsLoader.class.getName());

    private static final TomlMapper TOML = new TomlMapper();

    private static final Set<PosixFilePermission> GROUP_OR_OTHERS =
            EnumSet.of(
                    PosixFilePermission.GROUP_READ,
                    PosixFilePermission.GROUP_WRITE,
                    PosixFilePermission.GROUP_EXECUTE,
                    PosixFilePermission.OTHERS_READ,
                    PosixFilePermission.OTHERS_WRITE,
                    PosixFilePermission.OTHERS_EXECUTE);

    private SecretsLoader() {}

    /// Reads a secrets file.
    ///
    /// @param path location of the TOML file, not null
    /// @return the secrets; empty if the file does not exist, never null
    /// @throws IOException if the file exists but cannot be read
    /// @throws IllegalArgumentException if the TOML is malformed
    public static Secrets load(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        if (!Files.exists(path)) {
            logger.fine(() -> "No secrets file at " + path);
            return Secrets.empty();
        }
        checkPermissions(path);
        return parse(Files.readString(path));
    }

    /// Parses secrets TOML.
    ///
    /// @param toml TOML document, not null
    /// @return the secrets, never null
    /// @throws IllegalArgumentException if the TOML is malformed
    public static Secrets parse(String toml) {
        Objects.requireNonNull(toml, "toml must not be null");
        JsonNode root;
        try {
            root = TOML.readTree(toml);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("failed to parse secrets: " + e.getMessage(), e);
        }

        Map<String, Secret> entries = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode table = field.getValue();
            if (!table.isObject()) {
                logger.fine(() -> "Skipping non-table secrets entry: " + field.getKey());
                continue;
            }
            entries.put(
                    field.getKey(),
                    new Secret(
                            text(table, "key", ""),
                            text(table, "header", Secret.DEFAULT_HEADER),
                            text(table, "match", "")));
        }
        return Secrets.of(entries);
    }

    /// Warns when the file is accessible to anyone but its owner. Skipped on filesystems
    /// without POSIX permissions.
    static boolean checkPermissions(Path path) {
        Set<PosixFilePermission> permissions;
        try {
            permissions = Files.getPosixFilePermissions(path);
        } catch (UnsupportedOperationException | IOException e) {
            logger.fine(() -> "Cannot check permissions of " + path + ": " + e.getMessage());
            return true;
        }

        Set<PosixFilePermission> exposed = EnumSet.noneOf(PosixFilePermission.class);
        exposed.addAll(permissions);
        exposed.retainAll(GROUP_OR_OTHERS);
        if (exposed.isEmpty()) {
            return true;
        }

        logger.warning(
                path
                        + " has mode "
                        + PosixFilePermissions.toString(permissions)
                        + ", should be rw-------. Fix with: chmod 600 "
                        + path);
        return false;
    }

    private static String text(JsonNode table, String field, String fallback) {
        JsonNode node = table.get(field);
        return node != null && node.isTextual() ? node.asText() : fallback;
    }
}
