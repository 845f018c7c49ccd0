package io.vatic.core.template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Parsed header of a for-block.
///
/// @param var name the loop variable is bound to inside the body, not null
/// @param source what the loop iterates over, not null
/// @param params loop-level parameters such as `limit`; unmodifiable, never null
public record ForLoop(String var, LoopSource source, Map<String, String> params) {

    /// Loop parameter capping the number of collection items visited.
    public static final String LIMIT = "limit";

    public ForLoop {
        Objects.requireNonNull(var, "var must not be null");
        Objects.requireNonNull(source, "source must not be null");
        params =
                params != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(params))
                        : Map.of();
    }

    /// Returns the raw value of a loop parameter.
    ///
    /// @param key parameter key, not null
    /// @return the value, or empty if not declared
    public Optional<String> param(String key) {
        return Optional.ofNullable(params.get(key));
    }
}
