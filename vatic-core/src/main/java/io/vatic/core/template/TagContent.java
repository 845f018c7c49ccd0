package io.vatic.core.template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Parsed body of a value tag: `name [key=value]* [| pipe]`.
///
/// Parameters keep their declaration order. When the same key is given twice the later
/// value wins. Quoted values keep their quote characters.
///
/// @param name the tag name, may contain `:` or `.`, not null or blank
/// @param params parameters in declaration order; copied to an unmodifiable map, never null
/// @param pipe name of the pipe applied to the resolved value, may be null
public record TagContent(String name, Map<String, String> params, String pipe) {

    public TagContent {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        params =
                params != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(params))
                        : Map.of();
    }

    /// Creates a tag without parameters or pipe.
    ///
    /// @param name the tag name, not null
    /// @return new tag content, never null
    public static TagContent of(String name) {
        return new TagContent(name, Map.of(), null);
    }

    /// Returns the raw value of a parameter.
    ///
    /// @param key parameter key, not null
    /// @return the value, or empty if the tag does not declare it
    public Optional<String> param(String key) {
        return Optional.ofNullable(params.get(key));
    }

    /// @return `true` if a pipe is attached to this tag
    public boolean hasPipe() {
        return pipe != null;
    }
}
