package io.vatic.core.context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Static two-level `section → key → value` lookup table.
///
/// Templates read the `general` section through `{% custom:<key> %}`. Other sections are
/// available to callers but not addressable from templates.
///
/// @implNote Immutable and thread-safe. Built with {@link #builder()} or {@link #of(Map)}.
public final class Dictionary {

    /// Section read by `custom:` tags.
    public static final String GENERAL = "general";

    private static final Dictionary EMPTY = new Dictionary(Map.of());

    private final Map<String, Map<String, String>> entries;

    private Dictionary(Map<String, Map<String, String>> entries) {
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        entries.forEach(
                (section, values) ->
                        copy.put(section, Collections.unmodifiableMap(new LinkedHashMap<>(values))));
        this.entries = Collections.unmodifiableMap(copy);
    }

    /// @return a dictionary without sections, never null
    public static Dictionary empty() {
        return EMPTY;
    }

    /// Creates a dictionary from nested maps.
    ///
    /// @param entries section name to key/value map, not null
    /// @return new dictionary, never null
    public static Dictionary of(Map<String, Map<String, String>> entries) {
        Objects.requireNonNull(entries, "entries must not be null");
        return new Dictionary(entries);
    }

    /// Looks up a value.
    ///
    /// @param section section name, not null
    /// @param key key within the section, not null
    /// @return the value, or empty if the section or key is missing
    public Optional<String> get(String section, String key) {
        Objects.requireNonNull(section, "section must not be null");
        Objects.requireNonNull(key, "key must not be null");
        return Optional.ofNullable(section(section).get(key));
    }

    /// Returns all keys of a section.
    ///
    /// @param section section name, not null
    /// @return unmodifiable view; empty if the section does not exist
    public Map<String, String> section(String section) {
        return entries.getOrDefault(section, Map.of());
    }

    /// @return names of all sections, never null
    public Set<String> sections() {
        return entries.keySet();
    }

    /// @return `true` if no section is defined
    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /// @return a new builder, never null
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Dictionary other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "Dictionary" + entries;
    }

    /// Fluent builder for {@link Dictionary}.
    public static final class Builder {
        private final Map<String, Map<String, String>> entries = new LinkedHashMap<>();

        private Builder() {}

        /// Declares a section, so it exists even without keys.
        ///
        /// @param section section name, not null
        /// @return this builder for chaining, never null
        public Builder section(String section) {
            entries.computeIfAbsent(section, s -> new LinkedHashMap<>());
            return this;
        }

        /// Adds or replaces a value.
        ///
        /// @param section section name, not null
        /// @param key key within the section, not null
        /// @param value the value, not null
        /// @return this builder for chaining, never null
        public Builder put(String section, String key, String value) {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(value, "value must not be null");
            entries.computeIfAbsent(section, s -> new LinkedHashMap<>()).put(key, value);
            return this;
        }

        /// @return the immutable dictionary, never null
        public Dictionary build() {
            return new Dictionary(entries);
        }
    }
}
