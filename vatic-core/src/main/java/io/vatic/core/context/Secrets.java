package io.vatic.core.context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Registry of named {@link Secret}s.
///
/// @implNote Immutable and thread-safe. {@link #toString()} reports only the entry count.
public final class Secrets {

    private static final Secrets EMPTY = new Secrets(Map.of());

    private final Map<String, Secret> entries;

    private Secrets(Map<String, Secret> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /// @return a registry without secrets, never null
    public static Secrets empty() {
        return EMPTY;
    }

    /// Creates a registry from a name-keyed map.
    ///
    /// @param entries secrets by name, not null
    /// @return new registry, never null
    public static Secrets of(Map<String, Secret> entries) {
        Objects.requireNonNull(entries, "entries must not be null");
        return new Secrets(entries);
    }

    /// Looks up a secret by name.
    ///
    /// @param name secret name, not null
    /// @return the secret, or empty if not configured
    public Optional<Secret> get(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(entries.get(name));
    }

    /// @return configured secret names, never null
    public Set<String> names() {
        return entries.keySet();
    }

    /// @return number of configured secrets
    public int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        return "Secrets[" + entries.size() + " entries]";
    }
}
