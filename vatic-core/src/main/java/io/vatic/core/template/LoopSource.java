package io.vatic.core.template;

import java.util.Objects;

/// What a for-block iterates over.
///
/// ### Permitted Subtypes
/// - {@link Range}: inclusive integer range, `(start..end)`
/// - {@link Collection}: a named sequence supplied by the render context, e.g. `memories`
///
/// The parser accepts any collection name; unknown names fail when the loop is evaluated.
public sealed interface LoopSource permits LoopSource.Range, LoopSource.Collection {

    /// Inclusive ascending range. Yields nothing when `start > end`.
    ///
    /// @param start first value
    /// @param end last value
    record Range(long start, long end) implements LoopSource {

        /// @return `true` if the range yields no values
        public boolean isEmpty() {
            return start > end;
        }
    }

    /// Named collection looked up in the render context.
    ///
    /// @param name collection identifier, not null
    record Collection(String name) implements LoopSource {

        public Collection {
            Objects.requireNonNull(name, "name must not be null");
        }
    }
}
