package io.vatic.core.context;

import java.util.Objects;

/// Value bound to a loop variable.
///
/// ### Permitted Subtypes
/// - {@link Index}: current value of a range loop
/// - {@link Memory}: current entry of a `memories` loop
public sealed interface LoopValue permits LoopValue.Index, LoopValue.Memory {

    /// Text produced when the variable is used as a bare tag, e.g. `{% i %}`.
    ///
    /// @return decimal index or memory result, never null
    String asText();

    /// Range loop value.
    ///
    /// @param value the current index
    record Index(long value) implements LoopValue {

        @Override
        public String asText() {
            return Long.toString(value);
        }
    }

    /// Memory loop value.
    ///
    /// @param entry the current memory, not null
    record Memory(MemoryEntry entry) implements LoopValue {

        public Memory {
            Objects.requireNonNull(entry, "entry must not be null");
        }

        @Override
        public String asText() {
            return entry.result();
        }
    }
}
