package io.vatic.core.context;

import java.util.Objects;

/// Snapshot of one past job run, as exposed to templates through `memory` tags and
/// `for ... in memories` loops.
///
/// @param date run date as `YYYY-MM-DD`, not null
/// @param datetime run timestamp as stored by the caller, not null
/// @param result the run's output, not null
public record MemoryEntry(String date, String datetime, String result) {

    private static final int DATE_LENGTH = "YYYY-MM-DD".length();

    public MemoryEntry {
        Objects.requireNonNull(date, "date must not be null");
        Objects.requireNonNull(datetime, "datetime must not be null");
        Objects.requireNonNull(result, "result must not be null");
    }

    /// Derives the entry from a stored timestamp such as `2025-01-01 08:00:00`.
    ///
    /// The date is the first ten characters of the timestamp, or the whole timestamp
    /// if it is shorter.
    ///
    /// @param timestamp creation timestamp, not null
    /// @param result the run's output, not null
    /// @return new entry, never null
    public static MemoryEntry fromTimestamp(String timestamp, String result) {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        String date =
                timestamp.length() > DATE_LENGTH ? timestamp.substring(0, DATE_LENGTH) : timestamp;
        return new MemoryEntry(date, timestamp, result);
    }
}
