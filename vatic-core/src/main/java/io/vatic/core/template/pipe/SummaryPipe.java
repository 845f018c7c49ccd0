package io.vatic.core.template.pipe;

/// Built-in `summary` pipe.
///
/// Marks the value with a fixed prefix. Real summarization by an agent replaces this
/// entry in the {@link PipeRegistry} without touching the renderer.
public final class SummaryPipe implements Pipe {

    /// Registered name.
    public static final String NAME = "summary";

    /// Marker prepended to the input.
    public static final String PREFIX = "Summary of: ";

    @Override
    public String apply(String input) {
        return PREFIX + input;
    }
}
