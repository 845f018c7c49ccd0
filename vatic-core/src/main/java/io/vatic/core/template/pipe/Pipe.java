package io.vatic.core.template.pipe;

import io.vatic.core.template.TemplateException;

/// Post-processing step applied to a tag's resolved value, `{% tag | name %}`.
///
/// ### Contracts
/// - **Precondition**: `input` is the fully resolved tag value, never null
/// - **Postcondition**: returns the transformed value, never null
///
/// Pipes run on the rendering thread. A pipe that calls out to an agent or any other
/// I/O blocks until it completes; the renderer does not move to the next token before
/// the pipe returns, and no two pipes of one render run at the same time.
///
/// @implNote Implementations must be thread-safe: one registered instance serves every
/// concurrent render.
///
/// @see PipeRegistry for registration by name
@FunctionalInterface
public interface Pipe {

    /// Transforms a resolved value.
    ///
    /// @param input the resolved tag value, not null
    /// @return the transformed value, never null
    /// @throws TemplateException if the transformation fails; aborts the render
    String apply(String input) throws TemplateException;
}
