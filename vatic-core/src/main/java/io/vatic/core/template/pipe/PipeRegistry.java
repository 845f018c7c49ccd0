package io.vatic.core.template.pipe;

import io.vatic.core.template.TemplateException;
import java.util.Optional;
import java.util.Set;

/// Name-keyed registry of {@link Pipe}s.
///
/// The renderer only ever calls {@link #apply(String, String)}, so new pipes are added by
/// registering them here rather than by changing the renderer.
///
/// ### Usage
/// {@snippet :
/// PipeRegistry pipes = new DefaultPipeRegistry();
/// pipes.register("upper", input -> input.toUpperCase(Locale.ROOT));
/// TemplateEngine engine = TemplateEngine.builder().pipeRegistry(pipes).build();
/// }
///
/// @see DefaultPipeRegistry for the default implementation
public interface PipeRegistry {

    /// Registers a pipe, replacing any pipe already registered under the same name.
    ///
    /// @apiNote **Side effects**: modifies the registry
    ///
    /// @param name pipe name as written after `|`, case-sensitive, not null or blank
    /// @param pipe the implementation, not null
    void register(String name, Pipe pipe);

    /// Looks up a pipe.
    ///
    /// @param name pipe name, not null
    /// @return the pipe, or empty if none is registered
    Optional<Pipe> get(String name);

    /// @param name pipe name, not null
    /// @return `true` if a pipe is registered under the name
    boolean contains(String name);

    /// @return names of all registered pipes, never null
    Set<String> names();

    /// Applies the named pipe.
    ///
    /// @param name pipe name, not null
    /// @param input resolved tag value, not null
    /// @return the transformed value, never null
    /// @throws TemplateException `UNKNOWN_PIPE` if no pipe has that name, or whatever the
    ///                           pipe itself throws
    String apply(String name, String input) throws TemplateException;
}
