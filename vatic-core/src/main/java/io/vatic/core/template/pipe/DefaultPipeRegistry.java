package io.vatic.core.template.pipe;

import io.vatic.core.template.TemplateException;
import io.vatic.core.template.TemplateException.Kind;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Default thread-safe implementation of {@link PipeRegistry}.
///
/// Comes with the built-in `summary` pipe ({@link SummaryPipe}) registered.
///
/// @implNote Thread-safe. Backed by a {@link ConcurrentHashMap}, so pipes may be registered
/// while renders are running.
public class DefaultPipeRegistry implements PipeRegistry {

    private static final Logger logger = Logger.getLogger(DefaultPipeRegistry.class.getName());

    private final Map<String, Pipe> pipes = new ConcurrentHashMap<>();

    /// Creates a registry with the built-in pipes registered.
    public DefaultPipeRegistry() {
        pipes.put(SummaryPipe.NAME, new SummaryPipe());
    }

    @Override
    public void register(String name, Pipe pipe) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        Objects.requireNonNull(pipe, "pipe must not be null");
        if (pipes.put(name, pipe) != null) {
            logger.warning("Pipe already registered: " + name + ". Replacing...");
        }
    }

    @Override
    public Optional<Pipe> get(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(pipes.get(name));
    }

    @Override
    public boolean contains(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return pipes.containsKey(name);
    }

    @Override
    public Set<String> names() {
        return Set.copyOf(pipes.keySet());
    }

    @Override
    public String apply(String name, String input) throws TemplateException {
        Pipe pipe = pipes.get(name);
        if (pipe == null) {
            throw new TemplateException(Kind.UNKNOWN_PIPE, "unknown pipe: '" + name + "'");
        }
        return pipe.apply(input);
    }
}
