package io.vatic.core.template;

import io.vatic.core.context.RenderContext;
import io.vatic.core.template.pipe.DefaultPipeRegistry;
import io.vatic.core.template.pipe.PipeRegistry;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Entry point for rendering agent prompts and output messages.
///
/// A template is plain text with `{% ... %}` tags:
/// ```
/// Hello {% custom:name %}, today is {% date %}.
/// {% for m in memories limit:3 %}{% m.date %}: {% m.result | summary %}
/// {% endfor %}
/// ```
/// Rendering tokenizes the whole template first, then evaluates it against a
/// {@link RenderContext}. It reads the clock and nothing else: no I/O, no persistence.
///
/// ### Usage
/// {@snippet :
/// TemplateEngine engine = TemplateEngine.create();
/// String prompt = engine.render(template, RenderContext.of(dictionary));
/// }
///
/// @implNote Thread-safe if the configured {@link PipeRegistry} and its pipes are. The
/// default registry is. Concurrent renders share no mutable state.
///
/// @see TemplateTokenizer for the syntax
/// @see Builder for configuration
public final class TemplateEngine {

    private static final Logger logger = Logger.getLogger(TemplateEngine.class.getName());

    private final Clock clock;
    private final PipeRegistry pipeRegistry;
    private final TemplateRenderer renderer;

    private TemplateEngine(Builder builder) {
        this.clock = builder.clock;
        this.pipeRegistry = builder.pipeRegistry;
        this.renderer = new TemplateRenderer(new TagResolver(clock), pipeRegistry);
    }

    /// Creates an engine with the system clock in the default zone and the built-in pipes.
    ///
    /// @return new engine, never null
    public static TemplateEngine create() {
        return builder().build();
    }

    /// @return a new builder, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Renders a template.
    ///
    /// @param template the template text, not null
    /// @param context values tags resolve against; not modified, not null
    /// @return the rendered text, never null
    /// @throws TemplateException if the template is malformed or any tag, loop source or
    ///                           pipe fails; output rendered before the failure is discarded
    public String render(String template, RenderContext context) throws TemplateException {
        Objects.requireNonNull(template, "template must not be null");
        Objects.requireNonNull(context, "context must not be null");

        List<Token> tokens = TemplateTokenizer.tokenize(template);
        logger.fine(
                () ->
                        "Rendering template ("
                                + template.length()
                                + " chars, "
                                + tokens.size()
                                + " tokens)");
        String output = renderer.render(tokens, context);
        logger.fine(() -> "Rendered " + output.length() + " chars");
        return output;
    }

    /// Tokenizes a template without evaluating it.
    ///
    /// @param template the template text, not null
    /// @return unmodifiable token list, never null
    /// @throws TemplateException on a syntax error
    public List<Token> tokenize(String template) throws TemplateException {
        Objects.requireNonNull(template, "template must not be null");
        return TemplateTokenizer.tokenize(template);
    }

    /// Checks a template's syntax and for/endfor nesting without resolving any tag.
    ///
    /// A template that passes can still fail at render time, e.g. on an unknown tag name
    /// or a missing dictionary key.
    ///
    /// @param template the template text, not null
    /// @return the tokens, never null
    /// @throws TemplateException on a syntax or nesting error
    public List<Token> validate(String template) throws TemplateException {
        List<Token> tokens = tokenize(template);
        BlockMatcher.checkBalanced(tokens);
        return tokens;
    }

    /// @return the clock used for `date`, `datetime` and `datetimeiso`, never null
    public Clock clock() {
        return clock;
    }

    /// @return the registry consulted for `| pipe` suffixes, never null
    public PipeRegistry pipes() {
        return pipeRegistry;
    }

    /// Fluent builder for {@link TemplateEngine}.
    ///
    /// ### Default Values
    /// - `clock`: {@link Clock#systemDefaultZone()}; dates render in its zone
    /// - `pipeRegistry`: a new {@link DefaultPipeRegistry}
    public static final class Builder {
        private Clock clock = Clock.systemDefaultZone();
        private PipeRegistry pipeRegistry;

        private Builder() {}

        /// Sets the source of "now". Tests pass {@link Clock#fixed}.
        ///
        /// @param clock the clock, not null
        /// @return this builder for chaining, never null
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /// Sets the pipe registry.
        ///
        /// @param pipeRegistry the registry, not null
        /// @return this builder for chaining, never null
        public Builder pipeRegistry(PipeRegistry pipeRegistry) {
            this.pipeRegistry = Objects.requireNonNull(pipeRegistry, "pipeRegistry must not be null");
            return this;
        }

        /// @return the configured engine, never null
        public TemplateEngine build() {
            if (pipeRegistry == null) {
                pipeRegistry = new DefaultPipeRegistry();
            }
            return new TemplateEngine(this);
        }
    }
}
