package io.vatic.core.context;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Everything a template can read while it renders.
///
/// Caller data (dictionary, secrets, current result, inbound message, sender and
/// memories) is fixed at construction. Loop variables live in a separate scope that the
/// renderer writes on its own per-loop {@link #copy()}, so bindings made inside a
/// for-block are never visible outside it.
///
/// ### Contracts
/// - **Invariant**: caller data never changes after {@link Builder#build()}
/// - **Invariant**: `memories` is ordered newest first
///
/// @implNote Not thread-safe while loop variables are being bound. A context handed to
/// {@link io.vatic.core.template.TemplateEngine#render} is only read; the engine binds
/// variables on private copies, so one context may be shared by concurrent renders.
public final class RenderContext {

    private final Dictionary dictionary;
    private final Secrets secrets;
    private final String result;
    private final String message;
    private final String sender;
    private final List<MemoryEntry> memories;
    private final Map<String, LoopValue> loopVars;

    private RenderContext(Builder builder) {
        this.dictionary = builder.dictionary;
        this.secrets = builder.secrets;
        this.result = builder.result;
        this.message = builder.message;
        this.sender = builder.sender;
        this.memories = List.copyOf(builder.memories);
        this.loopVars = new HashMap<>(builder.loopVars);
    }

    private RenderContext(RenderContext source) {
        this.dictionary = source.dictionary;
        this.secrets = source.secrets;
        this.result = source.result;
        this.message = source.message;
        this.sender = source.sender;
        this.memories = source.memories;
        this.loopVars = new HashMap<>(source.loopVars);
    }

    /// Minimal context with only a dictionary.
    ///
    /// @param dictionary static lookup table, not null
    /// @return new context, never null
    public static RenderContext of(Dictionary dictionary) {
        return builder().dictionary(dictionary).build();
    }

    /// @return a new builder with an empty dictionary and no secrets, never null
    public static Builder builder() {
        return new Builder();
    }

    public Dictionary dictionary() {
        return dictionary;
    }

    public Secrets secrets() {
        return secrets;
    }

    /// @return output of the current job run, or empty if not yet available
    public Optional<String> result() {
        return Optional.ofNullable(result);
    }

    /// @return inbound message text, or empty outside a message-triggered run
    public Optional<String> message() {
        return Optional.ofNullable(message);
    }

    /// @return identity of the message sender, or empty if unknown
    public Optional<String> sender() {
        return Optional.ofNullable(sender);
    }

    /// @return stored results of previous runs, newest first, never null
    public List<MemoryEntry> memories() {
        return memories;
    }

    /// Looks up a loop variable binding.
    ///
    /// @param name variable name, not null
    /// @return the bound value, or empty if the name is unbound
    public Optional<LoopValue> loopVar(String name) {
        return Optional.ofNullable(loopVars.get(name));
    }

    /// @return unmodifiable view of the current loop bindings, never null
    public Map<String, LoopValue> loopVars() {
        return Collections.unmodifiableMap(loopVars);
    }

    /// Structural copy sharing all caller data and owning a fresh loop scope.
    ///
    /// @return the copy, never null
    public RenderContext copy() {
        return new RenderContext(this);
    }

    /// Copy with one additional loop binding.
    ///
    /// @param name variable name, not null
    /// @param value bound value, not null
    /// @return the copy, never null
    public RenderContext withLoopVar(String name, LoopValue value) {
        RenderContext copy = copy();
        copy.bindLoopVar(name, value);
        return copy;
    }

    /// Binds a loop variable in this context, replacing any previous binding.
    ///
    /// @apiNote **Side effects**: mutates this context's loop scope. The renderer only calls
    /// this on the copy it made for the current for-block.
    ///
    /// @param name variable name, not null
    /// @param value bound value, not null
    public void bindLoopVar(String name, LoopValue value) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
        loopVars.put(name, value);
    }

    @Override
    public String toString() {
        return "RenderContext[dictionary sections="
                + dictionary.sections().size()
                + ", "
                + secrets
                + ", memories="
                + memories.size()
                + ", loopVars="
                + loopVars.keySet()
                + "]";
    }

    /// Fluent builder for {@link RenderContext}.
    public static final class Builder {
        private Dictionary dictionary = Dictionary.empty();
        private Secrets secrets = Secrets.empty();
        private String result;
        private String message;
        private String sender;
        private List<MemoryEntry> memories = List.of();
        private final Map<String, LoopValue> loopVars = new HashMap<>();

        private Builder() {}

        public Builder dictionary(Dictionary dictionary) {
            this.dictionary = Objects.requireNonNull(dictionary, "dictionary must not be null");
            return this;
        }

        public Builder secrets(Secrets secrets) {
            this.secrets = Objects.requireNonNull(secrets, "secrets must not be null");
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder sender(String sender) {
            this.sender = sender;
            return this;
        }

        /// Sets the memories, newest first.
        ///
        /// @param memories stored results, not null
        /// @return this builder for chaining, never null
        public Builder memories(List<MemoryEntry> memories) {
            this.memories = Objects.requireNonNull(memories, "memories must not be null");
            return this;
        }

        public Builder loopVar(String name, LoopValue value) {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(value, "value must not be null");
            loopVars.put(name, value);
            return this;
        }

        /// @return the context, never null
        public RenderContext build() {
            return new RenderContext(this);
        }
    }
}
