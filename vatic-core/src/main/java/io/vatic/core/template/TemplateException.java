package io.vatic.core.template;

import java.io.Serial;
import java.util.Objects;

/// Thrown when a template cannot be tokenized or rendered.
///
/// Every failure is terminal for the render call that raised it: no partial output is
/// returned and the engine never retries. The {@link Kind} tells callers which rule was
/// violated without having to parse the message.
///
/// ### Parse vs evaluation errors
/// Kinds reporting a malformed template (see {@link Kind#isParseError()}) are raised by
/// the tokenizer or the block matcher. All other kinds are raised while a specific tag
/// or loop is being evaluated.
///
/// @see TemplateEngine#render
public class TemplateException extends Exception {

    @Serial private static final long serialVersionUID = 3817046528170943610L;

    /// Failure categories raised by the template engine.
    public enum Kind {
        UNCLOSED_TAG(true),
        EMPTY_TAG(true),
        INVALID_PARAM(true),
        INVALID_FOR_LOOP_SYNTAX(true),
        UNCLOSED_RANGE_PAREN(true),
        INVALID_RANGE_SYNTAX(true),
        INVALID_RANGE_BOUND(true),
        UNTERMINATED_FOR_LOOP(true),
        UNEXPECTED_END_FOR(true),
        UNKNOWN_COLLECTION(false),
        UNKNOWN_TAG(false),
        UNKNOWN_LOOP_VARIABLE(false),
        UNKNOWN_LOOP_FIELD(false),
        UNKNOWN_DICTIONARY_KEY(false),
        UNKNOWN_SECRET(false),
        EMPTY_DURATION(false),
        INVALID_DURATION_NUMBER(false),
        UNKNOWN_DURATION_UNIT(false),
        INVALID_MEMORY_OFFSET(false),
        MEMORY_OFFSET_OUT_OF_RANGE(false),
        UNKNOWN_PIPE(false),
        INTERPOLATION_TYPE_MISMATCH(false);

        private final boolean parseError;

        Kind(boolean parseError) {
            this.parseError = parseError;
        }

        /// Returns whether this kind describes a structurally malformed template.
        ///
        /// @return `true` for tokenizer and block-matching failures, `false` for
        ///         failures raised while resolving a tag, loop source or pipe
        public boolean isParseError() {
            return parseError;
        }
    }

    private final Kind kind;

    /// Creates exception with kind and message.
    ///
    /// @param kind the failure category, not null
    /// @param message description naming the offending template text
    public TemplateException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    /// Creates exception with kind, message and cause.
    ///
    /// @param kind the failure category, not null
    /// @param message description naming the offending template text
    /// @param cause the underlying exception
    public TemplateException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    /// Returns the failure category.
    ///
    /// @return the kind, never null
    public Kind kind() {
        return kind;
    }

    /// Shorthand for `kind().isParseError()`.
    ///
    /// @return `true` if the template itself is malformed
    public boolean isParseError() {
        return kind.isParseError();
    }
}
