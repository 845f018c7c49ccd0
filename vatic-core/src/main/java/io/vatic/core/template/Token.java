package io.vatic.core.template;

import java.util.Objects;

/// Sealed hierarchy of the flat token stream produced by {@link TemplateTokenizer}.
///
/// ### Permitted Subtypes
/// - {@link Literal}: text outside `{% ... %}`, reproduced byte for byte
/// - {@link Tag}: a value tag such as `{% date minus=1d %}`
/// - {@link ForStart}: opens a for-block, `{% for i in (1..3) %}`
/// - {@link ForEnd}: closes the innermost open for-block, `{% endfor %}`
///
/// The stream is flat; nesting is recovered at render time by {@link BlockMatcher}.
///
/// @implNote Thread-safe. All permitted subtypes are immutable records.
public sealed interface Token permits Token.Literal, Token.Tag, Token.ForStart, Token.ForEnd {

    /// Literal text, never trimmed.
    ///
    /// @param text the verbatim text, not null
    record Literal(String text) implements Token {

        public Literal {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    /// A value tag.
    ///
    /// @param content parsed name, params and pipe, not null
    record Tag(TagContent content) implements Token {

        public Tag {
            Objects.requireNonNull(content, "content must not be null");
        }
    }

    /// Start of a for-block.
    ///
    /// @param loop parsed loop header, not null
    record ForStart(ForLoop loop) implements Token {

        public ForStart {
            Objects.requireNonNull(loop, "loop must not be null");
        }
    }

    /// End of a for-block.
    record ForEnd() implements Token {}
}
