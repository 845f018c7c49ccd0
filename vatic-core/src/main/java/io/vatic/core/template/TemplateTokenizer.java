package io.vatic.core.template;

import io.vatic.core.template.TemplateException.Kind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// Splits template text into a flat {@link Token} stream.
///
/// Text outside `{% ... %}` becomes {@link Token.Literal} unchanged, whitespace and
/// newlines included. The text inside a delimiter pair is trimmed and dispatched:
/// - exactly `endfor` → {@link Token.ForEnd}
/// - starts with `for ` → {@link ForLoopParser}
/// - anything else → {@link TagParser}
///
/// The whole template is tokenized before rendering starts, so syntax errors surface
/// before any tag is evaluated.
///
/// @implNote Stateless utility. Safe to call from any thread.
public final class TemplateTokenizer {

    static final String OPEN = "{%";
    static final String CLOSE = "%}";

    private static final String END_FOR = "endfor";
    private static final String FOR_PREFIX = "for ";

    private TemplateTokenizer() {}

    /// Tokenizes a template.
    ///
    /// @param template the template text, not null
    /// @return unmodifiable token list; empty for an empty template, never null
    /// @throws TemplateException `UNCLOSED_TAG` if a `{%` has no matching `%}`, or any
    ///                           parse error raised for a tag or loop header
    public static List<Token> tokenize(String template) throws TemplateException {
        List<Token> tokens = new ArrayList<>();
        int pos = 0;

        while (pos < template.length()) {
            int open = template.indexOf(OPEN, pos);
            if (open < 0) {
                tokens.add(new Token.Literal(template.substring(pos)));
                break;
            }
            if (open > pos) {
                tokens.add(new Token.Literal(template.substring(pos, open)));
            }

            int bodyStart = open + OPEN.length();
            int close = template.indexOf(CLOSE, bodyStart);
            if (close < 0) {
                throw new TemplateException(Kind.UNCLOSED_TAG, "unclosed tag: missing '%}'");
            }

            tokens.add(parseBody(template.substring(bodyStart, close).trim()));
            pos = close + CLOSE.length();
        }

        return Collections.unmodifiableList(tokens);
    }

    private static Token parseBody(String body) throws TemplateException {
        if (body.equals(END_FOR)) {
            return new Token.ForEnd();
        }
        if (body.startsWith(FOR_PREFIX)) {
            String header = body.substring(FOR_PREFIX.length()).trim();
            return new Token.ForStart(ForLoopParser.parse(header));
        }
        return new Token.Tag(TagParser.parse(body));
    }
}
