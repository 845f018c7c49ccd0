package io.vatic.core.template;

import io.vatic.core.template.TemplateException.Kind;
import java.util.List;

/// Delimits for-block bodies in a flat token stream.
final class BlockMatcher {

    private BlockMatcher() {}

    /// Body of a for-block and the position of its closing {@link Token.ForEnd}.
    ///
    /// @param body tokens strictly between the `ForStart` and its matching `ForEnd`
    /// @param endIndex index of the matching `ForEnd` in the scanned list
    record Block(List<Token> body, int endIndex) {}

    /// Finds the `ForEnd` matching a `ForStart`, skipping nested blocks.
    ///
    /// @param tokens the enclosing token list, not null
    /// @param from index just after the `ForStart`
    /// @return the body view and the matching end index, never null
    /// @throws TemplateException `UNTERMINATED_FOR_LOOP` if the list ends first
    static Block match(List<Token> tokens, int from) throws TemplateException {
        int depth = 0;
        for (int i = from; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token instanceof Token.ForStart) {
                depth++;
            } else if (token instanceof Token.ForEnd) {
                if (depth == 0) {
                    return new Block(tokens.subList(from, i), i);
                }
                depth--;
            }
        }
        throw new TemplateException(
                Kind.UNTERMINATED_FOR_LOOP, "for loop without matching endfor");
    }

    /// Checks that every `ForStart` has a matching `ForEnd` and no `ForEnd` is stray.
    ///
    /// @param tokens a complete token stream, not null
    /// @throws TemplateException `UNEXPECTED_END_FOR` or `UNTERMINATED_FOR_LOOP`
    static void checkBalanced(List<Token> tokens) throws TemplateException {
        int depth = 0;
        for (Token token : tokens) {
            if (token instanceof Token.ForStart) {
                depth++;
            } else if (token instanceof Token.ForEnd) {
                if (depth == 0) {
                    throw unexpectedEndFor();
                }
                depth--;
            }
        }
        if (depth > 0) {
            throw new TemplateException(
                    Kind.UNTERMINATED_FOR_LOOP, "for loop without matching endfor");
        }
    }

    static TemplateException unexpectedEndFor() {
        return new TemplateException(
                Kind.UNEXPECTED_END_FOR, "unexpected endfor outside for loop");
    }
}
