package io.vatic.core.template;

import io.vatic.core.template.TemplateException.Kind;
import java.util.List;
import java.util.Map;

/// Parses a for-block header, the text following `for `.
///
/// Accepted shapes:
/// - `<var> in (<start>..<end>)`: signed integer range, both bounds inclusive
/// - `<var> in <collection> [key:value]*`: named collection with loop parameters
///
/// Collection names are not validated here; {@link TemplateRenderer} rejects unknown
/// names when the loop runs.
final class ForLoopParser {

    private ForLoopParser() {}

    /// Parses a loop header.
    ///
    /// @param header trimmed text after the `for ` keyword, not null
    /// @return the parsed loop, never null
    /// @throws TemplateException `INVALID_FOR_LOOP_SYNTAX`, `UNCLOSED_RANGE_PAREN`,
    ///                           `INVALID_RANGE_SYNTAX`, `INVALID_RANGE_BOUND` or
    ///                           `INVALID_PARAM` when the header is malformed
    static ForLoop parse(String header) throws TemplateException {
        String[] pieces = header.split("\\s+", 3);
        if (pieces.length < 3 || !pieces[1].equals("in")) {
            throw new TemplateException(
                    Kind.INVALID_FOR_LOOP_SYNTAX, "invalid for loop syntax: 'for " + header + "'");
        }

        String var = pieces[0];
        String rest = pieces[2].trim();

        if (rest.startsWith("(")) {
            return new ForLoop(var, parseRange(rest), Map.of());
        }

        List<String> parts = TagParser.splitParts(rest);
        if (parts.isEmpty()) {
            throw new TemplateException(
                    Kind.INVALID_FOR_LOOP_SYNTAX, "missing collection name in for loop");
        }
        return new ForLoop(
                var,
                new LoopSource.Collection(parts.get(0)),
                TagParser.parseParams(parts.subList(1, parts.size())));
    }

    private static LoopSource.Range parseRange(String text) throws TemplateException {
        int close = text.indexOf(')');
        if (close < 0) {
            throw new TemplateException(Kind.UNCLOSED_RANGE_PAREN, "unclosed range parenthesis");
        }

        String inner = text.substring(1, close);
        String[] bounds = inner.split("\\.\\.", -1);
        if (bounds.length != 2) {
            throw new TemplateException(
                    Kind.INVALID_RANGE_SYNTAX, "invalid range syntax: '" + inner + "'");
        }

        long start = parseBound(bounds[0], "start");
        long end = parseBound(bounds[1], "end");
        return new LoopSource.Range(start, end);
    }

    private static long parseBound(String bound, String side) throws TemplateException {
        try {
            return Long.parseLong(bound.trim());
        } catch (NumberFormatException e) {
            throw new TemplateException(
                    Kind.INVALID_RANGE_BOUND, "invalid range " + side + ": '" + bound + "'", e);
        }
    }
}
