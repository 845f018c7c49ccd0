package io.vatic.core.template;

import io.vatic.core.template.TemplateException.Kind;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Parses the trimmed body of a value tag into {@link TagContent}.
///
/// ### Grammar
/// ```
/// body  := name param* ("|" pipe)?
/// param := key "=" value | key ":" value
/// ```
/// Parts are separated by whitespace outside double quotes. Quote characters stay in the
/// captured part. A part containing `=` is always split at the first `=`, even when a `:`
/// appears earlier, so `key=val:ue` yields key `key` and value `val:ue`.
///
/// The pipe is split off at the first `|` in the body, quoted or not.
///
/// @implNote Stateless utility. Safe to call from any thread.
/// @see TemplateTokenizer for dispatch between tags and loop delimiters
final class TagParser {

    private TagParser() {}

    /// Parses a tag body.
    ///
    /// @param body trimmed text between `{%` and `%}`, not null
    /// @return the parsed tag, never null
    /// @throws TemplateException `EMPTY_TAG` if no name is present, `INVALID_PARAM` if a
    ///                           parameter lacks a separator or has an empty key
    static TagContent parse(String body) throws TemplateException {
        int pipeAt = body.indexOf('|');
        String beforePipe = pipeAt < 0 ? body : body.substring(0, pipeAt).trim();
        String pipe = null;
        if (pipeAt >= 0) {
            String afterPipe = body.substring(pipeAt + 1).trim();
            pipe = afterPipe.isEmpty() ? null : afterPipe;
        }

        List<String> parts = splitParts(beforePipe);
        if (parts.isEmpty()) {
            throw new TemplateException(Kind.EMPTY_TAG, "empty tag");
        }

        return new TagContent(parts.get(0), parseParams(parts.subList(1, parts.size())), pipe);
    }

    /// Parses `key=value` / `key:value` parts into an ordered map. Later duplicates win.
    ///
    /// @param parts parameter parts, not null
    /// @return parameters in declaration order, never null
    /// @throws TemplateException `INVALID_PARAM` on the first malformed part
    static Map<String, String> parseParams(List<String> parts) throws TemplateException {
        Map<String, String> params = new LinkedHashMap<>();
        for (String part : parts) {
            Map.Entry<String, String> param = parseParam(part);
            params.put(param.getKey(), param.getValue());
        }
        return params;
    }

    /// Splits one parameter part at its separator. `=` takes precedence over `:`.
    ///
    /// @param part a single whitespace-delimited part, not null
    /// @return key and value; the value may be empty
    /// @throws TemplateException `INVALID_PARAM` if no separator is present or the key is empty
    static Map.Entry<String, String> parseParam(String part) throws TemplateException {
        int sep = part.indexOf('=');
        if (sep < 0) {
            sep = part.indexOf(':');
        }
        if (sep < 0) {
            throw new TemplateException(
                    Kind.INVALID_PARAM, "invalid parameter (missing '=' or ':'): '" + part + "'");
        }
        if (sep == 0) {
            throw new TemplateException(
                    Kind.INVALID_PARAM, "empty parameter key in '" + part + "'");
        }
        return Map.entry(part.substring(0, sep), part.substring(sep + 1));
    }

    /// Splits text on whitespace, keeping double-quoted runs (quotes included) together.
    ///
    /// @param input text to split, not null
    /// @return non-empty parts in order, never null
    static List<String> splitParts(String input) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;

        for (int i = 0; i < input.length(); i++) {
            char ch = input.charAt(i);
            if (ch == '"') {
                inQuotes = !inQuotes;
                current.append(ch);
            } else if (!inQuotes && Character.isWhitespace(ch)) {
                if (current.length() > 0) {
                    parts.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(ch);
            }
        }

        if (current.length() > 0) {
            parts.add(current.toString());
        }
        return parts;
    }
}
