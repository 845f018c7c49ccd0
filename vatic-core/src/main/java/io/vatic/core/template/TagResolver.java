package io.vatic.core.template;

import io.vatic.core.context.Dictionary;
import io.vatic.core.context.LoopValue;
import io.vatic.core.context.MemoryEntry;
import io.vatic.core.context.RenderContext;
import io.vatic.core.context.Secret;
import io.vatic.core.template.TemplateException.Kind;
import java.math.BigInteger;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/// Resolves a parsed value tag against a {@link RenderContext}.
///
/// ### Resolution order
/// The first matching rule wins:
/// 1. name contains `.` → field of a memory loop variable (`i.date`, `i.datetime`, `i.result`)
/// 2. `proxy:<name>` → match URL of the named secret
/// 3. `custom:<key>` → `general` section of the dictionary
/// 4. `date` → now plus offset, `yyyy-MM-dd`
/// 5. `datetime` → now plus offset, `yyyy-MM-dd HH:mm`
/// 6. `datetimeiso` → now as an RFC 3339 timestamp, params ignored
/// 7. `result`, 8. `message`, 9. `sender` → context value or empty string
/// 10. `memory` → result of a stored memory, `minus=1` (default) is the newest
/// 11. bare loop variable → index in decimal or memory result
/// 12. anything else fails with `UNKNOWN_TAG`
///
/// ### Offsets
/// `minus` and `plus` hold `<int><d|h|m>`. A value of the form `i"d"` is interpolated
/// with the index bound to `i`, giving e.g. `2d`. If no variable of that name is bound
/// the raw text is used as is.
///
/// @implNote Thread-safe. Holds only the clock; all state comes from the context.
final class TagResolver {

    static final String PROXY_PREFIX = "proxy:";
    static final String CUSTOM_PREFIX = "custom:";
    static final String MINUS = "minus";
    static final String PLUS = "plus";

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter DATETIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final DateTimeFormatter ISO_SECONDS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");
    private static final DateTimeFormatter ISO_OFFSET = DateTimeFormatter.ofPattern("xxx");
    private static final Pattern UNSIGNED = Pattern.compile("\\+?\\d+");

    private final Clock clock;

    TagResolver(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Resolves a tag to its text.
    ///
    /// @param tag the parsed tag, not null
    /// @param ctx the current context, including loop bindings, not null
    /// @return the resolved value, never null
    /// @throws TemplateException if the tag cannot be resolved
    String resolve(TagContent tag, RenderContext ctx) throws TemplateException {
        String name = tag.name();

        int dot = name.indexOf('.');
        if (dot >= 0) {
            return resolveField(name.substring(0, dot), name.substring(dot + 1), ctx);
        }
        if (name.startsWith(PROXY_PREFIX)) {
            return resolveProxy(name.substring(PROXY_PREFIX.length()), ctx);
        }
        if (name.startsWith(CUSTOM_PREFIX)) {
            return resolveCustom(name.substring(CUSTOM_PREFIX.length()), ctx);
        }

        return switch (name) {
            case "date" -> now(tag, ctx).format(DATE);
            case "datetime" -> now(tag, ctx).format(DATETIME);
            case "datetimeiso" -> formatIso(OffsetDateTime.now(clock));
            case "result" -> ctx.result().orElse("");
            case "message" -> ctx.message().orElse("");
            case "sender" -> ctx.sender().orElse("");
            case "memory" -> resolveMemory(tag, ctx);
            default -> resolveLoopVar(name, ctx);
        };
    }

    private String resolveField(String varName, String field, RenderContext ctx)
            throws TemplateException {
        LoopValue value =
                ctx.loopVar(varName)
                        .orElseThrow(
                                () ->
                                        new TemplateException(
                                                Kind.UNKNOWN_LOOP_VARIABLE,
                                                "unknown loop variable: '" + varName + "'"));

        if (!(value instanceof LoopValue.Memory memory)) {
            throw new TemplateException(
                    Kind.UNKNOWN_LOOP_FIELD,
                    "index variable '" + varName + "' has no field '" + field + "'");
        }

        MemoryEntry entry = memory.entry();
        return switch (field) {
            case "date" -> entry.date();
            case "datetime" -> entry.datetime();
            case "result" -> entry.result();
            default -> throw new TemplateException(
                    Kind.UNKNOWN_LOOP_FIELD, "memory has no field '" + field + "'");
        };
    }

    private String resolveProxy(String secretName, RenderContext ctx) throws TemplateException {
        return ctx.secrets()
                .get(secretName)
                .map(Secret::matchUrl)
                .orElseThrow(
                        () ->
                                new TemplateException(
                                        Kind.UNKNOWN_SECRET,
                                        "unknown secret for proxy: '" + secretName + "'"));
    }

    private String resolveCustom(String key, RenderContext ctx) throws TemplateException {
        return ctx.dictionary()
                .get(Dictionary.GENERAL, key)
                .orElseThrow(
                        () ->
                                new TemplateException(
                                        Kind.UNKNOWN_DICTIONARY_KEY,
                                        "unknown dictionary key: 'custom:" + key + "'"));
    }

    private String resolveMemory(TagContent tag, RenderContext ctx) throws TemplateException {
        BigInteger offset = BigInteger.ZERO;
        Optional<String> minus = tag.param(MINUS);
        if (minus.isPresent()) {
            BigInteger requested = parseMemoryOffset(minus.get());
            offset =
                    requested.signum() == 0
                            ? BigInteger.ZERO
                            : requested.subtract(BigInteger.ONE);
        }

        List<MemoryEntry> memories = ctx.memories();
        if (offset.compareTo(BigInteger.valueOf(memories.size())) >= 0) {
            throw new TemplateException(
                    Kind.MEMORY_OFFSET_OUT_OF_RANGE,
                    "no memory at offset " + offset + " (have " + memories.size() + " memories)");
        }
        return memories.get(offset.intValue()).result();
    }

    // Unbounded: an integer too large for the list is out of range, not malformed.
    private static BigInteger parseMemoryOffset(String text) throws TemplateException {
        if (!UNSIGNED.matcher(text).matches()) {
            throw new TemplateException(
                    Kind.INVALID_MEMORY_OFFSET, "invalid memory offset: '" + text + "'");
        }
        return new BigInteger(text);
    }

    /// RFC 3339 with a numeric offset (`+00:00` for UTC). Fractional seconds are printed
    /// only when present, in groups of 3, 6 or 9 digits.
    static String formatIso(OffsetDateTime now) {
        int nanos = now.getNano();
        String fraction;
        if (nanos == 0) {
            fraction = "";
        } else if (nanos % 1_000_000 == 0) {
            fraction = String.format(Locale.ROOT, ".%03d", nanos / 1_000_000);
        } else if (nanos % 1_000 == 0) {
            fraction = String.format(Locale.ROOT, ".%06d", nanos / 1_000);
        } else {
            fraction = String.format(Locale.ROOT, ".%09d", nanos);
        }
        return now.format(ISO_SECONDS) + fraction + now.format(ISO_OFFSET);
    }

    private static String resolveLoopVar(String name, RenderContext ctx) throws TemplateException {
        return ctx.loopVar(name)
                .map(LoopValue::asText)
                .orElseThrow(
                        () ->
                                new TemplateException(
                                        Kind.UNKNOWN_TAG, "unknown tag: '" + name + "'"));
    }

    private ZonedDateTime now(TagContent tag, RenderContext ctx) throws TemplateException {
        Duration offset = computeOffset(tag, ctx);
        try {
            return ZonedDateTime.now(clock).plus(offset);
        } catch (DateTimeException | ArithmeticException e) {
            throw new TemplateException(
                    Kind.INVALID_DURATION_NUMBER, "date offset out of range: " + offset, e);
        }
    }

    /// Sums the `minus` and `plus` params of a date tag. Absent params count as zero.
    static Duration computeOffset(TagContent tag, RenderContext ctx) throws TemplateException {
        Duration total = Duration.ZERO;
        try {
            Optional<String> minus = tag.param(MINUS);
            if (minus.isPresent()) {
                total = total.minus(DurationParser.parse(interpolate(minus.get(), ctx)));
            }
            Optional<String> plus = tag.param(PLUS);
            if (plus.isPresent()) {
                total = total.plus(DurationParser.parse(interpolate(plus.get(), ctx)));
            }
        } catch (ArithmeticException e) {
            throw new TemplateException(
                    Kind.INVALID_DURATION_NUMBER, "date offset out of range", e);
        }
        return total;
    }

    /// Expands `var"suffix"` into `<index of var><suffix>`.
    ///
    /// Text without a quote, or whose variable part is not bound, comes back unchanged.
    ///
    /// @param raw the raw parameter text, not null
    /// @param ctx context holding loop bindings, not null
    /// @return the interpolated text, never null
    /// @throws TemplateException `INTERPOLATION_TYPE_MISMATCH` if the variable is bound to
    ///                           a memory rather than an index
    static String interpolate(String raw, RenderContext ctx) throws TemplateException {
        int quote = raw.indexOf('"');
        if (quote < 0) {
            return raw;
        }

        String varName = raw.substring(0, quote);
        Optional<LoopValue> bound = ctx.loopVar(varName);
        if (bound.isEmpty()) {
            return raw;
        }
        if (!(bound.get() instanceof LoopValue.Index index)) {
            throw new TemplateException(
                    Kind.INTERPOLATION_TYPE_MISMATCH,
                    "loop variable '" + varName + "' is not an index, cannot interpolate");
        }

        String suffix = raw.substring(quote + 1);
        int end = suffix.length();
        while (end > 0 && suffix.charAt(end - 1) == '"') {
            end--;
        }
        return index.value() + suffix.substring(0, end);
    }
}
