package io.vatic.core.template;

import io.vatic.core.template.TemplateException.Kind;
import java.time.Duration;

/// Parses the `minus` / `plus` offsets of `date` and `datetime` tags.
///
/// Format: `<integer><unit>` with unit `d` (days), `h` (hours) or `m` (minutes). The
/// integer may be signed. No whitespace, fractions or compound forms are accepted.
final class DurationParser {

    private DurationParser() {}

    /// Parses an offset such as `1d`, `-3h` or `30m`.
    ///
    /// @param text the offset text, not null
    /// @return the duration, never null
    /// @throws TemplateException `EMPTY_DURATION`, `INVALID_DURATION_NUMBER` or
    ///                           `UNKNOWN_DURATION_UNIT`
    static Duration parse(String text) throws TemplateException {
        if (text.isEmpty()) {
            throw new TemplateException(Kind.EMPTY_DURATION, "empty duration");
        }

        int unitAt = text.offsetByCodePoints(text.length(), -1);
        String number = text.substring(0, unitAt);
        String unit = text.substring(unitAt);

        long amount;
        try {
            amount = Long.parseLong(number);
        } catch (NumberFormatException e) {
            throw new TemplateException(
                    Kind.INVALID_DURATION_NUMBER, "invalid duration number: '" + number + "'", e);
        }

        try {
            return switch (unit) {
                case "d" -> Duration.ofDays(amount);
                case "h" -> Duration.ofHours(amount);
                case "m" -> Duration.ofMinutes(amount);
                default -> throw new TemplateException(
                        Kind.UNKNOWN_DURATION_UNIT, "unknown duration unit: '" + unit + "'");
            };
        } catch (ArithmeticException e) {
            throw new TemplateException(
                    Kind.INVALID_DURATION_NUMBER, "duration out of range: '" + text + "'", e);
        }
    }
}
