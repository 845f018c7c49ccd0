package io.vatic.core.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.vatic.core.template.TemplateException.Kind;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DurationParserTest {

    @Test
    void shouldParseDays() throws Exception {
        assertThat(DurationParser.parse("1d")).isEqualTo(Duration.ofDays(1));
    }

    @Test
    void shouldParseHours() throws Exception {
        assertThat(DurationParser.parse("3h")).isEqualTo(Duration.ofHours(3));
    }

    @Test
    void shouldParseMinutes() throws Exception {
        assertThat(DurationParser.parse("30m")).isEqualTo(Duration.ofMinutes(30));
    }

    @Test
    void shouldParseSignedAmounts() throws Exception {
        assertThat(DurationParser.parse("-2d")).isEqualTo(Duration.ofDays(-2));
        assertThat(DurationParser.parse("+5m")).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    void shouldParseZero() throws Exception {
        assertThat(DurationParser.parse("0h")).isZero();
    }

    @Test
    void shouldRejectEmptyText() {
        assertThatThrownBy(() -> DurationParser.parse(""))
                .isInstanceOf(TemplateException.class)
                .hasMessage("empty duration")
                .extracting(e -> ((TemplateException) e).kind())
                .isEqualTo(Kind.EMPTY_DURATION);
    }

    @ParameterizedTest
    @ValueSource(strings = {"d", "xd", "1.5h", " 1d", "1 d"})
    void shouldRejectInvalidNumbers(String text) {
        assertThatThrownBy(() -> DurationParser.parse(text))
                .isInstanceOf(TemplateException.class)
                .hasMessageStartingWith("invalid duration number")
                .extracting(e -> ((TemplateException) e).kind())
                .isEqualTo(Kind.INVALID_DURATION_NUMBER);
    }

    @ParameterizedTest
    @ValueSource(strings = {"1w", "5s", "2D", "10"})
    void shouldRejectUnknownUnits(String text) {
        assertThatThrownBy(() -> DurationParser.parse(text))
                .isInstanceOf(TemplateException.class)
                .extracting(e -> ((TemplateException) e).kind())
                .isEqualTo(Kind.UNKNOWN_DURATION_UNIT);
    }

    @Test
    void shouldNameTheBadUnit() {
        assertThatThrownBy(() -> DurationParser.parse("1w"))
                .isInstanceOf(TemplateException.class)
                .hasMessage("unknown duration unit: 'w'");
    }

    @Test
    void shouldRejectOverflowingDays() {
        assertThatThrownBy(() -> DurationParser.parse(Long.MAX_VALUE + "d"))
                .isInstanceOf(TemplateException.class)
                .extracting(e -> ((TemplateException) e).kind())
                .isEqualTo(Kind.INVALID_DURATION_NUMBER);
    }
}
