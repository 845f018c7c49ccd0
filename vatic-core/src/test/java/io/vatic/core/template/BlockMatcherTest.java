package io.vatic.core.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.vatic.core.template.TemplateException.Kind;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class BlockMatcherTest {

    private static final Token START = new Token.ForStart(
            new ForLoop("i", new LoopSource.Range(1, 2), null));
    private static final Token END = new Token.ForEnd();

    private static Token literal(String text) {
        return new Token.Literal(text);
    }

    @Nested
    class Match {

        @Test
        void shouldReturnBodyAndEndIndex() throws Exception {
            List<Token> tokens = List.of(START, literal("a"), END, literal("b"));

            BlockMatcher.Block block = BlockMatcher.match(tokens, 1);

            assertThat(block.body()).containsExactly(literal("a"));
            assertThat(block.endIndex()).isEqualTo(2);
        }

        @Test
        void shouldSkipNestedBlocks() throws Exception {
            List<Token> tokens = List.of(START, START, literal("x"), END, literal("y"), END);

            BlockMatcher.Block block = BlockMatcher.match(tokens, 1);

            assertThat(block.endIndex()).isEqualTo(5);
            assertThat(block.body()).containsExactly(START, literal("x"), END, literal("y"));
        }

        @Test
        void shouldReturnEmptyBodyForEmptyBlock() throws Exception {
            BlockMatcher.Block block = BlockMatcher.match(List.of(START, END), 1);

            assertThat(block.body()).isEmpty();
            assertThat(block.endIndex()).isEqualTo(1);
        }

        @Test
        void shouldFailWhenEndIsMissing() {
            List<Token> tokens = List.of(START, START, END);

            assertThatThrownBy(() -> BlockMatcher.match(tokens, 1))
                    .isInstanceOf(TemplateException.class)
                    .hasMessage("for loop without matching endfor")
                    .extracting(e -> ((TemplateException) e).kind())
                    .isEqualTo(Kind.UNTERMINATED_FOR_LOOP);
        }
    }

    @Nested
    class CheckBalanced {

        @Test
        void shouldAcceptBalancedStream() {
            List<Token> tokens = List.of(START, START, END, literal("z"), END, START, END);

            assertThatCode(() -> BlockMatcher.checkBalanced(tokens)).doesNotThrowAnyException();
        }

        @Test
        void shouldRejectStrayEnd() {
            List<Token> tokens = List.of(START, END, END);

            assertThatThrownBy(() -> BlockMatcher.checkBalanced(tokens))
                    .isInstanceOf(TemplateException.class)
                    .extracting(e -> ((TemplateException) e).kind())
                    .isEqualTo(Kind.UNEXPECTED_END_FOR);
        }

        @Test
        void shouldRejectUnterminatedStart() {
            assertThatThrownBy(() -> BlockMatcher.checkBalanced(List.of(START, literal("a"))))
                    .isInstanceOf(TemplateException.class)
                    .extracting(e -> ((TemplateException) e).kind())
                    .isEqualTo(Kind.UNTERMINATED_FOR_LOOP);
        }

        @Test
        void shouldClassifyNestingErrorsAsParseErrors() {
            assertThat(BlockMatcher.unexpectedEndFor().isParseError()).isTrue();
        }
    }
}
