package io.vatic.core.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.vatic.core.template.TemplateException.Kind;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TemplateTokenizerTest {

    @Nested
    class Literals {

        @Test
        void shouldReturnSingleLiteralForPlainText() throws Exception {
            List<Token> tokens = TemplateTokenizer.tokenize("hello world");

            assertThat(tokens).containsExactly(new Token.Literal("hello world"));
        }

        @Test
        void shouldReturnNoTokensForEmptyInput() throws Exception {
            assertThat(TemplateTokenizer.tokenize("")).isEmpty();
        }

        @Test
        void shouldPreserveWhitespaceAndNewlinesExactly() throws Exception {
            String text = "  Line one\n\tLine TWO  \r\n";

            assertThat(TemplateTokenizer.tokenize(text)).containsExactly(new Token.Literal(text));
        }

        @Test
        void shouldKeepWhitespaceLiteralBetweenTags() throws Exception {
            List<Token> tokens = TemplateTokenizer.tokenize("{% date %} {% result %}");

            assertThat(tokens).hasSize(3);
            assertThat(tokens.get(1)).isEqualTo(new Token.Literal(" "));
        }

        @Test
        void shouldReturnUnmodifiableList() throws Exception {
            List<Token> tokens = TemplateTokenizer.tokenize("text");

            assertThatThrownBy(() -> tokens.add(new Token.ForEnd()))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    class Tags {

        @Test
        void shouldParseSimpleTag() throws Exception {
            List<Token> tokens = TemplateTokenizer.tokenize("{% date %}");

            assertThat(tokens).containsExactly(new Token.Tag(TagContent.of("date")));
        }

        @Test
        void shouldParseTagWithoutSurroundingSpaces() throws Exception {
            List<Token> tokens = TemplateTokenizer.tokenize("{%date%}");

            assertThat(tokens).containsExactly(new Token.Tag(TagContent.of("date")));
        }

        @Test
        void shouldSplitMixedContent() throws Exception {
            List<Token> tokens =
                    TemplateTokenizer.tokenize("Hello {% custom:name %}, today is {% date %}");

            assertThat(tokens)
                    .containsExactly(
                            new Token.Literal("Hello "),
                            new Token.Tag(TagContent.of("custom:name")),
                            new Token.Literal(", today is "),
                            new Token.Tag(TagContent.of("date")));
        }

        @Test
        void shouldParseAdjacentTags() throws Exception {
            List<Token> tokens = TemplateTokenizer.tokenize("{% date %}{% result %}");

            assertThat(tokens)
                    .containsExactly(
                            new Token.Tag(TagContent.of("date")),
                            new Token.Tag(TagContent.of("result")));
        }

        @Test
        void shouldParsePipe() throws Exception {
            Token token = TemplateTokenizer.tokenize("{% i.result | summary %}").get(0);

            assertThat(token).isInstanceOf(Token.Tag.class);
            TagContent tag = ((Token.Tag) token).content();
            assertThat(tag.name()).isEqualTo("i.result");
            assertThat(tag.pipe()).isEqualTo("summary");
        }

        @Test
        void shouldFailOnUnclosedTag() {
            assertThatThrownBy(() -> TemplateTokenizer.tokenize("{% date"))
                    .isInstanceOf(TemplateException.class)
                    .hasMessageContaining("unclosed tag")
                    .extracting(e -> ((TemplateException) e).kind())
                    .isEqualTo(Kind.UNCLOSED_TAG);
        }

        @Test
        void shouldFailOnEmptyTag() {
            assertThatThrownBy(() -> TemplateTokenizer.tokenize("{% %}"))
                    .isInstanceOf(TemplateException.class)
                    .hasMessageContaining("empty tag");
        }

        @Test
        void shouldNotTreatOpenerInsideTagAsNewTag() {
            assertThatThrownBy(() -> TemplateTokenizer.tokenize("text {%}"))
                    .isInstanceOf(TemplateException.class)
                    .extracting(e -> ((TemplateException) e).kind())
                    .isEqualTo(Kind.UNCLOSED_TAG);
        }
    }

    @Nested
    class ForBlocks {

        @Test
        void shouldParseRangeLoop() throws Exception {
            List<Token> tokens = TemplateTokenizer.tokenize("{% for i in (1..3) %}{% endfor %}");

            assertThat(tokens)
                    .containsExactly(
                            new Token.ForStart(
                                    new ForLoop("i", new LoopSource.Range(1, 3), null)),
                            new Token.ForEnd());
        }

        @Test
        void shouldParseCollectionLoopWithLimit() throws Exception {
            List<Token> tokens =
                    TemplateTokenizer.tokenize("{% for m in memories limit:3 %}{% endfor %}");

            ForLoop loop = ((Token.ForStart) tokens.get(0)).loop();
            assertThat(loop.var()).isEqualTo("m");
            assertThat(loop.source()).isEqualTo(new LoopSource.Collection("memories"));
            assertThat(loop.param("limit")).hasValue("3");
        }

        @Test
        void shouldParseNestedLoopsAsFlatStream() throws Exception {
            List<Token> tokens =
                    TemplateTokenizer.tokenize(
                            "{% for i in (1..2) %}{% for j in (3..4) %}{% endfor %}{% endfor %}");

            assertThat(tokens).hasSize(4);
            assertThat(((Token.ForStart) tokens.get(0)).loop().var()).isEqualTo("i");
            assertThat(((Token.ForStart) tokens.get(1)).loop().var()).isEqualTo("j");
            assertThat(tokens.get(2)).isInstanceOf(Token.ForEnd.class);
            assertThat(tokens.get(3)).isInstanceOf(Token.ForEnd.class);
        }

        @Test
        void shouldTreatBareForAsOrdinaryTag() throws Exception {
            List<Token> tokens = TemplateTokenizer.tokenize("{% for %}");

            assertThat(tokens).containsExactly(new Token.Tag(TagContent.of("for")));
        }

        @Test
        void shouldNotValidateNestingWhileTokenizing() throws Exception {
            assertThat(TemplateTokenizer.tokenize("{% endfor %}"))
                    .containsExactly(new Token.ForEnd());
        }

        @Test
        void shouldFailOnMissingIn() {
            assertThatThrownBy(() -> TemplateTokenizer.tokenize("{% for i of (1..3) %}"))
                    .isInstanceOf(TemplateException.class)
                    .hasMessageContaining("invalid for loop");
        }
    }
}
