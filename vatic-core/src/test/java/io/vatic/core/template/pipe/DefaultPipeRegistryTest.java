package io.vatic.core.template.pipe;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.vatic.core.template.TemplateException;
import io.vatic.core.template.TemplateException.Kind;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DefaultPipeRegistryTest {

    private DefaultPipeRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DefaultPipeRegistry();
    }

    @Nested
    class BuiltIns {

        @Test
        void shouldRegisterSummaryByDefault() {
            assertThat(registry.contains("summary")).isTrue();
            assertThat(registry.names()).containsExactly("summary");
        }

        @Test
        void shouldPrefixSummary() throws Exception {
            assertThat(registry.apply("summary", "the weather"))
                    .isEqualTo("Summary of: the weather");
        }

        @Test
        void shouldSummarizeEmptyInput() throws Exception {
            assertThat(registry.apply("summary", "")).isEqualTo("Summary of: ");
        }
    }

    @Nested
    class Registration {

        @Mock private Pipe pipe;

        @Test
        void shouldRegisterPipe() {
            registry.register("upper", pipe);

            assertThat(registry.contains("upper")).isTrue();
            assertThat(registry.get("upper")).hasValue(pipe);
            assertThat(registry.names()).containsExactlyInAnyOrder("summary", "upper");
        }

        @Test
        void shouldReplaceExistingPipe() throws Exception {
            registry.register("summary", input -> "short");

            assertThat(registry.apply("summary", "long text")).isEqualTo("short");
            assertThat(registry.names()).hasSize(1);
        }

        @Test
        void shouldDelegateToRegisteredPipe() throws Exception {
            when(pipe.apply("abc")).thenReturn("ABC");
            registry.register("upper", pipe);

            assertThat(registry.apply("upper", "abc")).isEqualTo("ABC");
            verify(pipe).apply("abc");
        }

        @Test
        void shouldPropagatePipeFailure() throws Exception {
            TemplateException failure = new TemplateException(Kind.UNKNOWN_PIPE, "boom");
            when(pipe.apply("abc")).thenThrow(failure);
            registry.register("upper", pipe);

            assertThatThrownBy(() -> registry.apply("upper", "abc")).isSameAs(failure);
        }

        @Test
        void shouldThrowWhenNameIsBlank() {
            assertThatThrownBy(() -> registry.register(" ", pipe))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("null or blank");
        }

        @Test
        void shouldThrowWhenNameIsNull() {
            assertThatThrownBy(() -> registry.register(null, pipe))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldThrowWhenPipeIsNull() {
            assertThatThrownBy(() -> registry.register("upper", null))
                    .isInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    class Lookup {

        @Test
        void shouldReturnEmptyWhenPipeNotFound() {
            assertThat(registry.get("nonexistent")).isEmpty();
            assertThat(registry.contains("nonexistent")).isFalse();
        }

        @Test
        void shouldFailApplyingUnknownPipe() {
            assertThatThrownBy(() -> registry.apply("translate", "hola"))
                    .isInstanceOf(TemplateException.class)
                    .hasMessage("unknown pipe: 'translate'")
                    .extracting(e -> ((TemplateException) e).kind())
                    .isEqualTo(Kind.UNKNOWN_PIPE);
        }

        @Test
        void shouldMatchNamesCaseSensitively() {
            assertThat(registry.contains("Summary")).isFalse();
        }

        @Test
        void shouldReturnSnapshotOfNames() {
            Set<String> names = registry.names();
            registry.register("later", input -> input);

            assertThat(names).containsExactly("summary");
        }
    }
}
