package io.vatic.core.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RenderContextTest {

    @Nested
    class Building {

        @Test
        void shouldDefaultToEmptyCollaborators() {
            RenderContext ctx = RenderContext.builder().build();

            assertThat(ctx.dictionary().isEmpty()).isTrue();
            assertThat(ctx.secrets().size()).isZero();
            assertThat(ctx.result()).isEmpty();
            assertThat(ctx.message()).isEmpty();
            assertThat(ctx.sender()).isEmpty();
            assertThat(ctx.memories()).isEmpty();
            assertThat(ctx.loopVars()).isEmpty();
        }

        @Test
        void shouldCreateFromDictionary() {
            Dictionary dictionary = Dictionary.builder().put("general", "k", "v").build();

            assertThat(RenderContext.of(dictionary).dictionary()).isSameAs(dictionary);
        }

        @Test
        void shouldCopyMemoriesDefensively() {
            List<MemoryEntry> memories = new ArrayList<>();
            memories.add(new MemoryEntry("2025-01-01", "2025-01-01 08:00", "a"));
            RenderContext ctx = RenderContext.builder().memories(memories).build();

            memories.clear();

            assertThat(ctx.memories()).hasSize(1);
        }

        @Test
        void shouldAcceptInitialLoopBindings() {
            RenderContext ctx =
                    RenderContext.builder().loopVar("i", new LoopValue.Index(2)).build();

            assertThat(ctx.loopVar("i")).hasValue(new LoopValue.Index(2));
        }

        @Test
        void shouldRejectNullCollaborators() {
            assertThatThrownBy(() -> RenderContext.builder().dictionary(null))
                    .isInstanceOf(NullPointerException.class);
            assertThatThrownBy(() -> RenderContext.builder().secrets(null))
                    .isInstanceOf(NullPointerException.class);
            assertThatThrownBy(() -> RenderContext.builder().memories(null))
                    .isInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    class LoopScope {

        @Test
        void shouldIsolateBindingsOfCopy() {
            RenderContext original = RenderContext.builder().build();
            RenderContext copy = original.copy();

            copy.bindLoopVar("i", new LoopValue.Index(1));

            assertThat(copy.loopVar("i")).isPresent();
            assertThat(original.loopVar("i")).isEmpty();
        }

        @Test
        void shouldShareCallerDataWithCopy() {
            RenderContext original =
                    RenderContext.builder()
                            .result("r")
                            .memories(List.of(MemoryEntry.fromTimestamp("2025-01-01", "x")))
                            .build();

            RenderContext copy = original.copy();

            assertThat(copy.result()).hasValue("r");
            assertThat(copy.memories()).isSameAs(original.memories());
        }

        @Test
        void shouldReplaceBindingOnRebind() {
            RenderContext ctx = RenderContext.builder().build();

            ctx.bindLoopVar("i", new LoopValue.Index(1));
            ctx.bindLoopVar("i", new LoopValue.Index(2));

            assertThat(ctx.loopVars()).containsOnly(Map.entry("i", new LoopValue.Index(2)));
        }

        @Test
        void shouldLeaveSourceUntouchedWithLoopVar() {
            RenderContext ctx = RenderContext.builder().build();

            RenderContext bound = ctx.withLoopVar("m", new LoopValue.Index(5));

            assertThat(bound.loopVar("m")).isPresent();
            assertThat(ctx.loopVars()).isEmpty();
        }

        @Test
        void shouldExposeReadOnlyBindings() {
            RenderContext ctx = RenderContext.builder().build();

            assertThatThrownBy(() -> ctx.loopVars().put("i", new LoopValue.Index(1)))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    class Values {

        @Test
        void shouldRenderIndexAsDecimal() {
            assertThat(new LoopValue.Index(-42).asText()).isEqualTo("-42");
        }

        @Test
        void shouldRenderMemoryAsResult() {
            MemoryEntry entry = MemoryEntry.fromTimestamp("2025-01-01 08:00:00", "done");

            assertThat(new LoopValue.Memory(entry).asText()).isEqualTo("done");
        }

        @Test
        void shouldDeriveDateFromTimestamp() {
            MemoryEntry entry = MemoryEntry.fromTimestamp("2025-01-01 08:00:00", "done");

            assertThat(entry.date()).isEqualTo("2025-01-01");
            assertThat(entry.datetime()).isEqualTo("2025-01-01 08:00:00");
        }

        @Test
        void shouldKeepShortTimestampAsDate() {
            assertThat(MemoryEntry.fromTimestamp("2025", "x").date()).isEqualTo("2025");
        }

        @Test
        void shouldNotExposeSecretsInToString() {
            RenderContext ctx =
                    RenderContext.builder()
                            .secrets(Secrets.of(Map.of("gh", new Secret("s3cr3t", "bearer", "u"))))
                            .build();

            assertThat(ctx.toString()).doesNotContain("s3cr3t").contains("1 entries");
        }
    }
}
