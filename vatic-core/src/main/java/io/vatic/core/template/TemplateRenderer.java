package io.vatic.core.template;

import io.vatic.core.context.LoopValue;
import io.vatic.core.context.MemoryEntry;
import io.vatic.core.context.RenderContext;
import io.vatic.core.template.TemplateException.Kind;
import io.vatic.core.template.pipe.PipeRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/// Evaluates a token stream against a context.
///
/// Literals are appended as is. Tags are resolved by {@link TagResolver} and, when they
/// name a pipe, passed through the {@link PipeRegistry} before being appended. For-blocks
/// are delimited by {@link BlockMatcher} and their bodies rendered recursively once per
/// item.
///
/// ### Loop scoping
/// Each for-block renders against one copy of the enclosing context, made when the block
/// starts. The loop variable is rebound on that copy before every iteration. A nested
/// loop makes its own copy, so a variable it binds (even one reusing an outer name)
/// shadows the outer binding only inside the nested block; after its `endfor` the outer
/// value is visible again.
///
/// @implNote Thread-safe. Holds no per-render state; the output buffer and loop copies
/// are local to each call.
final class TemplateRenderer {

    private static final Logger logger = Logger.getLogger(TemplateRenderer.class.getName());

    static final String MEMORIES = "memories";

    private final TagResolver resolver;
    private final PipeRegistry pipes;

    TemplateRenderer(TagResolver resolver, PipeRegistry pipes) {
        this.resolver = resolver;
        this.pipes = pipes;
    }

    /// Renders a complete token stream.
    ///
    /// @param tokens tokens produced by {@link TemplateTokenizer}, not null
    /// @param ctx the caller's context; never mutated, not null
    /// @return the rendered text, never null
    /// @throws TemplateException on the first failing token; no partial output is kept
    String render(List<Token> tokens, RenderContext ctx) throws TemplateException {
        StringBuilder out = new StringBuilder();
        renderTokens(tokens, ctx, out);
        return out.toString();
    }

    private void renderTokens(List<Token> tokens, RenderContext ctx, StringBuilder out)
            throws TemplateException {
        int i = 0;
        while (i < tokens.size()) {
            Token token = tokens.get(i);
            if (token instanceof Token.Literal literal) {
                out.append(literal.text());
                i++;
            } else if (token instanceof Token.Tag tag) {
                out.append(renderTag(tag.content(), ctx));
                i++;
            } else if (token instanceof Token.ForStart forStart) {
                BlockMatcher.Block block = BlockMatcher.match(tokens, i + 1);
                executeLoop(forStart.loop(), block.body(), ctx, out);
                i = block.endIndex() + 1;
            } else {
                throw BlockMatcher.unexpectedEndFor();
            }
        }
    }

    private String renderTag(TagContent tag, RenderContext ctx) throws TemplateException {
        String value = resolver.resolve(tag, ctx);
        return tag.hasPipe() ? pipes.apply(tag.pipe(), value) : value;
    }

    private void executeLoop(
            ForLoop loop, List<Token> body, RenderContext ctx, StringBuilder out)
            throws TemplateException {
        RenderContext loopCtx = ctx.copy();
        LoopSource source = loop.source();

        if (source instanceof LoopSource.Range range) {
            if (range.isEmpty()) {
                return;
            }
            for (long value = range.start(); ; value++) {
                loopCtx.bindLoopVar(loop.var(), new LoopValue.Index(value));
                renderTokens(body, loopCtx, out);
                if (value == range.end()) {
                    break;
                }
            }
        } else if (source instanceof LoopSource.Collection collection) {
            List<LoopValue> items = collection(collection.name(), ctx);
            int count = limit(loop).map(l -> (int) Math.min(items.size(), l)).orElse(items.size());
            for (LoopValue item : items.subList(0, count)) {
                loopCtx.bindLoopVar(loop.var(), item);
                renderTokens(body, loopCtx, out);
            }
        }
    }

    private static List<LoopValue> collection(String name, RenderContext ctx)
            throws TemplateException {
        if (!MEMORIES.equals(name)) {
            throw new TemplateException(
                    Kind.UNKNOWN_COLLECTION, "unknown collection: '" + name + "'");
        }
        List<LoopValue> items = new ArrayList<>(ctx.memories().size());
        for (MemoryEntry entry : ctx.memories()) {
            items.add(new LoopValue.Memory(entry));
        }
        return items;
    }

    /// The `limit` loop param as a non-negative number; anything else means "no limit".
    private static Optional<Long> limit(ForLoop loop) {
        Optional<String> raw = loop.param(ForLoop.LIMIT);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            long limit = Long.parseLong(raw.get());
            if (limit >= 0) {
                return Optional.of(limit);
            }
        } catch (NumberFormatException e) {
            logger.fine("Ignoring non-numeric loop limit: " + raw.get());
        }
        return Optional.empty();
    }
}
