package io.vatic.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.vatic.core.context.LoopValue;
import io.vatic.core.context.MemoryEntry;
import io.vatic.core.context.RenderContext;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all Vatic serialization configuration in one place.
///
/// **Custom serializer/deserializer pairs**:
/// - `MemoryEntry`: `MemoryEntrySerializer` / `MemoryEntryDeserializer`
/// - `LoopValue`: `LoopValueSerializer` / `LoopValueDeserializer`, discriminator: `"type"`
///
/// **Write-only**:
/// - `RenderContext`: `RenderContextSerializer`. Reading a context needs the dictionary and
///   secrets from their own files, so it goes through {@link ContextSerializer#fromJson}.
///
/// @implNote All registrations are explicit, no classpath scanning and no reflection on
/// core types.
/// @see ContextSerializer for the convenience factory API
public class VaticJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 4213395087517210386L;

    public VaticJacksonModule() {
        super("VaticJacksonModule");

        addSerializer(MemoryEntry.class, new MemoryEntrySerializer());
        addDeserializer(MemoryEntry.class, new MemoryEntryDeserializer());

        addSerializer(LoopValue.class, new LoopValueSerializer());
        addDeserializer(LoopValue.class, new LoopValueDeserializer());

        addSerializer(RenderContext.class, new RenderContextSerializer());
    }
}
