package work.goscript.kernel.runtime;

import work.goscript.kernel.core.HeapPrimitives;
import work.goscript.kernel.core.LiteralPrimitives;
import work.goscript.kernel.core.MapPrimitives;
import work.goscript.kernel.core.ValuePrimitives;

/**
 * Shared registry bootstrap so the CLI, the embedding API and tests use the same function set.
 */
public final class KernelRegistry {
    private KernelRegistry() {}

    public static Registry create() {
        var registry = new Registry();
        LiteralPrimitives.register(registry);
        MapPrimitives.register(registry);
        ValuePrimitives.register(registry);
        HeapPrimitives.register(registry);
        return registry;
    }
}
