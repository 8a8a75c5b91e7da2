package work.goscript.kernel.runtime;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.goscript.kernel.heap.SlotArena;
import work.goscript.kernel.literal.LiteralConstructor;
import work.goscript.kernel.types.TypeRegistry;

/**
 * Execution context passed to kernel functions. Owns the per-run type declarations and pointer slots.
 */
public final class ExecutionContext {
    private static final Logger LOG = LoggerFactory.getLogger(ExecutionContext.class);

    private final Registry registry;
    private final KernelConfig config;
    private final TypeRegistry types = new TypeRegistry();
    private final SlotArena arena = new SlotArena();
    private final LiteralConstructor literals;

    public ExecutionContext(Registry registry) {
        this(registry, KernelConfig.defaults());
    }

    public ExecutionContext(Registry registry, KernelConfig config) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.config = Objects.requireNonNull(config, "config");
        this.literals = new LiteralConstructor(config.maxLiteralLength());
    }

    public Registry registry() {
        return registry;
    }

    public KernelConfig config() {
        return config;
    }

    public TypeRegistry types() {
        return types;
    }

    public SlotArena arena() {
        return arena;
    }

    public LiteralConstructor literals() {
        return literals;
    }

    public Object call(String id, Map<String, Object> input) throws Exception {
        var entry = registry.get(id);
        if (entry == null) {
            throw new IllegalStateException("Function not registered: " + id);
        }
        LOG.debug("call {}", id);
        var sanitized = input == null ? new LinkedHashMap<String, Object>() : new LinkedHashMap<>(input);
        return entry.function().invoke(this, sanitized);
    }
}
