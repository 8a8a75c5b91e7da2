package work.goscript.kernel.runtime;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stores kernel functions by id.
 */
public final class Registry {
    private final Map<String, Entry> functions = new ConcurrentHashMap<>();

    public Registry register(String id, KernelFunction fn) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(fn, "fn");
        functions.put(id, new Entry(id, fn));
        return this;
    }

    public Entry get(String id) {
        return id == null ? null : functions.get(id);
    }

    public void unregister(String id) {
        if (id != null) {
            functions.remove(id);
        }
    }

    public Map<String, Entry> entries() {
        return Collections.unmodifiableMap(functions);
    }

    public record Entry(String id, KernelFunction function) {}
}
