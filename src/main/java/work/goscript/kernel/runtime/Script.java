package work.goscript.kernel.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A loaded behavioural script: named type declarations, the steps to run and the expected outcome.
 */
public record Script(String source, Map<String, String> types, List<Map<String, Object>> steps, Map<String, Object> expect) {
    public static final String PANIC_KEY = "panic";

    public Script {
        Objects.requireNonNull(source, "source");
        types = Collections.unmodifiableMap(new LinkedHashMap<>(types == null ? Map.of() : types));
        steps = steps == null ? List.of() : List.copyOf(steps);
        expect = Collections.unmodifiableMap(new LinkedHashMap<>(expect == null ? Map.of() : expect));
    }

    public boolean expectsPanic() {
        return expect.containsKey(PANIC_KEY);
    }

    public String expectedPanic() {
        var raw = expect.get(PANIC_KEY);
        return raw == null ? null : raw.toString();
    }
}
