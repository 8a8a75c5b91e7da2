package work.goscript.kernel.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named type declarations visible to a script. Predeclared types are resolved by {@link TypeParser} directly.
 */
public final class TypeRegistry {
    private final Map<String, GosType> named = new LinkedHashMap<>();

    /**
     * Declares {@code name} as the type denoted by {@code expression}. Struct declarations are registered
     * before their body is parsed so fields may refer to the struct through pointers.
     */
    public GosType declare(String name, String expression) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("type name must not be blank");
        }
        if (BasicType.lookup(name) != null || "any".equals(name) || named.containsKey(name)) {
            throw new IllegalArgumentException("type " + name + " redeclared");
        }
        var trimmed = expression == null ? "" : expression.trim();
        if (trimmed.startsWith("struct")) {
            var declared = StructType.declare(name);
            named.put(name, declared);
            try {
                var body = TypeParser.parse(trimmed, this);
                if (!(body instanceof StructType anonymous)) {
                    throw new IllegalArgumentException("expected struct type for " + name + ": " + expression);
                }
                declared.define(anonymous.fields());
            } catch (RuntimeException ex) {
                named.remove(name);
                throw ex;
            }
            return declared;
        }
        var resolved = TypeParser.parse(trimmed, this);
        named.put(name, resolved);
        return resolved;
    }

    public GosType lookup(String name) {
        return named.get(name);
    }

    public GosType resolve(String expression) {
        return TypeParser.parse(expression, this);
    }

    public Map<String, GosType> declared() {
        return Collections.unmodifiableMap(named);
    }
}
