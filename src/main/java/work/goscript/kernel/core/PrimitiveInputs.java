package work.goscript.kernel.core;

import java.util.Locale;
import java.util.Map;
import work.goscript.kernel.runtime.ExecutionContext;
import work.goscript.kernel.runtime.ValueDecoder;
import work.goscript.kernel.types.GosType;
import work.goscript.kernel.value.MapValue;
import work.goscript.kernel.value.RuntimeValue;

/**
 * Input accessors shared by the kernel functions in this package.
 */
final class PrimitiveInputs {
    private PrimitiveInputs() {}

    static Object require(Map<String, Object> input, String key) {
        if (!input.containsKey(key)) {
            throw new IllegalArgumentException("missing input '" + key + "'");
        }
        return input.get(key);
    }

    static GosType type(ExecutionContext ctx, Map<String, Object> input) {
        return ValueDecoder.type(require(input, "type"), ctx);
    }

    @SuppressWarnings("unchecked")
    static <T extends GosType> T type(ExecutionContext ctx, Map<String, Object> input, Class<T> kind) {
        var type = type(ctx, input);
        if (!kind.isInstance(type)) {
            throw new IllegalArgumentException(type.typeName() + " is not a " + describe(kind) + " type");
        }
        return (T) type;
    }

    static RuntimeValue value(ExecutionContext ctx, Map<String, Object> input, String key, GosType target) {
        return ValueDecoder.decode(require(input, key), target, ctx);
    }

    static MapValue map(Map<String, Object> input) {
        var raw = require(input, "map");
        if (raw instanceof MapValue map) {
            return map;
        }
        throw new IllegalArgumentException("input 'map' must be a map value, got " + describeValue(raw));
    }

    static <T extends RuntimeValue> T runtime(Map<String, Object> input, String key, Class<T> kind) {
        var raw = require(input, key);
        if (kind.isInstance(raw)) {
            return kind.cast(raw);
        }
        throw new IllegalArgumentException("input '" + key + "' must be a " + describe(kind) + ", got " + describeValue(raw));
    }

    static Map<String, Object> result(RuntimeValue value) {
        return Map.of("value", value);
    }

    private static String describe(Class<?> kind) {
        return kind.getSimpleName()
            .replace("Type", "")
            .replace("Value", "")
            .toLowerCase(Locale.ROOT);
    }

    private static String describeValue(Object raw) {
        if (raw instanceof RuntimeValue value) {
            return value.kind();
        }
        return raw == null ? "null" : raw.getClass().getSimpleName();
    }
}
