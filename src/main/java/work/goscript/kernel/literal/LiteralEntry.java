package work.goscript.kernel.literal;

import java.util.Objects;
import work.goscript.kernel.value.RuntimeValue;

/**
 * One element of a composite literal, optionally keyed.
 */
public record LiteralEntry(LiteralKey key, RuntimeValue value) {
    public LiteralEntry {
        Objects.requireNonNull(value, "value");
    }

    public static LiteralEntry positional(RuntimeValue value) {
        return new LiteralEntry(null, value);
    }

    public static LiteralEntry field(String name, RuntimeValue value) {
        return new LiteralEntry(new LiteralKey.Field(name), value);
    }

    public static LiteralEntry index(long index, RuntimeValue value) {
        return new LiteralEntry(new LiteralKey.Index(index), value);
    }

    public static LiteralEntry mapKey(RuntimeValue key, RuntimeValue value) {
        return new LiteralEntry(new LiteralKey.MapKey(key), value);
    }

    public boolean isKeyed() {
        return key != null;
    }
}
