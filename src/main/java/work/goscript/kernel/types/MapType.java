package work.goscript.kernel.types;

import java.util.Objects;
import work.goscript.kernel.value.MapValue;
import work.goscript.kernel.value.RuntimeValue;

public record MapType(GosType key, GosType value) implements GosType {
    public MapType {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String typeName() {
        return "map[" + key.typeName() + "]" + value.typeName();
    }

    /**
     * The zero value of a map type is the uninitialized (nil) map.
     */
    @Override
    public RuntimeValue zeroValue() {
        return MapValue.nil(this);
    }

    @Override
    public String toString() {
        return typeName();
    }
}
