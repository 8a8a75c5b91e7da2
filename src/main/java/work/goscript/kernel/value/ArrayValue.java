package work.goscript.kernel.value;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import work.goscript.kernel.shared.KernelPanicException;
import work.goscript.kernel.shared.PanicCode;
import work.goscript.kernel.types.ArrayType;
import work.goscript.kernel.types.GosType;

/**
 * Array instance with a length fixed at construction.
 */
public final class ArrayValue implements RuntimeValue {
    private final ArrayType arrayType;
    private final RuntimeValue[] items;

    public ArrayValue(ArrayType arrayType, RuntimeValue[] items) {
        this.arrayType = Objects.requireNonNull(arrayType, "arrayType");
        Objects.requireNonNull(items, "items");
        if (!arrayType.isInferred() && items.length != arrayType.length()) {
            throw new IllegalArgumentException(
                "array " + arrayType.typeName() + " needs " + arrayType.length() + " elements, got " + items.length);
        }
        for (RuntimeValue item : items) {
            Objects.requireNonNull(item, "item");
        }
        this.items = items.clone();
    }

    public ArrayType arrayType() {
        return arrayType;
    }

    public int length() {
        return items.length;
    }

    public RuntimeValue get(long index) {
        return items[checkIndex(index)];
    }

    /**
     * Stores an already assigned value; callers convert operands to the element type first.
     */
    public void set(long index, RuntimeValue value) {
        items[checkIndex(index)] = Objects.requireNonNull(value, "value");
    }

    public List<RuntimeValue> items() {
        return Collections.unmodifiableList(Arrays.asList(items));
    }

    @Override
    public String kind() {
        return "array";
    }

    @Override
    public GosType type() {
        return arrayType;
    }

    @Override
    public ArrayValue copyValue() {
        var copy = new RuntimeValue[items.length];
        for (int i = 0; i < items.length; i++) {
            copy[i] = items[i].copyValue();
        }
        return new ArrayValue(arrayType, copy);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof ArrayValue that
            && arrayType.equals(that.arrayType)
            && Arrays.equals(items, that.items);
    }

    @Override
    public int hashCode() {
        return 31 * arrayType.hashCode() + Arrays.hashCode(items);
    }

    @Override
    public String toString() {
        return ValueFormatter.format(this);
    }

    private int checkIndex(long index) {
        if (index < 0 || index >= items.length) {
            throw KernelPanicException.of(
                PanicCode.INDEX_OUT_OF_RANGE, "index out of range [%d] with length %d", index, items.length);
        }
        return (int) index;
    }
}
