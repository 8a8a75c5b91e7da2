package work.goscript.kernel.types;

import java.util.Objects;
import work.goscript.kernel.value.ArrayValue;
import work.goscript.kernel.value.RuntimeValue;

/**
 * Fixed-length array type, or an unsized literal type whose length is taken from the literal: {@code []T}
 * keeps its unsized type, {@code [...]T} becomes the fixed array type {@code [n]T}.
 */
public record ArrayType(GosType element, int length) implements GosType {
    public static final int INFERRED = -1;
    public static final int ELLIPSIS = -2;

    public ArrayType {
        Objects.requireNonNull(element, "element");
        if (length < ELLIPSIS) {
            throw new IllegalArgumentException("invalid array length: " + length);
        }
    }

    public static ArrayType fixed(GosType element, int length) {
        return new ArrayType(element, length);
    }

    public static ArrayType inferred(GosType element) {
        return new ArrayType(element, INFERRED);
    }

    public static ArrayType ellipsis(GosType element) {
        return new ArrayType(element, ELLIPSIS);
    }

    public boolean isInferred() {
        return length < 0;
    }

    public boolean isEllipsis() {
        return length == ELLIPSIS;
    }

    /**
     * Type of a literal of this type holding {@code count} elements.
     */
    public ArrayType withLiteralLength(int count) {
        return isEllipsis() ? fixed(element, count) : this;
    }

    @Override
    public String typeName() {
        String prefix;
        if (length == INFERRED) {
            prefix = "[]";
        } else if (isEllipsis()) {
            prefix = "[...]";
        } else {
            prefix = "[" + length + "]";
        }
        return prefix + element.typeName();
    }

    @Override
    public RuntimeValue zeroValue() {
        int size = isInferred() ? 0 : length;
        var items = new RuntimeValue[size];
        for (int i = 0; i < size; i++) {
            items[i] = element.zeroValue();
        }
        return new ArrayValue(this, items);
    }

    @Override
    public String toString() {
        return typeName();
    }
}
