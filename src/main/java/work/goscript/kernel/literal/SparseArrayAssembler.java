package work.goscript.kernel.literal;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import work.goscript.kernel.convert.ValueAssigner;
import work.goscript.kernel.shared.KernelPanicException;
import work.goscript.kernel.shared.PanicCode;
import work.goscript.kernel.types.ArrayType;
import work.goscript.kernel.value.ArrayValue;
import work.goscript.kernel.value.RuntimeValue;

/**
 * Places array literal elements with a running cursor. An explicit index moves the cursor before the element
 * is placed; the cursor then advances by one. Positions never written hold the element zero value.
 */
public final class SparseArrayAssembler {
    private static final long ARRAY_LIMIT = Integer.MAX_VALUE - 8;

    private final ArrayType type;
    private final long maxLength;
    private final Map<Long, RuntimeValue> placed = new HashMap<>();
    private long cursor;
    private long highest = -1;

    public SparseArrayAssembler(ArrayType type, long maxLength) {
        this.type = Objects.requireNonNull(type, "type");
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive: " + maxLength);
        }
        this.maxLength = Math.min(maxLength, ARRAY_LIMIT);
        if (!type.isInferred() && type.length() > this.maxLength) {
            throw KernelPanicException.of(PanicCode.LITERAL_TOO_LARGE,
                "array literal length %d exceeds limit %d", type.length(), this.maxLength);
        }
    }

    public SparseArrayAssembler place(LiteralEntry entry) {
        Objects.requireNonNull(entry, "entry");
        if (entry.key() instanceof LiteralKey.Index index) {
            if (index.index() < 0) {
                throw KernelPanicException.of(PanicCode.NEGATIVE_INDEX,
                    "index %d must be non-negative integer constant", index.index());
            }
            cursor = index.index();
        } else if (entry.key() != null) {
            throw KernelPanicException.of(PanicCode.INVALID_KEY,
                "invalid %s in array literal of type %s", entry.key().describe(), type.typeName());
        }
        long position = cursor;
        if (!type.isInferred() && position >= type.length()) {
            throw KernelPanicException.of(PanicCode.INDEX_OUT_OF_RANGE,
                "array index %d out of range [0:%d]", position, type.length());
        }
        if (position >= maxLength) {
            throw KernelPanicException.of(PanicCode.LITERAL_TOO_LARGE,
                "array literal index %d exceeds limit %d", position, maxLength);
        }
        if (placed.containsKey(position)) {
            throw KernelPanicException.of(PanicCode.DUPLICATE_INDEX, "duplicate index %d in array literal", position);
        }
        placed.put(position, ValueAssigner.assign(entry.value(), type.element()));
        highest = Math.max(highest, position);
        cursor = position + 1;
        return this;
    }

    public long cursor() {
        return cursor;
    }

    /**
     * Declared length for fixed arrays, otherwise one past the highest written position.
     */
    public int length() {
        return type.isInferred() ? (int) (highest + 1) : type.length();
    }

    public ArrayValue build() {
        var items = new RuntimeValue[length()];
        for (int i = 0; i < items.length; i++) {
            var value = placed.get((long) i);
            items[i] = value != null ? value : type.element().zeroValue();
        }
        return new ArrayValue(type.withLiteralLength(items.length), items);
    }
}
