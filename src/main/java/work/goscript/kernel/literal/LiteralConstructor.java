package work.goscript.kernel.literal;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.goscript.kernel.convert.ValueAssigner;
import work.goscript.kernel.shared.KernelPanicException;
import work.goscript.kernel.shared.PanicCode;
import work.goscript.kernel.types.ArrayType;
import work.goscript.kernel.types.MapType;
import work.goscript.kernel.types.StructType;
import work.goscript.kernel.value.ArrayValue;
import work.goscript.kernel.value.MapValue;
import work.goscript.kernel.value.RuntimeValue;
import work.goscript.kernel.value.StructValue;

/**
 * Builds struct, array and map values from composite literal entries. All violations are reported
 * while the literal is being built.
 */
public final class LiteralConstructor {
    public static final long DEFAULT_MAX_LENGTH = 1L << 20;

    private static final Logger LOG = LoggerFactory.getLogger(LiteralConstructor.class);

    private final long maxLength;

    public LiteralConstructor() {
        this(DEFAULT_MAX_LENGTH);
    }

    /**
     * @param maxLength upper bound on the length of array literals, guarding against huge sparse indices
     */
    public LiteralConstructor(long maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive: " + maxLength);
        }
        this.maxLength = maxLength;
    }

    public long maxLength() {
        return maxLength;
    }

    /**
     * Builds a struct from a literal that is either fully keyed by field name or fully positional.
     */
    public StructValue buildStruct(StructType type, List<LiteralEntry> entries) {
        Objects.requireNonNull(type, "type");
        var items = entries == null ? List.<LiteralEntry>of() : entries;
        var result = StructValue.zero(type);
        if (items.isEmpty()) {
            return result;
        }
        boolean keyed = items.get(0).isKeyed();
        for (LiteralEntry entry : items) {
            if (entry.isKeyed() != keyed) {
                throw new KernelPanicException(PanicCode.MIXED_LITERAL,
                    "mixture of field:value and value elements in struct literal");
            }
        }
        if (keyed) {
            var seen = new HashSet<String>();
            for (LiteralEntry entry : items) {
                if (!(entry.key() instanceof LiteralKey.Field field)) {
                    throw KernelPanicException.of(PanicCode.INVALID_KEY,
                        "invalid %s in struct literal of type %s", entry.key().describe(), type.typeName());
                }
                int index = type.fieldIndex(field.name());
                if (index < 0) {
                    throw KernelPanicException.of(PanicCode.UNKNOWN_FIELD,
                        "unknown field %s in struct literal of type %s", field.name(), type.typeName());
                }
                if (!seen.add(field.name())) {
                    throw KernelPanicException.of(PanicCode.DUPLICATE_FIELD,
                        "duplicate field name %s in struct literal", field.name());
                }
                result.set(index, ValueAssigner.assign(entry.value(), type.fields().get(index).type()));
            }
        } else {
            int count = type.fieldCount();
            if (items.size() > count) {
                throw KernelPanicException.of(PanicCode.TOO_MANY_VALUES,
                    "too many values in struct literal of type %s", type.typeName());
            }
            if (items.size() < count) {
                throw KernelPanicException.of(PanicCode.TOO_FEW_VALUES,
                    "too few values in struct literal of type %s", type.typeName());
            }
            for (int i = 0; i < items.size(); i++) {
                result.set(i, ValueAssigner.assign(items.get(i).value(), type.fields().get(i).type()));
            }
        }
        LOG.trace("built {} from {} entries", type.typeName(), items.size());
        return result;
    }

    public ArrayValue buildArray(ArrayType type, List<LiteralEntry> entries) {
        Objects.requireNonNull(type, "type");
        var assembler = new SparseArrayAssembler(type, maxLength);
        if (entries != null) {
            for (LiteralEntry entry : entries) {
                assembler.place(entry);
            }
        }
        var result = assembler.build();
        LOG.trace("built {} of length {}", type.typeName(), result.length());
        return result;
    }

    /**
     * Builds an initialized map; an empty literal yields an empty map that is not nil.
     */
    public MapValue buildMap(MapType type, List<LiteralEntry> entries) {
        Objects.requireNonNull(type, "type");
        var items = entries == null ? List.<LiteralEntry>of() : entries;
        var result = MapValue.make(type, items.size());
        for (LiteralEntry entry : items) {
            if (!(entry.key() instanceof LiteralKey.MapKey mapKey)) {
                var what = entry.key() == null ? "missing key" : "invalid " + entry.key().describe();
                throw KernelPanicException.of(PanicCode.INVALID_KEY, "%s in map literal of type %s", what, type.typeName());
            }
            result.set(mapKey.key(), entry.value());
        }
        return result;
    }

    /**
     * Dispatches on the literal's type. Only struct, array and map types have composite literals.
     */
    public RuntimeValue build(work.goscript.kernel.types.GosType type, List<LiteralEntry> entries) {
        if (type instanceof StructType struct) {
            return buildStruct(struct, entries);
        }
        if (type instanceof ArrayType array) {
            return buildArray(array, entries);
        }
        if (type instanceof MapType map) {
            return buildMap(map, entries);
        }
        throw new IllegalArgumentException("invalid composite literal type " + type.typeName());
    }
}
