package work.goscript.kernel.runtime;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.goscript.kernel.convert.ValueAssigner;
import work.goscript.kernel.literal.LiteralEntry;
import work.goscript.kernel.shared.KernelPanicException;
import work.goscript.kernel.shared.PanicCode;
import work.goscript.kernel.types.ArrayType;
import work.goscript.kernel.types.GosType;
import work.goscript.kernel.types.MapType;
import work.goscript.kernel.types.PointerType;
import work.goscript.kernel.types.StructType;
import work.goscript.kernel.value.RuntimeValue;

/**
 * Turns script operands (plain YAML values, or runtime values pulled from state) into runtime values.
 *
 * <p>Numbers become untyped constants, strings and booleans their basic values, {@code null} the untyped nil.
 * YAML maps and lists are composite literals of the expected type; {@code {$key: K, value: V}} inside a list is a
 * keyed element. {@code {$type: T, value: V}} gives an operand an explicit type.
 */
public final class ValueDecoder {
    public static final String TYPE_MARKER = "$type";
    public static final String KEY_MARKER = "$key";

    private ValueDecoder() {}

    public static GosType type(Object raw, ExecutionContext ctx) {
        if (raw instanceof GosType type) {
            return type;
        }
        if (raw instanceof String expression && !expression.isBlank()) {
            return ctx.types().resolve(expression);
        }
        throw new IllegalArgumentException("type expression expected, got " + raw);
    }

    /**
     * Decodes {@code raw} as an operand whose destination has type {@code target}; {@code target} may be
     * {@code null} when the destination is unknown.
     */
    public static RuntimeValue decode(Object raw, GosType target, ExecutionContext ctx) {
        if (raw instanceof RuntimeValue value) {
            return value;
        }
        if (raw == null) {
            return RuntimeValue.NilValue.INSTANCE;
        }
        if (raw instanceof Boolean flag) {
            return new RuntimeValue.BoolValue(flag);
        }
        if (raw instanceof String text) {
            return new RuntimeValue.StringValue(text);
        }
        if (raw instanceof Number number) {
            return constant(number);
        }
        if (raw instanceof Map<?, ?> map && map.containsKey(TYPE_MARKER)) {
            var explicit = type(map.get(TYPE_MARKER), ctx);
            return ValueAssigner.assign(decode(map.get("value"), explicit, ctx), explicit);
        }
        if (raw instanceof Map<?, ?> || raw instanceof List<?>) {
            return composite(raw, target, ctx);
        }
        throw new IllegalArgumentException("unsupported operand: " + raw.getClass().getSimpleName());
    }

    /**
     * Decodes the elements of a composite literal of type {@code type}.
     */
    public static List<LiteralEntry> entries(Object raw, GosType type, ExecutionContext ctx) {
        var entries = new ArrayList<LiteralEntry>();
        if (raw == null) {
            return entries;
        }
        if (raw instanceof List<?> items) {
            for (int i = 0; i < items.size(); i++) {
                var item = items.get(i);
                if (isKeyedElement(item)) {
                    var element = (Map<?, ?>) item;
                    entries.add(keyed(element.get(KEY_MARKER), element.get("value"), type, ctx));
                } else {
                    entries.add(LiteralEntry.positional(decode(item, positionalType(type, i), ctx)));
                }
            }
            return entries;
        }
        if (raw instanceof Map<?, ?> map && !(type instanceof ArrayType)) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                entries.add(keyed(entry.getKey(), entry.getValue(), type, ctx));
            }
            return entries;
        }
        throw new IllegalArgumentException("cannot use " + raw.getClass().getSimpleName()
            + " as elements of " + type.typeName() + " literal");
    }

    private static RuntimeValue composite(Object raw, GosType target, ExecutionContext ctx) {
        if (target instanceof PointerType pointer) {
            // &T{...} elided inside composite literals
            return ctx.arena().allocate(pointer.element(), composite(raw, pointer.element(), ctx));
        }
        if (target instanceof StructType || target instanceof ArrayType || target instanceof MapType) {
            return ctx.literals().build(target, entries(raw, target, ctx));
        }
        var expected = target == null ? "untyped" : target.typeName();
        throw new IllegalArgumentException("composite literal needs a struct, array or map type, got " + expected);
    }

    private static LiteralEntry keyed(Object key, Object value, GosType type, ExecutionContext ctx) {
        if (type instanceof StructType struct) {
            var name = String.valueOf(key);
            int index = struct.fieldIndex(name);
            var fieldType = index < 0 ? null : struct.fields().get(index).type();
            return LiteralEntry.field(name, decode(value, fieldType, ctx));
        }
        if (type instanceof ArrayType array) {
            return LiteralEntry.index(index(key, ctx), decode(value, array.element(), ctx));
        }
        if (type instanceof MapType map) {
            return LiteralEntry.mapKey(decode(key, map.key(), ctx), decode(value, map.value(), ctx));
        }
        throw new IllegalArgumentException("invalid composite literal type " + type.typeName());
    }

    private static GosType positionalType(GosType type, int position) {
        if (type instanceof StructType struct) {
            return position < struct.fieldCount() ? struct.fields().get(position).type() : null;
        }
        if (type instanceof ArrayType array) {
            return array.element();
        }
        if (type instanceof MapType map) {
            return map.value();
        }
        return null;
    }

    private static long index(Object key, ExecutionContext ctx) {
        var value = decode(key, null, ctx);
        BigInteger integer = null;
        if (value instanceof RuntimeValue.UntypedConst constant && !constant.floating()) {
            integer = constant.value().toBigIntegerExact();
        } else if (value instanceof RuntimeValue.IntValue n) {
            integer = n.toBigInteger();
        }
        if (integer == null) {
            throw KernelPanicException.of(PanicCode.INVALID_KEY,
                "index %s must be integer constant", key);
        }
        if (integer.bitLength() > 63) {
            throw KernelPanicException.of(PanicCode.LITERAL_TOO_LARGE,
                "array index %s exceeds the maximum literal length", integer);
        }
        return integer.longValue();
    }

    private static RuntimeValue constant(Number number) {
        if (number instanceof BigDecimal decimal) {
            return new RuntimeValue.UntypedConst(decimal, true);
        }
        if (number instanceof BigInteger integer) {
            return RuntimeValue.UntypedConst.integer(integer);
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("constant " + d + " is not representable");
            }
            return new RuntimeValue.UntypedConst(new BigDecimal(number.toString()), true);
        }
        return RuntimeValue.UntypedConst.integer(number.longValue());
    }

    private static boolean isKeyedElement(Object item) {
        return item instanceof Map<?, ?> map
            && map.size() == 2
            && map.containsKey(KEY_MARKER)
            && map.containsKey("value");
    }
}
