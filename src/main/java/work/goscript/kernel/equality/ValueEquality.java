package work.goscript.kernel.equality;

import java.util.Objects;
import work.goscript.kernel.shared.KernelPanicException;
import work.goscript.kernel.shared.PanicCode;
import work.goscript.kernel.types.GosType;
import work.goscript.kernel.types.MapType;
import work.goscript.kernel.types.PointerType;
import work.goscript.kernel.types.AnyType;
import work.goscript.kernel.value.ArrayValue;
import work.goscript.kernel.value.MapValue;
import work.goscript.kernel.value.RuntimeValue;
import work.goscript.kernel.value.StructValue;

/**
 * Equality and hashing over runtime values, dispatched per value kind. Pointers compare by slot identity,
 * structs field by field, {@code any} values by dynamic type and then boxed value.
 */
public final class ValueEquality {
    private ValueEquality() {}

    public static boolean equal(RuntimeValue a, RuntimeValue b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        if (a instanceof RuntimeValue.NilValue) {
            return isNil(b);
        }
        if (b instanceof RuntimeValue.NilValue) {
            return isNil(a);
        }
        if (isBoxable(a, b)) {
            return equal(RuntimeValue.AnyValue.box(a), b);
        }
        if (isBoxable(b, a)) {
            return equal(a, RuntimeValue.AnyValue.box(b));
        }
        if (a instanceof RuntimeValue.IntValue x) {
            return b instanceof RuntimeValue.IntValue y && x.basic() == y.basic() && x.bits() == y.bits();
        }
        if (a instanceof RuntimeValue.Float32Value x) {
            return b instanceof RuntimeValue.Float32Value y && x.value() == y.value();
        }
        if (a instanceof RuntimeValue.Float64Value x) {
            return b instanceof RuntimeValue.Float64Value y && x.value() == y.value();
        }
        if (a instanceof RuntimeValue.StringValue x) {
            return b instanceof RuntimeValue.StringValue y && x.value().equals(y.value());
        }
        if (a instanceof RuntimeValue.BoolValue x) {
            return b instanceof RuntimeValue.BoolValue y && x.value() == y.value();
        }
        if (a instanceof RuntimeValue.UntypedConst x) {
            return b instanceof RuntimeValue.UntypedConst y && x.value().compareTo(y.value()) == 0;
        }
        if (a instanceof RuntimeValue.PointerValue x) {
            return b instanceof RuntimeValue.PointerValue y && Objects.equals(x.slot(), y.slot());
        }
        if (a instanceof RuntimeValue.AnyValue x) {
            if (!(b instanceof RuntimeValue.AnyValue y) || !Objects.equals(x.dynamicType(), y.dynamicType())) {
                return false;
            }
            return x.isNil() || equal(x.boxed(), y.boxed());
        }
        if (a instanceof StructValue x) {
            if (!(b instanceof StructValue y) || !x.structType().equals(y.structType())) {
                return false;
            }
            for (int i = 0; i < x.size(); i++) {
                if (!equal(x.get(i), y.get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (a instanceof ArrayValue x) {
            if (!(b instanceof ArrayValue y)
                || x.length() != y.length()
                || !x.arrayType().element().equals(y.arrayType().element())) {
                return false;
            }
            for (int i = 0; i < x.length(); i++) {
                if (!equal(x.get(i), y.get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (a instanceof MapValue) {
            if (b instanceof MapValue) {
                throw new KernelPanicException(PanicCode.INCOMPARABLE, "invalid operation: map can only be compared to nil");
            }
            return false;
        }
        throw new IllegalStateException("unknown runtime value: " + a);
    }

    /**
     * Hash consistent with {@link #equal}. Maps and arrays are not valid key kinds.
     */
    public static int hash(RuntimeValue value) {
        Objects.requireNonNull(value, "value");
        if (value instanceof RuntimeValue.NilValue) {
            return 0;
        }
        if (value instanceof RuntimeValue.IntValue n) {
            return 31 * n.basic().ordinal() + Long.hashCode(n.bits());
        }
        if (value instanceof RuntimeValue.Float32Value f) {
            // +0 and -0 are equal keys
            return f.value() == 0f ? 0 : Float.hashCode(f.value());
        }
        if (value instanceof RuntimeValue.Float64Value f) {
            return f.value() == 0d ? 0 : Double.hashCode(f.value());
        }
        if (value instanceof RuntimeValue.StringValue s) {
            return s.value().hashCode();
        }
        if (value instanceof RuntimeValue.BoolValue b) {
            return Boolean.hashCode(b.value());
        }
        if (value instanceof RuntimeValue.UntypedConst c) {
            return c.value().stripTrailingZeros().hashCode();
        }
        if (value instanceof RuntimeValue.PointerValue p) {
            return p.isNil() ? 0 : 31 * Long.hashCode(p.slot().arena()) + Long.hashCode(p.slot().id() * 0x9E3779B97F4A7C15L);
        }
        if (value instanceof RuntimeValue.AnyValue any) {
            return any.isNil() ? 0 : 31 * any.dynamicType().typeName().hashCode() + hash(any.boxed());
        }
        if (value instanceof StructValue struct) {
            int result = struct.structType().typeName().hashCode();
            for (int i = 0; i < struct.size(); i++) {
                result = 31 * result + hash(struct.get(i));
            }
            return result;
        }
        if (value instanceof ArrayValue || value instanceof MapValue) {
            throw unhashable(value);
        }
        throw new IllegalStateException("unknown runtime value: " + value);
    }

    /**
     * Rejects values that cannot serve as map keys, including structs and {@code any} values wrapping them.
     */
    public static void requireHashable(RuntimeValue value) {
        hash(value);
    }

    /**
     * Validates the operands of {@code ==} and {@code !=}: both sides must have the same type, except that
     * untyped nil may be compared with pointers, maps and {@code any} values, and an {@code any} value with a
     * value of any comparable type.
     */
    public static void checkComparable(RuntimeValue a, RuntimeValue b) {
        if (a instanceof RuntimeValue.NilValue || b instanceof RuntimeValue.NilValue) {
            var other = a instanceof RuntimeValue.NilValue ? b : a;
            if (other instanceof RuntimeValue.NilValue || isNilable(other.type())) {
                return;
            }
            throw KernelPanicException.of(PanicCode.TYPE_MISMATCH,
                "invalid operation: mismatched types %s and untyped nil", describe(other));
        }
        if (isBoxable(a, b) || isBoxable(b, a)) {
            var concrete = a instanceof RuntimeValue.AnyValue ? b : a;
            if (concrete instanceof MapValue) {
                throw new KernelPanicException(PanicCode.INCOMPARABLE, "invalid operation: map can only be compared to nil");
            }
            return;
        }
        if (!Objects.equals(a.type(), b.type())
            && !(a instanceof RuntimeValue.UntypedConst && b instanceof RuntimeValue.UntypedConst)) {
            throw KernelPanicException.of(PanicCode.TYPE_MISMATCH,
                "invalid operation: mismatched types %s and %s", describe(a), describe(b));
        }
        if (a instanceof MapValue) {
            throw new KernelPanicException(PanicCode.INCOMPARABLE, "invalid operation: map can only be compared to nil");
        }
    }

    /**
     * {@code value} is a concrete typed operand compared against an {@code any} operand.
     */
    private static boolean isBoxable(RuntimeValue value, RuntimeValue other) {
        return other instanceof RuntimeValue.AnyValue
            && !(value instanceof RuntimeValue.AnyValue)
            && !(value instanceof RuntimeValue.UntypedConst)
            && !(value instanceof RuntimeValue.NilValue);
    }

    private static boolean isNil(RuntimeValue value) {
        if (value instanceof RuntimeValue.NilValue) {
            return true;
        }
        if (value instanceof RuntimeValue.PointerValue p) {
            return p.isNil();
        }
        if (value instanceof RuntimeValue.AnyValue any) {
            return any.isNil();
        }
        if (value instanceof MapValue map) {
            return map.isNil();
        }
        return false;
    }

    private static boolean isNilable(GosType type) {
        return type instanceof PointerType || type instanceof MapType || type == AnyType.ANY;
    }

    private static String describe(RuntimeValue value) {
        return value.type() == null ? value.kind() : value.type().typeName();
    }

    private static KernelPanicException unhashable(RuntimeValue value) {
        return KernelPanicException.of(PanicCode.UNHASHABLE_KEY,
            "unhashable key kind: %s", value.type().typeName());
    }
}
