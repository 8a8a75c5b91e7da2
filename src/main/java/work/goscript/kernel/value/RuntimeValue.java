package work.goscript.kernel.value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;
import work.goscript.kernel.types.AnyType;
import work.goscript.kernel.types.BasicType;
import work.goscript.kernel.types.GosType;
import work.goscript.kernel.types.PointerType;

/**
 * Dynamically tagged runtime value. Exactly one variant is active for any instance.
 */
public sealed interface RuntimeValue
        permits RuntimeValue.IntValue,
                RuntimeValue.Float32Value,
                RuntimeValue.Float64Value,
                RuntimeValue.StringValue,
                RuntimeValue.BoolValue,
                RuntimeValue.NilValue,
                RuntimeValue.UntypedConst,
                RuntimeValue.PointerValue,
                RuntimeValue.AnyValue,
                StructValue,
                ArrayValue,
                MapValue {
    String kind();

    /**
     * Static type of the value, or {@code null} for untyped nil and untyped constants.
     */
    GosType type();

    /**
     * Copy used when the value is assigned somewhere else. Structs and arrays are copied deeply,
     * everything else is immutable or a reference.
     */
    default RuntimeValue copyValue() {
        return this;
    }

    record IntValue(BasicType basic, long bits) implements RuntimeValue {
        public IntValue {
            Objects.requireNonNull(basic, "basic");
            if (!basic.isInteger()) {
                throw new IllegalArgumentException("not an integer type: " + basic);
            }
            bits = basic.wrap(bits);
        }

        public static IntValue of(long value) {
            return new IntValue(BasicType.INT, value);
        }

        public BigInteger toBigInteger() {
            var signedValue = BigInteger.valueOf(bits);
            if (!basic.signed() && bits < 0) {
                return signedValue.add(BigInteger.ONE.shiftLeft(64));
            }
            return signedValue;
        }

        @Override
        public String kind() {
            return basic.typeName();
        }

        @Override
        public GosType type() {
            return basic;
        }
    }

    record Float32Value(float value) implements RuntimeValue {
        @Override
        public String kind() {
            return "float32";
        }

        @Override
        public GosType type() {
            return BasicType.FLOAT32;
        }
    }

    record Float64Value(double value) implements RuntimeValue {
        @Override
        public String kind() {
            return "float64";
        }

        @Override
        public GosType type() {
            return BasicType.FLOAT64;
        }
    }

    record StringValue(String value) implements RuntimeValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String kind() {
            return "string";
        }

        @Override
        public GosType type() {
            return BasicType.STRING;
        }
    }

    record BoolValue(boolean value) implements RuntimeValue {
        @Override
        public String kind() {
            return "bool";
        }

        @Override
        public GosType type() {
            return BasicType.BOOL;
        }
    }

    /**
     * The untyped {@code nil} literal.
     */
    record NilValue() implements RuntimeValue {
        public static final NilValue INSTANCE = new NilValue();

        @Override
        public String kind() {
            return "nil";
        }

        @Override
        public GosType type() {
            return null;
        }
    }

    /**
     * Numeric literal that has not been given a type yet. {@code floating} records whether it was written
     * as a floating point literal, which decides its default type.
     */
    record UntypedConst(BigDecimal value, boolean floating) implements RuntimeValue {
        public UntypedConst {
            Objects.requireNonNull(value, "value");
            if (!floating && value.signum() != 0 && value.stripTrailingZeros().scale() > 0) {
                throw new IllegalArgumentException("integer constant with fractional part: " + value);
            }
        }

        public static UntypedConst integer(long value) {
            return new UntypedConst(BigDecimal.valueOf(value), false);
        }

        public static UntypedConst integer(BigInteger value) {
            return new UntypedConst(new BigDecimal(value), false);
        }

        public static UntypedConst floating(String literal) {
            return new UntypedConst(new BigDecimal(literal), true);
        }

        public BasicType defaultType() {
            return floating ? BasicType.FLOAT64 : BasicType.INT;
        }

        @Override
        public String kind() {
            return floating ? "untyped float" : "untyped int";
        }

        @Override
        public GosType type() {
            return null;
        }
    }

    /**
     * Pointer holding a slot identity token; a {@code null} slot is the nil pointer.
     */
    record PointerValue(PointerType pointerType, SlotId slot) implements RuntimeValue {
        public PointerValue {
            Objects.requireNonNull(pointerType, "pointerType");
        }

        public static PointerValue nil(PointerType type) {
            return new PointerValue(type, null);
        }

        public boolean isNil() {
            return slot == null;
        }

        @Override
        public String kind() {
            return "pointer";
        }

        @Override
        public GosType type() {
            return pointerType;
        }
    }

    /**
     * Value stored in an {@code any} slot: the dynamic type travels with the boxed value.
     */
    record AnyValue(GosType dynamicType, RuntimeValue boxed) implements RuntimeValue {
        private static final AnyValue NIL = new AnyValue(null, NilValue.INSTANCE);

        public AnyValue {
            Objects.requireNonNull(boxed, "boxed");
            if (dynamicType == null && !(boxed instanceof NilValue)) {
                throw new IllegalArgumentException("boxed value without dynamic type: " + boxed.kind());
            }
            if (dynamicType != null && (boxed instanceof AnyValue || boxed.type() == null)) {
                throw new IllegalArgumentException("cannot box " + boxed.kind() + " as " + dynamicType.typeName());
            }
        }

        public static AnyValue nil() {
            return NIL;
        }

        public static AnyValue box(RuntimeValue value) {
            Objects.requireNonNull(value, "value");
            if (value instanceof AnyValue any) {
                return any;
            }
            if (value instanceof NilValue) {
                return NIL;
            }
            return new AnyValue(value.type(), value);
        }

        public boolean isNil() {
            return dynamicType == null;
        }

        @Override
        public String kind() {
            return "any";
        }

        @Override
        public GosType type() {
            return AnyType.ANY;
        }

        @Override
        public RuntimeValue copyValue() {
            if (isNil()) {
                return this;
            }
            var copied = boxed.copyValue();
            return copied == boxed ? this : new AnyValue(dynamicType, copied);
        }
    }
}
