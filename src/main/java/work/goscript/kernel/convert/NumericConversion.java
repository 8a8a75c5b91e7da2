package work.goscript.kernel.convert;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;
import work.goscript.kernel.shared.KernelPanicException;
import work.goscript.kernel.shared.PanicCode;
import work.goscript.kernel.types.BasicType;
import work.goscript.kernel.value.RuntimeValue;

/**
 * Numeric conversions between integer widths and floating point formats. Loss of precision is silent:
 * values are wrapped (integers) or rounded to the nearest representable value (floats).
 */
public final class NumericConversion {
    private NumericConversion() {}

    public static RuntimeValue convert(RuntimeValue value, BasicType target) {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(target, "target");
        if (value instanceof RuntimeValue.UntypedConst constant) {
            return convertConstant(constant.value(), target);
        }
        if (!target.isNumeric()) {
            throw cannotConvert(value, target);
        }
        if (value instanceof RuntimeValue.IntValue n) {
            if (target.isInteger()) {
                return new RuntimeValue.IntValue(target, n.bits());
            }
            boolean unsignedHigh = !n.basic().signed() && n.bits() < 0;
            if (target == BasicType.FLOAT32) {
                return new RuntimeValue.Float32Value(unsignedHigh ? n.toBigInteger().floatValue() : (float) n.bits());
            }
            return new RuntimeValue.Float64Value(unsignedHigh ? n.toBigInteger().doubleValue() : (double) n.bits());
        }
        double source;
        if (value instanceof RuntimeValue.Float32Value f) {
            source = f.value();
        } else if (value instanceof RuntimeValue.Float64Value f) {
            source = f.value();
        } else {
            throw cannotConvert(value, target);
        }
        if (target == BasicType.FLOAT32) {
            return new RuntimeValue.Float32Value((float) source);
        }
        if (target == BasicType.FLOAT64) {
            return new RuntimeValue.Float64Value(source);
        }
        return new RuntimeValue.IntValue(target, truncate(source));
    }

    /**
     * Gives an untyped constant the type {@code target}. Floating targets round to the nearest representable
     * value; integer targets reject constants with a fractional part or outside the target's range.
     */
    public static RuntimeValue convertConstant(BigDecimal constant, BasicType target) {
        Objects.requireNonNull(constant, "constant");
        Objects.requireNonNull(target, "target");
        if (target == BasicType.FLOAT32) {
            float rounded = constant.floatValue();
            if (Float.isInfinite(rounded)) {
                rounded = constant.signum() < 0 ? -Float.MAX_VALUE : Float.MAX_VALUE;
            }
            return new RuntimeValue.Float32Value(rounded);
        }
        if (target == BasicType.FLOAT64) {
            double rounded = constant.doubleValue();
            if (Double.isInfinite(rounded)) {
                rounded = constant.signum() < 0 ? -Double.MAX_VALUE : Double.MAX_VALUE;
            }
            return new RuntimeValue.Float64Value(rounded);
        }
        if (!target.isInteger()) {
            throw KernelPanicException.of(PanicCode.TYPE_MISMATCH,
                "cannot use constant %s as %s value", constant.toPlainString(), target.typeName());
        }
        if (constant.signum() != 0 && constant.stripTrailingZeros().scale() > 0) {
            throw KernelPanicException.of(PanicCode.CONSTANT_TRUNCATED,
                "constant %s truncated to integer", constant.toPlainString());
        }
        var integer = constant.toBigIntegerExact();
        if (integer.compareTo(minOf(target)) < 0 || integer.compareTo(maxOf(target)) > 0) {
            throw KernelPanicException.of(PanicCode.CONSTANT_OVERFLOW,
                "constant %s overflows %s", integer, target.typeName());
        }
        return new RuntimeValue.IntValue(target, integer.longValue());
    }

    private static long truncate(double source) {
        if (Double.isNaN(source)) {
            return 0L;
        }
        if (Double.isInfinite(source)) {
            return source > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
        // low 64 bits of the truncated value, wrapped afterwards by the target width
        return new BigDecimal(source).toBigInteger().longValue();
    }

    private static BigInteger minOf(BasicType type) {
        return type.signed() ? BigInteger.ONE.shiftLeft(type.width() - 1).negate() : BigInteger.ZERO;
    }

    private static BigInteger maxOf(BasicType type) {
        return type.signed()
            ? BigInteger.ONE.shiftLeft(type.width() - 1).subtract(BigInteger.ONE)
            : BigInteger.ONE.shiftLeft(type.width()).subtract(BigInteger.ONE);
    }

    private static KernelPanicException cannotConvert(RuntimeValue value, BasicType target) {
        var source = value.type() == null ? value.kind() : value.type().typeName();
        return KernelPanicException.of(PanicCode.TYPE_MISMATCH, "cannot convert %s to type %s", source, target.typeName());
    }
}
