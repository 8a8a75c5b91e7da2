package work.goscript.kernel.value;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.StringJoiner;

/**
 * Renders runtime values the way the {@code %v} verb prints them.
 */
public final class ValueFormatter {
    private static final Comparator<RuntimeValue> KEY_ORDER = ValueFormatter::compareKeys;

    private ValueFormatter() {}

    public static String format(RuntimeValue value) {
        var out = new StringBuilder();
        append(out, value);
        return out.toString();
    }

    private static void append(StringBuilder out, RuntimeValue value) {
        if (value instanceof RuntimeValue.IntValue n) {
            out.append(n.basic().signed() ? Long.toString(n.bits()) : Long.toUnsignedString(n.bits()));
        } else if (value instanceof RuntimeValue.Float32Value f) {
            out.append(formatFloat(f.value(), true));
        } else if (value instanceof RuntimeValue.Float64Value f) {
            out.append(formatFloat(f.value(), false));
        } else if (value instanceof RuntimeValue.StringValue s) {
            out.append(s.value());
        } else if (value instanceof RuntimeValue.BoolValue b) {
            out.append(b.value());
        } else if (value instanceof RuntimeValue.NilValue) {
            out.append("<nil>");
        } else if (value instanceof RuntimeValue.UntypedConst c) {
            out.append(c.value().stripTrailingZeros().toPlainString());
        } else if (value instanceof RuntimeValue.PointerValue p) {
            out.append(p.isNil() ? "<nil>" : p.slot().toString());
        } else if (value instanceof RuntimeValue.AnyValue any) {
            append(out, any.boxed());
        } else if (value instanceof StructValue struct) {
            out.append('{');
            for (int i = 0; i < struct.size(); i++) {
                if (i > 0) {
                    out.append(' ');
                }
                append(out, struct.get(i));
            }
            out.append('}');
        } else if (value instanceof ArrayValue array) {
            out.append('[');
            for (int i = 0; i < array.length(); i++) {
                if (i > 0) {
                    out.append(' ');
                }
                append(out, array.get(i));
            }
            out.append(']');
        } else if (value instanceof MapValue map) {
            var entries = new ArrayList<>(map.entries());
            entries.sort(Comparator.comparing(MapValue.Entry::key, KEY_ORDER));
            out.append("map[");
            for (int i = 0; i < entries.size(); i++) {
                if (i > 0) {
                    out.append(' ');
                }
                append(out, entries.get(i).key());
                out.append(':');
                append(out, entries.get(i).value());
            }
            out.append(']');
        } else {
            throw new IllegalStateException("unknown runtime value: " + value);
        }
    }

    /**
     * Shortest round-trip digits, switching to exponent form when the decimal exponent is below -4 or at
     * least 6 ({@code 1.1}, {@code 123456}, {@code 1e+06}, {@code 2e+19}).
     */
    static String formatFloat(double value, boolean single) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "+Inf" : "-Inf";
        }
        if (value == 0) {
            return Double.doubleToRawLongBits(value) < 0 ? "-0" : "0";
        }
        var decimal = shortest(value, single).stripTrailingZeros();
        var digits = decimal.unscaledValue().abs().toString();
        int exponent = digits.length() - 1 - decimal.scale();
        var out = new StringBuilder();
        if (decimal.signum() < 0) {
            out.append('-');
        }
        if (exponent < -4 || exponent >= 6) {
            out.append(digits.charAt(0));
            if (digits.length() > 1) {
                out.append('.').append(digits, 1, digits.length());
            }
            out.append('e').append(exponent < 0 ? '-' : '+');
            int magnitude = Math.abs(exponent);
            if (magnitude < 10) {
                out.append('0');
            }
            out.append(magnitude);
        } else {
            out.append(decimal.abs().toPlainString());
        }
        return out.toString();
    }

    private static BigDecimal shortest(double value, boolean single) {
        var exact = single ? new BigDecimal((float) value) : new BigDecimal(value);
        int maxDigits = single ? 9 : 17;
        for (int precision = 1; precision < maxDigits; precision++) {
            var candidate = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
            if (roundTrips(candidate, value, single)) {
                return candidate;
            }
        }
        return exact.round(new MathContext(maxDigits, RoundingMode.HALF_EVEN));
    }

    private static boolean roundTrips(BigDecimal candidate, double value, boolean single) {
        var text = candidate.toString();
        if (single) {
            return Float.parseFloat(text) == (float) value;
        }
        return Double.parseDouble(text) == value;
    }

    private static int compareKeys(RuntimeValue left, RuntimeValue right) {
        if (left instanceof RuntimeValue.AnyValue a && right instanceof RuntimeValue.AnyValue b) {
            if (a.isNil() || b.isNil()) {
                return Boolean.compare(!a.isNil(), !b.isNil());
            }
            int byType = a.dynamicType().typeName().compareTo(b.dynamicType().typeName());
            return byType != 0 ? byType : compareKeys(a.boxed(), b.boxed());
        }
        if (left instanceof RuntimeValue.IntValue a && right instanceof RuntimeValue.IntValue b) {
            return a.basic().signed() ? Long.compare(a.bits(), b.bits()) : Long.compareUnsigned(a.bits(), b.bits());
        }
        if (left instanceof RuntimeValue.Float32Value a && right instanceof RuntimeValue.Float32Value b) {
            return Float.compare(a.value(), b.value());
        }
        if (left instanceof RuntimeValue.Float64Value a && right instanceof RuntimeValue.Float64Value b) {
            return Double.compare(a.value(), b.value());
        }
        if (left instanceof RuntimeValue.StringValue a && right instanceof RuntimeValue.StringValue b) {
            return a.value().compareTo(b.value());
        }
        if (left instanceof RuntimeValue.BoolValue a && right instanceof RuntimeValue.BoolValue b) {
            return Boolean.compare(a.value(), b.value());
        }
        if (left instanceof RuntimeValue.PointerValue a && right instanceof RuntimeValue.PointerValue b) {
            if (a.isNil() || b.isNil()) {
                return Boolean.compare(!a.isNil(), !b.isNil());
            }
            int byArena = Long.compare(a.slot().arena(), b.slot().arena());
            return byArena != 0 ? byArena : Long.compare(a.slot().id(), b.slot().id());
        }
        if (left instanceof StructValue a && right instanceof StructValue b && a.size() == b.size()) {
            for (int i = 0; i < a.size(); i++) {
                int cmp = compareKeys(a.get(i), b.get(i));
                if (cmp != 0) {
                    return cmp;
                }
            }
            return 0;
        }
        return 0;
    }

    public static String joinAll(Iterable<? extends RuntimeValue> values) {
        var joiner = new StringJoiner(" ");
        for (RuntimeValue value : values) {
            joiner.add(format(value));
        }
        return joiner.toString();
    }
}
