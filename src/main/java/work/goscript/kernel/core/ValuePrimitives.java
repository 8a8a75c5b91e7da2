package work.goscript.kernel.core;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.goscript.kernel.convert.NumericConversion;
import work.goscript.kernel.convert.ValueAssigner;
import work.goscript.kernel.equality.ValueEquality;
import work.goscript.kernel.runtime.ExecutionContext;
import work.goscript.kernel.runtime.Registry;
import work.goscript.kernel.runtime.ValueDecoder;
import work.goscript.kernel.shared.KernelPanicException;
import work.goscript.kernel.shared.PanicCode;
import work.goscript.kernel.types.BasicType;
import work.goscript.kernel.value.ArrayValue;
import work.goscript.kernel.value.MapValue;
import work.goscript.kernel.value.RuntimeValue;
import work.goscript.kernel.value.StructValue;
import work.goscript.kernel.value.ValueFormatter;

/**
 * Value helpers: explicit conversion, {@code ==}, {@code %v} formatting, selectors and zero values.
 */
public final class ValuePrimitives {
    private ValuePrimitives() {}

    public static Registry register(Registry registry) {
        registry.register("gos://value/convert@1", ValuePrimitives::convert);
        registry.register("gos://value/equal@1", ValuePrimitives::equal);
        registry.register("gos://value/format@1", ValuePrimitives::format);
        registry.register("gos://value/field@1", ValuePrimitives::field);
        registry.register("gos://value/index@1", ValuePrimitives::index);
        registry.register("gos://value/zero@1", ValuePrimitives::zero);
        return registry;
    }

    private static Object convert(ExecutionContext ctx, Map<String, Object> input) {
        var target = PrimitiveInputs.type(ctx, input);
        var value = PrimitiveInputs.value(ctx, input, "value", target);
        if (target instanceof BasicType basic && basic.isNumeric()) {
            return PrimitiveInputs.result(NumericConversion.convert(value, basic));
        }
        return PrimitiveInputs.result(ValueAssigner.assign(value, target));
    }

    private static Object equal(ExecutionContext ctx, Map<String, Object> input) {
        var left = PrimitiveInputs.value(ctx, input, "left", null);
        var right = PrimitiveInputs.value(ctx, input, "right", null);
        if (isUntypedConstant(left) && right.type() != null) {
            left = ValueAssigner.assign(left, right.type());
        } else if (isUntypedConstant(right) && left.type() != null) {
            right = ValueAssigner.assign(right, left.type());
        }
        ValueEquality.checkComparable(left, right);
        return PrimitiveInputs.result(new RuntimeValue.BoolValue(ValueEquality.equal(left, right)));
    }

    private static Object format(ExecutionContext ctx, Map<String, Object> input) {
        if (input.get("values") instanceof List<?> raw) {
            var values = new ArrayList<RuntimeValue>(raw.size());
            for (Object item : raw) {
                values.add(ValueDecoder.decode(item, null, ctx));
            }
            return PrimitiveInputs.result(new RuntimeValue.StringValue(ValueFormatter.joinAll(values)));
        }
        var value = PrimitiveInputs.value(ctx, input, "value", null);
        return PrimitiveInputs.result(new RuntimeValue.StringValue(ValueFormatter.format(value)));
    }

    private static Object field(ExecutionContext ctx, Map<String, Object> input) {
        var target = dereference(ctx, PrimitiveInputs.value(ctx, input, "value", null));
        var name = String.valueOf(PrimitiveInputs.require(input, "name"));
        if (!(target instanceof StructValue struct)) {
            throw new IllegalArgumentException("field selector on " + target.kind() + " value");
        }
        if (struct.structType().fieldIndex(name) < 0) {
            throw KernelPanicException.of(PanicCode.UNKNOWN_FIELD,
                "%s undefined (type %s has no field %s)", name, struct.structType().typeName(), name);
        }
        return PrimitiveInputs.result(struct.get(name).copyValue());
    }

    private static Object index(ExecutionContext ctx, Map<String, Object> input) {
        var target = dereference(ctx, PrimitiveInputs.value(ctx, input, "value", null));
        if (target instanceof MapValue map) {
            return PrimitiveInputs.result(map.get(PrimitiveInputs.value(ctx, input, "index", map.mapType().key())));
        }
        if (target instanceof ArrayValue array) {
            var position = PrimitiveInputs.value(ctx, input, "index", BasicType.INT);
            return PrimitiveInputs.result(array.get(position(position)).copyValue());
        }
        throw new IllegalArgumentException("cannot index " + target.kind() + " value");
    }

    private static Object zero(ExecutionContext ctx, Map<String, Object> input) {
        return PrimitiveInputs.result(PrimitiveInputs.type(ctx, input).zeroValue());
    }

    private static RuntimeValue dereference(ExecutionContext ctx, RuntimeValue value) {
        if (value instanceof RuntimeValue.PointerValue pointer) {
            return ctx.arena().load(pointer);
        }
        return value;
    }

    private static long position(RuntimeValue index) {
        BigInteger value;
        if (index instanceof RuntimeValue.UntypedConst constant && !constant.floating()) {
            value = constant.value().toBigIntegerExact();
        } else if (index instanceof RuntimeValue.IntValue n) {
            value = n.toBigInteger();
        } else {
            throw KernelPanicException.of(PanicCode.TYPE_MISMATCH, "invalid array index of type %s", index.kind());
        }
        if (value.bitLength() > 63) {
            throw KernelPanicException.of(PanicCode.INDEX_OUT_OF_RANGE, "index out of range [%s]", value);
        }
        return value.longValue();
    }

    private static boolean isUntypedConstant(RuntimeValue value) {
        return value instanceof RuntimeValue.UntypedConst;
    }
}
