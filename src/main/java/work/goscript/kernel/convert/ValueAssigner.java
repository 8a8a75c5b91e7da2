package work.goscript.kernel.convert;

import java.util.Objects;
import work.goscript.kernel.shared.KernelPanicException;
import work.goscript.kernel.shared.PanicCode;
import work.goscript.kernel.types.AnyType;
import work.goscript.kernel.types.ArrayType;
import work.goscript.kernel.types.BasicType;
import work.goscript.kernel.types.GosType;
import work.goscript.kernel.types.MapType;
import work.goscript.kernel.types.PointerType;
import work.goscript.kernel.value.MapValue;
import work.goscript.kernel.value.RuntimeValue;

/**
 * Converts an operand into the value stored in a slot of a declared type: struct fields, array elements,
 * map keys and values, pointer targets.
 */
public final class ValueAssigner {
    private ValueAssigner() {}

    public static RuntimeValue assign(RuntimeValue value, GosType target) {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(target, "target");
        if (target == AnyType.ANY) {
            return box(value);
        }
        if (value instanceof RuntimeValue.UntypedConst constant) {
            if (target instanceof BasicType basic) {
                return NumericConversion.convertConstant(constant.value(), basic);
            }
            throw mismatch(value, target);
        }
        if (value instanceof RuntimeValue.NilValue) {
            if (target instanceof PointerType pointer) {
                return RuntimeValue.PointerValue.nil(pointer);
            }
            if (target instanceof MapType map) {
                return MapValue.nil(map);
            }
            if (target instanceof ArrayType array && array.isInferred() && !array.isEllipsis()) {
                return array.zeroValue();
            }
            throw KernelPanicException.of(PanicCode.TYPE_MISMATCH, "cannot use nil as %s value", target.typeName());
        }
        var source = value.type();
        if (target.equals(source)) {
            return value.copyValue();
        }
        if (source instanceof BasicType from && from.isNumeric()
            && target instanceof BasicType to && to.isNumeric()) {
            return NumericConversion.convert(value, to);
        }
        throw mismatch(value, target);
    }

    private static RuntimeValue box(RuntimeValue value) {
        if (value instanceof RuntimeValue.UntypedConst constant) {
            return RuntimeValue.AnyValue.box(NumericConversion.convertConstant(constant.value(), constant.defaultType()));
        }
        return RuntimeValue.AnyValue.box(value.copyValue());
    }

    private static KernelPanicException mismatch(RuntimeValue value, GosType target) {
        var source = value.type() == null ? value.kind() : value.type().typeName();
        return KernelPanicException.of(PanicCode.TYPE_MISMATCH,
            "cannot use value of type %s as %s value", source, target.typeName());
    }
}
