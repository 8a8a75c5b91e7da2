package work.goscript.kernel.convert;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import work.goscript.kernel.shared.KernelPanicException;
import work.goscript.kernel.shared.PanicCode;
import work.goscript.kernel.types.AnyType;
import work.goscript.kernel.types.ArrayType;
import work.goscript.kernel.types.BasicType;
import work.goscript.kernel.types.MapType;
import work.goscript.kernel.types.PointerType;
import work.goscript.kernel.value.ArrayValue;
import work.goscript.kernel.value.MapValue;
import work.goscript.kernel.value.RuntimeValue;

class ValueAssignerTest {
    @Test
    void untypedConstantsTakeTheTargetType() {
        assertEquals(new RuntimeValue.IntValue(BasicType.INT16, 7),
            ValueAssigner.assign(RuntimeValue.UntypedConst.integer(7), BasicType.INT16));
        assertEquals(new RuntimeValue.Float64Value(3),
            ValueAssigner.assign(RuntimeValue.UntypedConst.integer(3), BasicType.FLOAT64));
    }

    @Test
    void anyBoxesWithDefaultType() {
        var boxedInt = (RuntimeValue.AnyValue) ValueAssigner.assign(RuntimeValue.UntypedConst.integer(1), AnyType.ANY);
        assertEquals(BasicType.INT, boxedInt.dynamicType());
        var boxedFloat = (RuntimeValue.AnyValue) ValueAssigner.assign(RuntimeValue.UntypedConst.floating("1.5"), AnyType.ANY);
        assertEquals(BasicType.FLOAT64, boxedFloat.dynamicType());
        assertTrue(((RuntimeValue.AnyValue) ValueAssigner.assign(RuntimeValue.NilValue.INSTANCE, AnyType.ANY)).isNil());
    }

    @Test
    void nilBecomesTypedNil() {
        var pointer = ValueAssigner.assign(RuntimeValue.NilValue.INSTANCE, new PointerType(BasicType.INT));
        assertTrue(((RuntimeValue.PointerValue) pointer).isNil());
        var map = ValueAssigner.assign(RuntimeValue.NilValue.INSTANCE, new MapType(BasicType.INT, BasicType.INT));
        assertTrue(((MapValue) map).isNil());

        var panic = assertThrows(KernelPanicException.class,
            () -> ValueAssigner.assign(RuntimeValue.NilValue.INSTANCE, BasicType.STRING));
        assertEquals("cannot use nil as string value", panic.getMessage());
    }

    @Test
    void arraysAreCopiedOnAssignment() {
        var type = ArrayType.fixed(BasicType.INT, 1);
        var original = (ArrayValue) type.zeroValue();
        var assigned = ValueAssigner.assign(original, type);
        assertNotSame(original, assigned);
        assertEquals(original, assigned);
    }

    @Test
    void mismatchedTypesAreRejected() {
        var panic = assertThrows(KernelPanicException.class,
            () -> ValueAssigner.assign(new RuntimeValue.StringValue("x"), BasicType.INT));
        assertEquals(PanicCode.TYPE_MISMATCH, panic.code());
        assertEquals("cannot use value of type string as int value", panic.getMessage());
    }
}
