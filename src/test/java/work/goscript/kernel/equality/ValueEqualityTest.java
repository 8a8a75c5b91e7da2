package work.goscript.kernel.equality;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.goscript.kernel.shared.KernelPanicException;
import work.goscript.kernel.shared.PanicCode;
import work.goscript.kernel.types.ArrayType;
import work.goscript.kernel.types.BasicType;
import work.goscript.kernel.types.MapType;
import work.goscript.kernel.types.PointerType;
import work.goscript.kernel.types.StructType;
import work.goscript.kernel.value.MapValue;
import work.goscript.kernel.value.RuntimeValue;
import work.goscript.kernel.value.SlotId;
import work.goscript.kernel.value.StructValue;

class ValueEqualityTest {
    private static final StructType POINT = StructType.named("Point", List.of(
        new StructType.Field("x", BasicType.INT),
        new StructType.Field("y", BasicType.INT)));

    @Test
    void floatsCompareByValueWithoutTolerance() {
        assertTrue(ValueEquality.equal(new RuntimeValue.Float64Value(0.0), new RuntimeValue.Float64Value(-0.0)));
        assertEquals(ValueEquality.hash(new RuntimeValue.Float64Value(0.0)), ValueEquality.hash(new RuntimeValue.Float64Value(-0.0)));
        assertFalse(ValueEquality.equal(new RuntimeValue.Float64Value(Double.NaN), new RuntimeValue.Float64Value(Double.NaN)));
        assertFalse(ValueEquality.equal(new RuntimeValue.Float64Value(0.1 + 0.2), new RuntimeValue.Float64Value(0.3)));
    }

    @Test
    void integersOfDifferentKindsDiffer() {
        assertFalse(ValueEquality.equal(RuntimeValue.IntValue.of(1), new RuntimeValue.IntValue(BasicType.INT64, 1)));
        assertTrue(ValueEquality.equal(RuntimeValue.IntValue.of(1), RuntimeValue.IntValue.of(1)));

        var small = new RuntimeValue.IntValue(BasicType.INT8, 7);
        assertEquals(BasicType.INT8, small.basic());
        assertEquals("int8", small.kind());
        assertTrue(ValueEquality.equal(small, new RuntimeValue.IntValue(BasicType.INT8, 7)));
        assertFalse(ValueEquality.equal(small, new RuntimeValue.IntValue(BasicType.UINT8, 7)));
    }

    @Test
    void structsCompareFieldByField() {
        var a = point(1, 2);
        var b = point(1, 2);
        assertTrue(ValueEquality.equal(a, b));
        assertEquals(ValueEquality.hash(a), ValueEquality.hash(b));
        assertFalse(ValueEquality.equal(a, point(2, 1)));
    }

    @Test
    void pointersCompareBySlotIdentity() {
        var type = new PointerType(POINT);
        var first = new RuntimeValue.PointerValue(type, new SlotId(1, 1));
        var same = new RuntimeValue.PointerValue(type, new SlotId(1, 1));
        var other = new RuntimeValue.PointerValue(type, new SlotId(1, 2));
        var otherArena = new RuntimeValue.PointerValue(type, new SlotId(2, 1));
        assertTrue(ValueEquality.equal(first, same));
        assertEquals(ValueEquality.hash(first), ValueEquality.hash(same));
        assertFalse(ValueEquality.equal(first, other));
        assertFalse(ValueEquality.equal(first, otherArena));
        assertTrue(ValueEquality.equal(RuntimeValue.PointerValue.nil(type), RuntimeValue.NilValue.INSTANCE));
    }

    @Test
    void anyComparesDynamicTypeThenValue() {
        var one = RuntimeValue.AnyValue.box(RuntimeValue.IntValue.of(1));
        var oneString = RuntimeValue.AnyValue.box(new RuntimeValue.StringValue("1"));
        assertFalse(ValueEquality.equal(one, oneString));
        assertTrue(ValueEquality.equal(one, RuntimeValue.AnyValue.box(RuntimeValue.IntValue.of(1))));
        assertNotEquals(ValueEquality.hash(one), ValueEquality.hash(oneString));
    }

    @Test
    void anyComparesWithConcreteOperandsByBoxingThem() {
        var one = RuntimeValue.AnyValue.box(RuntimeValue.IntValue.of(1));
        var concreteOne = RuntimeValue.IntValue.of(1);
        assertDoesNotThrow(() -> ValueEquality.checkComparable(one, concreteOne));
        assertDoesNotThrow(() -> ValueEquality.checkComparable(new RuntimeValue.StringValue("1"), one));
        assertTrue(ValueEquality.equal(one, concreteOne));
        assertTrue(ValueEquality.equal(concreteOne, one));
        assertFalse(ValueEquality.equal(one, new RuntimeValue.IntValue(BasicType.INT64, 1)));
        assertFalse(ValueEquality.equal(one, new RuntimeValue.StringValue("1")));

        var nilPointer = RuntimeValue.PointerValue.nil(new PointerType(BasicType.INT));
        assertFalse(ValueEquality.equal(RuntimeValue.AnyValue.nil(), nilPointer));

        var map = MapValue.make(new MapType(BasicType.STRING, BasicType.INT));
        var panic = assertThrows(KernelPanicException.class, () -> ValueEquality.checkComparable(one, map));
        assertEquals(PanicCode.INCOMPARABLE, panic.code());
    }

    @Test
    void mapsOnlyCompareToNil() {
        var type = new MapType(BasicType.INT, BasicType.INT);
        var left = MapValue.make(type);
        assertDoesNotThrow(() -> ValueEquality.checkComparable(left, RuntimeValue.NilValue.INSTANCE));
        assertFalse(ValueEquality.equal(left, RuntimeValue.NilValue.INSTANCE));
        assertTrue(ValueEquality.equal(MapValue.nil(type), RuntimeValue.NilValue.INSTANCE));

        var panic = assertThrows(KernelPanicException.class, () -> ValueEquality.checkComparable(left, MapValue.make(type)));
        assertEquals(PanicCode.INCOMPARABLE, panic.code());
    }

    @Test
    void mismatchedOperandTypesAreRejected() {
        var panic = assertThrows(KernelPanicException.class,
            () -> ValueEquality.checkComparable(RuntimeValue.IntValue.of(1), new RuntimeValue.StringValue("1")));
        assertEquals(PanicCode.TYPE_MISMATCH, panic.code());
        assertThrows(KernelPanicException.class,
            () -> ValueEquality.checkComparable(RuntimeValue.IntValue.of(1), RuntimeValue.NilValue.INSTANCE));
    }

    @Test
    void arraysCompareButDoNotHash() {
        var type = ArrayType.fixed(BasicType.INT, 2);
        assertTrue(ValueEquality.equal(type.zeroValue(), type.zeroValue()));
        var panic = assertThrows(KernelPanicException.class, () -> ValueEquality.hash(type.zeroValue()));
        assertEquals(PanicCode.UNHASHABLE_KEY, panic.code());
    }

    @Test
    void keysWrapEqualityAndHash() {
        assertEquals(ValueKey.of(point(3, 4)), ValueKey.of(point(3, 4)));
        assertNotEquals(ValueKey.of(point(3, 4)), ValueKey.of(point(4, 3)));
        assertNotEquals(ValueKey.of(new RuntimeValue.Float64Value(Double.NaN)),
            ValueKey.of(new RuntimeValue.Float64Value(Double.NaN)));
    }

    private static StructValue point(long x, long y) {
        return new StructValue(POINT, new RuntimeValue[] {RuntimeValue.IntValue.of(x), RuntimeValue.IntValue.of(y)});
    }
}
