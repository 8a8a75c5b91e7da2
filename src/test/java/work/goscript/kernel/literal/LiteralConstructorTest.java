package work.goscript.kernel.literal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.goscript.kernel.shared.KernelPanicException;
import work.goscript.kernel.shared.PanicCode;
import work.goscript.kernel.types.ArrayType;
import work.goscript.kernel.types.BasicType;
import work.goscript.kernel.types.MapType;
import work.goscript.kernel.types.StructType;
import work.goscript.kernel.value.RuntimeValue;

class LiteralConstructorTest {
    private static final StructType TRIPLE = StructType.named("Triple", List.of(
        new StructType.Field("a", BasicType.INT),
        new StructType.Field("b", BasicType.INT),
        new StructType.Field("c", BasicType.INT)));

    private final LiteralConstructor literals = new LiteralConstructor();

    @Test
    void keyedStructLeavesOtherFieldsZero() {
        var value = literals.buildStruct(TRIPLE, List.of(LiteralEntry.field("b", constant(88))));
        assertEquals("{0 88 0}", value.toString());
    }

    @Test
    void positionalStructFillsInDeclarationOrder() {
        var value = literals.buildStruct(TRIPLE, List.of(
            LiteralEntry.positional(constant(8)),
            LiteralEntry.positional(constant(9)),
            LiteralEntry.positional(constant(10))));
        assertEquals("{8 9 10}", value.toString());
        assertEquals(RuntimeValue.IntValue.of(9), value.get("b"));
    }

    @Test
    void emptyStructLiteralIsZero() {
        assertEquals(TRIPLE.zeroValue(), literals.buildStruct(TRIPLE, List.of()));
    }

    @Test
    void structLiteralViolationsPanic() {
        assertPanics(PanicCode.MIXED_LITERAL, () -> literals.buildStruct(TRIPLE, List.of(
            LiteralEntry.field("a", constant(1)),
            LiteralEntry.positional(constant(2)))));
        assertPanics(PanicCode.UNKNOWN_FIELD, () -> literals.buildStruct(TRIPLE, List.of(
            LiteralEntry.field("d", constant(1)))));
        assertPanics(PanicCode.DUPLICATE_FIELD, () -> literals.buildStruct(TRIPLE, List.of(
            LiteralEntry.field("a", constant(1)),
            LiteralEntry.field("a", constant(2)))));
        assertPanics(PanicCode.TOO_MANY_VALUES, () -> literals.buildStruct(TRIPLE, List.of(
            LiteralEntry.positional(constant(1)),
            LiteralEntry.positional(constant(2)),
            LiteralEntry.positional(constant(3)),
            LiteralEntry.positional(constant(4)))));
        assertPanics(PanicCode.TOO_FEW_VALUES, () -> literals.buildStruct(TRIPLE, List.of(
            LiteralEntry.positional(constant(1)))));
        assertPanics(PanicCode.INVALID_KEY, () -> literals.buildStruct(TRIPLE, List.of(
            LiteralEntry.index(0, constant(1)))));
        assertPanics(PanicCode.TYPE_MISMATCH, () -> literals.buildStruct(TRIPLE, List.of(
            LiteralEntry.field("a", new RuntimeValue.StringValue("x")))));
    }

    @Test
    void fieldValuesAreConvertedToFieldTypes() {
        var mixed = StructType.anonymous(List.of(
            new StructType.Field("f", BasicType.FLOAT32),
            new StructType.Field("u", BasicType.UINT8)));
        var value = literals.buildStruct(mixed, List.of(
            LiteralEntry.positional(RuntimeValue.UntypedConst.floating("1.1")),
            LiteralEntry.positional(constant(255))));
        assertEquals(new RuntimeValue.Float32Value(1.1f), value.get(0));
        assertPanics(PanicCode.CONSTANT_OVERFLOW, () -> literals.buildStruct(mixed, List.of(
            LiteralEntry.field("u", constant(256)))));
    }

    @Test
    void mapLiteralRequiresKeys() {
        var type = new MapType(BasicType.STRING, BasicType.INT);
        var map = literals.buildMap(type, List.of(
            LiteralEntry.mapKey(new RuntimeValue.StringValue("a"), constant(1)),
            LiteralEntry.mapKey(new RuntimeValue.StringValue("b"), constant(2))));
        assertEquals("map[a:1 b:2]", map.toString());
        assertFalse(literals.buildMap(type, List.of()).isNil());
        assertPanics(PanicCode.INVALID_KEY, () -> literals.buildMap(type, List.of(LiteralEntry.positional(constant(1)))));
    }

    @Test
    void dispatchesOnLiteralType() {
        var array = literals.build(ArrayType.fixed(BasicType.INT, 3), List.of(LiteralEntry.index(1, constant(5))));
        assertEquals("[0 5 0]", array.toString());
        assertThrows(IllegalArgumentException.class, () -> literals.build(BasicType.INT, List.of()));
    }

    @Test
    void arrayLengthIsBoundedByConfiguration() {
        var small = new LiteralConstructor(4);
        assertPanics(PanicCode.LITERAL_TOO_LARGE, () -> small.buildArray(ArrayType.inferred(BasicType.INT),
            List.of(LiteralEntry.index(4, constant(1)))));
        assertThrows(IllegalArgumentException.class, () -> new LiteralConstructor(0));
    }

    private static RuntimeValue constant(long value) {
        return RuntimeValue.UntypedConst.integer(value);
    }

    @Test
    void ellipsisArrayTakesItsLengthFromTheLiteral() {
        var constructor = new LiteralConstructor();
        var entries = List.of(
            LiteralEntry.positional(RuntimeValue.UntypedConst.integer(1)),
            LiteralEntry.index(4, RuntimeValue.UntypedConst.integer(5)));

        var fixed = constructor.buildArray(ArrayType.ellipsis(BasicType.INT), entries);
        assertEquals(ArrayType.fixed(BasicType.INT, 5), fixed.arrayType());
        assertEquals("[1 0 0 0 5]", fixed.toString());

        var unsized = constructor.buildArray(ArrayType.inferred(BasicType.INT), entries);
        assertEquals(ArrayType.inferred(BasicType.INT), unsized.arrayType());
        assertEquals(5, unsized.length());
    }

    private static void assertPanics(PanicCode code, Runnable action) {
        var panic = assertThrows(KernelPanicException.class, action::run);
        assertEquals(code, panic.code(), panic::getMessage);
    }
}
