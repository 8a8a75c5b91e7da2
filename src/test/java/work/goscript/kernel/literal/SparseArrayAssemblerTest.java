package work.goscript.kernel.literal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.goscript.kernel.shared.KernelPanicException;
import work.goscript.kernel.shared.PanicCode;
import work.goscript.kernel.types.ArrayType;
import work.goscript.kernel.types.BasicType;
import work.goscript.kernel.types.StructType;
import work.goscript.kernel.value.RuntimeValue;
import work.goscript.kernel.value.StructValue;

class SparseArrayAssemblerTest {
    private static final StructType PAIR = StructType.named("Pair", List.of(
        new StructType.Field("x", BasicType.INT),
        new StructType.Field("y", BasicType.INT)));
    private static final ArrayType PAIRS = ArrayType.inferred(PAIR);

    @Test
    void forwardCursorContinuesAfterExplicitIndex() {
        var assembler = new SparseArrayAssembler(PAIRS, 1024);
        assembler.place(LiteralEntry.index(10, pair(1, 1)));
        assembler.place(LiteralEntry.positional(pair(2, 2)));
        assembler.place(LiteralEntry.index(1, pair(3, 3)));
        var array = assembler.build();

        assertEquals(12, array.length());
        assertEquals(PAIR.zeroValue(), array.get(0));
        assertEquals(pair(3, 3), array.get(1));
        assertEquals(pair(1, 1), array.get(10));
        assertEquals(pair(2, 2), array.get(11));
        assertEquals(2, assembler.cursor());
    }

    @Test
    void reorderedIndicesStopAtHighestPosition() {
        var assembler = new SparseArrayAssembler(PAIRS, 1024);
        assembler.place(LiteralEntry.index(1, pair(1, 1)));
        assembler.place(LiteralEntry.positional(pair(2, 2)));
        assembler.place(LiteralEntry.index(10, pair(3, 3)));
        var array = assembler.build();

        assertEquals(11, array.length());
        assertEquals(PAIR.zeroValue(), array.get(0));
        assertEquals(pair(1, 1), array.get(1));
        assertEquals(pair(2, 2), array.get(2));
        assertEquals(pair(3, 3), array.get(10));
    }

    @Test
    void fixedLengthArraysKeepTheirLength() {
        var assembler = new SparseArrayAssembler(ArrayType.fixed(BasicType.INT, 4), 1024);
        assembler.place(LiteralEntry.positional(RuntimeValue.UntypedConst.integer(7)));
        assertEquals(4, assembler.length());
        assertEquals("[7 0 0 0]", assembler.build().toString());
    }

    @Test
    void emptyInferredLiteralHasLengthZero() {
        assertEquals(0, new SparseArrayAssembler(PAIRS, 8).build().length());
    }

    @Test
    void boundsAreCheckedWhilePlacing() {
        var fixed = new SparseArrayAssembler(ArrayType.fixed(BasicType.INT, 2), 1024);
        fixed.place(LiteralEntry.positional(RuntimeValue.UntypedConst.integer(1)));
        fixed.place(LiteralEntry.positional(RuntimeValue.UntypedConst.integer(2)));
        var overflow = assertThrows(KernelPanicException.class,
            () -> fixed.place(LiteralEntry.positional(RuntimeValue.UntypedConst.integer(3))));
        assertEquals(PanicCode.INDEX_OUT_OF_RANGE, overflow.code());
        assertEquals("array index 2 out of range [0:2]", overflow.getMessage());

        var negative = assertThrows(KernelPanicException.class,
            () -> new SparseArrayAssembler(PAIRS, 8).place(LiteralEntry.index(-1, pair(0, 0))));
        assertEquals(PanicCode.NEGATIVE_INDEX, negative.code());

        var duplicate = new SparseArrayAssembler(PAIRS, 8);
        duplicate.place(LiteralEntry.index(3, pair(0, 0)));
        var repeated = assertThrows(KernelPanicException.class,
            () -> duplicate.place(LiteralEntry.index(3, pair(1, 1))));
        assertEquals(PanicCode.DUPLICATE_INDEX, repeated.code());

        var tooLarge = assertThrows(KernelPanicException.class,
            () -> new SparseArrayAssembler(ArrayType.fixed(BasicType.INT, 100), 8));
        assertEquals(PanicCode.LITERAL_TOO_LARGE, tooLarge.code());
    }

    @Test
    void mapKeysAreNotArrayIndices() {
        var panic = assertThrows(KernelPanicException.class, () -> new SparseArrayAssembler(PAIRS, 8)
            .place(LiteralEntry.mapKey(new RuntimeValue.StringValue("a"), pair(0, 0))));
        assertEquals(PanicCode.INVALID_KEY, panic.code());
    }

    private static StructValue pair(long x, long y) {
        return new StructValue(PAIR, new RuntimeValue[] {RuntimeValue.IntValue.of(x), RuntimeValue.IntValue.of(y)});
    }
}
