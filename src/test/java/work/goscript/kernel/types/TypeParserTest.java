package work.goscript.kernel.types;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class TypeParserTest {
    @Test
    void parsesCompositeExpressions() {
        var registry = new TypeRegistry();
        var type = TypeParser.parse("map[string][3]*struct { a, b int; c string }", registry);

        var map = (MapType) type;
        assertEquals(BasicType.STRING, map.key());
        var array = (ArrayType) map.value();
        assertEquals(3, array.length());
        var struct = (StructType) ((PointerType) array.element()).element();
        assertEquals(List.of("a", "b", "c"), struct.fields().stream().map(StructType.Field::name).toList());
        assertEquals(BasicType.INT, struct.fields().get(1).type());
        assertEquals("map[string][3]*struct { a int; b int; c string }", type.typeName());
    }

    @Test
    void resolvesAliasesAndEmptyInterface() {
        assertEquals(BasicType.UINT8, TypeParser.parse("byte", null));
        assertEquals(BasicType.INT32, TypeParser.parse("rune", null));
        assertSame(AnyType.ANY, TypeParser.parse("interface{}", null));
        assertTrue(((ArrayType) TypeParser.parse("[...]int", null)).isInferred());
    }

    @Test
    void ellipsisArrayIsDistinctFromUnsizedArray() {
        var ellipsis = (ArrayType) TypeParser.parse("[...]int", null);
        var unsized = (ArrayType) TypeParser.parse("[]int", null);
        assertTrue(ellipsis.isEllipsis());
        assertFalse(unsized.isEllipsis());
        assertNotEquals(ellipsis, unsized);
        assertEquals("[...]int", ellipsis.typeName());
        assertEquals("[]int", unsized.typeName());
        assertEquals(ArrayType.fixed(BasicType.INT, 3), ellipsis.withLiteralLength(3));
        assertSame(unsized, unsized.withLiteralLength(3));
    }

    @Test
    void rejectsUndefinedNamesAndTrailingInput() {
        var undefined = assertThrows(IllegalArgumentException.class, () -> TypeParser.parse("map[Point]int", null));
        assertTrue(undefined.getMessage().contains("undefined type Point"), undefined::getMessage);
        assertThrows(IllegalArgumentException.class, () -> TypeParser.parse("int int", null));
        assertThrows(IllegalArgumentException.class, () -> TypeParser.parse("[x]int", null));
    }

    @Test
    void registryAllowsSelfReferenceThroughPointers() {
        var registry = new TypeRegistry();
        var node = (StructType) registry.declare("Node", "struct { v int; next *Node }");

        var next = (PointerType) node.fields().get(1).type();
        assertSame(node, next.element());
        assertEquals("Node", node.typeName());
        assertSame(node, registry.resolve("Node"));
    }

    @Test
    void registryRejectsRedeclarationAndForgetsFailedDeclarations() {
        var registry = new TypeRegistry();
        registry.declare("Celsius", "float64");
        assertThrows(IllegalArgumentException.class, () -> registry.declare("Celsius", "int"));
        assertThrows(IllegalArgumentException.class, () -> registry.declare("int", "string"));

        assertThrows(IllegalArgumentException.class, () -> registry.declare("Broken", "struct { a Missing }"));
        assertEquals(null, registry.lookup("Broken"));
        assertEquals(BasicType.FLOAT64, registry.lookup("Celsius"));
    }

    @Test
    void namedStructsCompareByNameAnonymousByFields() {
        var registry = new TypeRegistry();
        var a = registry.declare("A", "struct { x int }");
        var b = registry.declare("B", "struct { x int }");
        assertTrue(!a.equals(b));
        assertEquals(TypeParser.parse("struct { x int }", null), TypeParser.parse("struct{x int}", null));
    }
}
