package work.goscript.kernel.types;

import work.goscript.kernel.value.RuntimeValue;

/**
 * Static type descriptor attached to runtime values and literal targets.
 */
public sealed interface GosType permits BasicType, StructType, ArrayType, PointerType, MapType, AnyType {
    /**
     * Renders the type the way it is written in source (e.g. {@code map[string]int}).
     */
    String typeName();

    /**
     * Returns a fresh zero value of this type.
     */
    RuntimeValue zeroValue();
}
