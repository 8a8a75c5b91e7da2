package work.goscript.kernel.types;

import work.goscript.kernel.value.RuntimeValue;

/**
 * The empty interface: values carry their dynamic type at runtime.
 */
public enum AnyType implements GosType {
    ANY;

    @Override
    public String typeName() {
        return "any";
    }

    @Override
    public RuntimeValue zeroValue() {
        return RuntimeValue.AnyValue.nil();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
