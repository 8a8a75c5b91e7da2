package work.goscript.kernel.types;

import java.util.Objects;
import work.goscript.kernel.value.RuntimeValue;

public record PointerType(GosType element) implements GosType {
    public PointerType {
        Objects.requireNonNull(element, "element");
    }

    @Override
    public String typeName() {
        return "*" + element.typeName();
    }

    @Override
    public RuntimeValue zeroValue() {
        return RuntimeValue.PointerValue.nil(this);
    }

    @Override
    public String toString() {
        return typeName();
    }
}
