package work.goscript.kernel.value;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import work.goscript.kernel.types.GosType;
import work.goscript.kernel.types.StructType;

/**
 * Struct instance: one value per declared field, addressed by name or declaration index.
 */
public final class StructValue implements RuntimeValue {
    private final StructType structType;
    private final RuntimeValue[] fields;

    public StructValue(StructType structType, RuntimeValue[] fields) {
        this.structType = Objects.requireNonNull(structType, "structType");
        Objects.requireNonNull(fields, "fields");
        if (fields.length != structType.fieldCount()) {
            throw new IllegalArgumentException(
                "struct " + structType.typeName() + " has " + structType.fieldCount() + " fields, got " + fields.length);
        }
        for (RuntimeValue field : fields) {
            Objects.requireNonNull(field, "field");
        }
        this.fields = fields.clone();
    }

    public static StructValue zero(StructType type) {
        var declared = type.fields();
        var values = new RuntimeValue[declared.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = declared.get(i).type().zeroValue();
        }
        return new StructValue(type, values);
    }

    public StructType structType() {
        return structType;
    }

    public int size() {
        return fields.length;
    }

    public RuntimeValue get(int index) {
        return fields[index];
    }

    public RuntimeValue get(String name) {
        return fields[requireIndex(name)];
    }

    /**
     * Stores an already assigned value; callers convert operands to the field type first.
     */
    public void set(int index, RuntimeValue value) {
        fields[index] = Objects.requireNonNull(value, "value");
    }

    public void set(String name, RuntimeValue value) {
        set(requireIndex(name), value);
    }

    public List<RuntimeValue> fields() {
        return Collections.unmodifiableList(Arrays.asList(fields));
    }

    @Override
    public String kind() {
        return "struct";
    }

    @Override
    public GosType type() {
        return structType;
    }

    @Override
    public StructValue copyValue() {
        var copy = new RuntimeValue[fields.length];
        for (int i = 0; i < fields.length; i++) {
            copy[i] = fields[i].copyValue();
        }
        return new StructValue(structType, copy);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof StructValue that
            && structType.equals(that.structType)
            && Arrays.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return 31 * structType.hashCode() + Arrays.hashCode(fields);
    }

    @Override
    public String toString() {
        return ValueFormatter.format(this);
    }

    private int requireIndex(String name) {
        int index = structType.fieldIndex(name);
        if (index < 0) {
            throw new IllegalArgumentException(structType.typeName() + " has no field " + name);
        }
        return index;
    }
}
