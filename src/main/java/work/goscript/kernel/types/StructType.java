package work.goscript.kernel.types;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;
import work.goscript.kernel.value.RuntimeValue;
import work.goscript.kernel.value.StructValue;

/**
 * Ordered, named field list. Named struct types are identified by their name and may be declared
 * before their fields are known so that fields can point back at the type itself.
 */
public final class StructType implements GosType {
    private final String name;
    private List<Field> fields;

    private StructType(String name, List<Field> fields) {
        this.name = name;
        if (fields != null) {
            define(fields);
        }
    }

    public static StructType anonymous(List<Field> fields) {
        return new StructType(null, Objects.requireNonNull(fields, "fields"));
    }

    public static StructType named(String name, List<Field> fields) {
        return new StructType(requireName(name), Objects.requireNonNull(fields, "fields"));
    }

    /**
     * Declares a named struct whose fields are supplied later through {@link #define(List)}.
     */
    public static StructType declare(String name) {
        return new StructType(requireName(name), null);
    }

    public void define(List<Field> newFields) {
        if (fields != null) {
            throw new IllegalStateException("struct type already defined: " + typeName());
        }
        var copy = List.copyOf(Objects.requireNonNull(newFields, "fields"));
        var seen = new HashSet<String>();
        for (Field field : copy) {
            if (!seen.add(field.name())) {
                throw new IllegalArgumentException("duplicate field " + field.name() + " in struct declaration");
            }
        }
        this.fields = copy;
    }

    public boolean isDefined() {
        return fields != null;
    }

    public boolean isNamed() {
        return name != null;
    }

    public String name() {
        return name;
    }

    public List<Field> fields() {
        if (fields == null) {
            throw new IllegalStateException("struct type declared but not defined: " + name);
        }
        return fields;
    }

    public int fieldCount() {
        return fields().size();
    }

    /**
     * Returns the declaration index of the field, or -1 when the struct has no such field.
     */
    public int fieldIndex(String fieldName) {
        var list = fields();
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i).name().equals(fieldName)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String typeName() {
        if (name != null) {
            return name;
        }
        var joiner = new StringJoiner("; ", "struct { ", " }").setEmptyValue("struct {}");
        for (Field field : fields()) {
            joiner.add(field.name() + " " + field.type().typeName());
        }
        return joiner.toString();
    }

    @Override
    public RuntimeValue zeroValue() {
        return StructValue.zero(this);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof StructType that)) {
            return false;
        }
        if (name != null || that.name != null) {
            return Objects.equals(name, that.name);
        }
        return fields().equals(that.fields());
    }

    @Override
    public int hashCode() {
        return name != null ? name.hashCode() : fields().hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("struct type name must not be blank");
        }
        return name;
    }

    public record Field(String name, GosType type) {
        public Field {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(type, "type");
        }
    }
}
