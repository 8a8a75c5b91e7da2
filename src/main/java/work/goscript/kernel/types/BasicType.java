package work.goscript.kernel.types;

import java.util.Map;
import work.goscript.kernel.value.RuntimeValue;

/**
 * Predeclared boolean, string and numeric types.
 */
public enum BasicType implements GosType {
    BOOL("bool", 0, false),
    STRING("string", 0, false),
    INT("int", 64, true),
    INT8("int8", 8, true),
    INT16("int16", 16, true),
    INT32("int32", 32, true),
    INT64("int64", 64, true),
    UINT("uint", 64, false),
    UINT8("uint8", 8, false),
    UINT16("uint16", 16, false),
    UINT32("uint32", 32, false),
    UINT64("uint64", 64, false),
    UINTPTR("uintptr", 64, false),
    FLOAT32("float32", 32, true),
    FLOAT64("float64", 64, true);

    private static final Map<String, BasicType> ALIASES = Map.of("byte", UINT8, "rune", INT32);

    private final String typeName;
    private final int width;
    private final boolean signed;

    BasicType(String typeName, int width, boolean signed) {
        this.typeName = typeName;
        this.width = width;
        this.signed = signed;
    }

    public static BasicType lookup(String name) {
        if (name == null) {
            return null;
        }
        var alias = ALIASES.get(name);
        if (alias != null) {
            return alias;
        }
        for (BasicType type : values()) {
            if (type.typeName.equals(name)) {
                return type;
            }
        }
        return null;
    }

    @Override
    public String typeName() {
        return typeName;
    }

    public int width() {
        return width;
    }

    public boolean signed() {
        return signed;
    }

    public boolean isInteger() {
        return ordinal() >= INT.ordinal() && ordinal() <= UINTPTR.ordinal();
    }

    public boolean isFloat() {
        return this == FLOAT32 || this == FLOAT64;
    }

    public boolean isNumeric() {
        return isInteger() || isFloat();
    }

    /**
     * Truncates raw two's complement bits to this integer kind's width, sign or zero extending the result.
     */
    public long wrap(long bits) {
        if (!isInteger()) {
            throw new IllegalStateException(typeName + " is not an integer type");
        }
        if (width == 64) {
            return bits;
        }
        int shift = 64 - width;
        return signed ? (bits << shift) >> shift : (bits << shift) >>> shift;
    }

    @Override
    public RuntimeValue zeroValue() {
        return switch (this) {
            case BOOL -> new RuntimeValue.BoolValue(false);
            case STRING -> new RuntimeValue.StringValue("");
            case FLOAT32 -> new RuntimeValue.Float32Value(0f);
            case FLOAT64 -> new RuntimeValue.Float64Value(0d);
            default -> new RuntimeValue.IntValue(this, 0L);
        };
    }

    @Override
    public String toString() {
        return typeName;
    }
}
