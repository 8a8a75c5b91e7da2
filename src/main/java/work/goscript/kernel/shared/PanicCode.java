package work.goscript.kernel.shared;

import java.util.Locale;

/**
 * Identifies the rule a fatal runtime condition violated.
 */
public enum PanicCode {
    NIL_MAP_WRITE("assignment_to_nil_map"),
    TOO_MANY_VALUES,
    TOO_FEW_VALUES,
    MIXED_LITERAL,
    UNKNOWN_FIELD,
    DUPLICATE_FIELD,
    DUPLICATE_INDEX,
    INVALID_KEY,
    NEGATIVE_INDEX,
    INDEX_OUT_OF_RANGE,
    LITERAL_TOO_LARGE,
    UNHASHABLE_KEY,
    INCOMPARABLE,
    TYPE_MISMATCH,
    CONSTANT_OVERFLOW,
    CONSTANT_TRUNCATED,
    NIL_DEREFERENCE;

    private final String id;

    PanicCode() {
        this.id = name().toLowerCase(Locale.ROOT);
    }

    PanicCode(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static PanicCode fromId(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        for (PanicCode code : values()) {
            if (code.id.equalsIgnoreCase(trimmed) || code.name().equalsIgnoreCase(trimmed)) {
                return code;
            }
        }
        return null;
    }
}
