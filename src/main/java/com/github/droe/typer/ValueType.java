package com.github.droe.typer;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of value type tags. The legacy names {@code number}, {@code string},
 * {@code boolean} and {@code array} are full members of their modern counterparts' families.
 * {@link #DATA} tags values of a user-declared data type.
 */
public enum ValueType {
    INT("int", Family.NUMERIC),
    DECIMAL("decimal", Family.NUMERIC),
    TEXT("text", Family.TEXTUAL),
    FLAG("flag", Family.BOOLEAN),
    YESNO("yesno", Family.BOOLEAN),
    DATE("date", Family.NONE),
    LIST_OF("list_of", Family.COLLECTION),
    GROUP_OF("group_of", Family.COLLECTION),
    FILE("file", Family.NONE),
    NUMBER("number", Family.NUMERIC),
    STRING("string", Family.TEXTUAL),
    BOOLEAN("boolean", Family.BOOLEAN),
    ARRAY("array", Family.COLLECTION),
    DATA("data", Family.NONE),
    /** Elements of a collection declared without an element type. */
    UNKNOWN("unknown", Family.NONE);

    public enum Family { NUMERIC, TEXTUAL, BOOLEAN, COLLECTION, NONE }

    private final String typeName;
    private final Family family;

    ValueType(String typeName, Family family) {
        this.typeName = typeName;
        this.family = family;
    }

    public String typeName() {
        return typeName;
    }

    public Family family() {
        return family;
    }

    public boolean isNumeric() {
        return family == Family.NUMERIC;
    }

    public boolean isTextual() {
        return family == Family.TEXTUAL;
    }

    public boolean isBoolean() {
        return family == Family.BOOLEAN;
    }

    public boolean isCollection() {
        return family == Family.COLLECTION;
    }

    /**
     * Whether values of this type can hold more than values of {@code other}, e.g.
     * {@code decimal} against {@code int}. Only meaningful for compatible types.
     */
    public boolean isWiderThan(ValueType other) {
        return isNumeric() && other == INT && this != INT;
    }

    /**
     * Looks up a built-in type by its source name, case-insensitively. {@code data} and
     * {@code unknown} are not source names; data types are referred to by their own names.
     */
    public static Optional<ValueType> fromName(String name) {
        var lower = name.toLowerCase(Locale.ROOT);
        for (var type : values()) {
            if (type != DATA && type != UNKNOWN && type.typeName.equals(lower)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Whether a value of type {@code observed} may be stored where {@code declared} is
     * expected: identical tags, the same family, or a textual value for a date. An
     * {@code unknown} type is compatible with everything.
     */
    public static boolean isCompatible(ValueType declared, ValueType observed) {
        if (declared == observed || declared == UNKNOWN || observed == UNKNOWN) {
            return true;
        }
        if (declared.family != Family.NONE && declared.family == observed.family) {
            return true;
        }
        return declared == DATE && observed.isTextual();
    }
}
