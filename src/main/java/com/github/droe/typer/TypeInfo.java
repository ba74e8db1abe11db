package com.github.droe.typer;

import java.util.Optional;

/**
 * A resolved type: the tag, the data type name for {@link ValueType#DATA} and, for
 * collections, the element type when it is known.
 */
public record TypeInfo(ValueType type, Optional<String> dataName, Optional<TypeInfo> elementType) {

    public static TypeInfo of(ValueType type) {
        return new TypeInfo(type, Optional.empty(), Optional.empty());
    }

    public static TypeInfo data(String name) {
        return new TypeInfo(ValueType.DATA, Optional.of(name), Optional.empty());
    }

    public static TypeInfo collection(ValueType type, TypeInfo element) {
        return new TypeInfo(type, Optional.empty(), Optional.of(element));
    }

    public TypeInfo withElementType(Optional<TypeInfo> element) {
        return new TypeInfo(type, dataName, element);
    }

    /**
     * Data values are only compatible with the same data type; everything else follows
     * {@link ValueType#isCompatible}. Known element types of two collections must be
     * compatible too.
     */
    public static boolean isCompatible(TypeInfo declared, TypeInfo observed) {
        if (declared.isUnknown() || observed.isUnknown()) {
            return true;
        }
        if (declared.type == ValueType.DATA || observed.type == ValueType.DATA) {
            return declared.dataName.equals(observed.dataName);
        }
        if (!ValueType.isCompatible(declared.type, observed.type)) {
            return false;
        }
        if (declared.elementType.isPresent() && observed.elementType.isPresent()) {
            return isCompatible(declared.elementType.get(), observed.elementType.get());
        }
        return true;
    }

    /**
     * Whether {@code declared} widens {@code existing}, at the top level or in the element
     * types of two collections.
     */
    public static boolean isWidening(TypeInfo existing, TypeInfo declared) {
        if (declared.type.isWiderThan(existing.type)) {
            return true;
        }
        return existing.elementType.isPresent() && declared.elementType.isPresent()
                && isWidening(existing.elementType.get(), declared.elementType.get());
    }

    public boolean isUnknown() {
        return type == ValueType.UNKNOWN;
    }

    public String describe() {
        if (type == ValueType.DATA) {
            return dataName.orElse("data");
        }
        if (elementType.isPresent()) {
            var prefix = type == ValueType.GROUP_OF ? "group of " : type == ValueType.ARRAY ? "array of " : "list of ";
            return prefix + elementType.get().describe();
        }
        return type.typeName();
    }

    @Override
    public String toString() {
        return describe();
    }
}
