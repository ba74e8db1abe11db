package com.github.droe.typer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.Test;

public class ValueTypeTest {

    @Test
    public void testCompatibilityIsSymmetricWithinFamilies() {
        for (var a : ValueType.values()) {
            for (var b : ValueType.values()) {
                if (a == ValueType.DATE || b == ValueType.DATE || a == ValueType.UNKNOWN || b == ValueType.UNKNOWN) {
                    continue;
                }
                assertEquals(ValueType.isCompatible(a, b), ValueType.isCompatible(b, a), a + " / " + b);
                boolean sameFamily = a.family() == b.family() && a.family() != ValueType.Family.NONE;
                assertEquals(a == b || sameFamily, ValueType.isCompatible(a, b), a + " / " + b);
            }
        }
    }

    @Test
    public void testDateAcceptsText() {
        assertTrue(ValueType.isCompatible(ValueType.DATE, ValueType.TEXT));
        assertTrue(ValueType.isCompatible(ValueType.DATE, ValueType.STRING));
        assertFalse(ValueType.isCompatible(ValueType.TEXT, ValueType.DATE));
        assertFalse(ValueType.isCompatible(ValueType.DATE, ValueType.INT));
    }

    @Test
    public void testUnknownIsCompatibleWithEverything() {
        for (var type : ValueType.values()) {
            assertTrue(ValueType.isCompatible(ValueType.UNKNOWN, type), type.name());
            assertTrue(ValueType.isCompatible(type, ValueType.UNKNOWN), type.name());
        }
        assertEquals(Optional.empty(), ValueType.fromName("unknown"));
    }

    @Test
    public void testWidening() {
        assertTrue(ValueType.DECIMAL.isWiderThan(ValueType.INT));
        assertTrue(ValueType.NUMBER.isWiderThan(ValueType.INT));
        assertFalse(ValueType.INT.isWiderThan(ValueType.DECIMAL));
        assertFalse(ValueType.INT.isWiderThan(ValueType.INT));
        assertFalse(ValueType.STRING.isWiderThan(ValueType.TEXT));

        var listOfInt = TypeInfo.collection(ValueType.LIST_OF, TypeInfo.of(ValueType.INT));
        var listOfDecimal = TypeInfo.collection(ValueType.LIST_OF, TypeInfo.of(ValueType.DECIMAL));
        assertTrue(TypeInfo.isWidening(listOfInt, listOfDecimal));
        assertFalse(TypeInfo.isWidening(listOfDecimal, listOfInt));
        assertFalse(TypeInfo.isWidening(listOfInt, TypeInfo.of(ValueType.LIST_OF)));
    }

    @Test
    public void testCrossFamily() {
        assertFalse(ValueType.isCompatible(ValueType.INT, ValueType.TEXT));
        assertFalse(ValueType.isCompatible(ValueType.FLAG, ValueType.INT));
        assertFalse(ValueType.isCompatible(ValueType.FILE, ValueType.TEXT));
        assertTrue(ValueType.isCompatible(ValueType.NUMBER, ValueType.DECIMAL));
        assertTrue(ValueType.isCompatible(ValueType.ARRAY, ValueType.LIST_OF));
    }

    @Test
    public void testFromName() {
        assertEquals(Optional.of(ValueType.NUMBER), ValueType.fromName("Number"));
        assertEquals(Optional.of(ValueType.YESNO), ValueType.fromName("yesno"));
        assertEquals(Optional.empty(), ValueType.fromName("data"));
        assertEquals(Optional.empty(), ValueType.fromName("Person"));
    }

    @Test
    public void testTypeInfo() {
        var listOfInt = TypeInfo.collection(ValueType.LIST_OF, TypeInfo.of(ValueType.INT));
        var listOfText = TypeInfo.collection(ValueType.LIST_OF, TypeInfo.of(ValueType.TEXT));
        assertEquals("list of int", listOfInt.describe());
        assertFalse(TypeInfo.isCompatible(listOfInt, listOfText));
        assertTrue(TypeInfo.isCompatible(listOfInt, TypeInfo.of(ValueType.LIST_OF)));
        assertTrue(TypeInfo.isCompatible(TypeInfo.data("User"), TypeInfo.data("User")));
        assertFalse(TypeInfo.isCompatible(TypeInfo.data("User"), TypeInfo.data("Order")));
        assertFalse(TypeInfo.isCompatible(TypeInfo.data("User"), TypeInfo.of(ValueType.TEXT)));
        assertEquals("User", TypeInfo.data("User").describe());
    }
}
