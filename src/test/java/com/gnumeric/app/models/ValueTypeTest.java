package com.gnumeric.app.models;

import com.gnumeric.app.exceptions.InvalidTypeException;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tag values and the inference table used when a value is stored without an explicit type.
 */
class ValueTypeTest {

    private static final Supplier<ValueType> NEVER_ASKED = () -> {
        throw new AssertionError("prior type should not be consulted");
    };

    @Test
    void testTagsMatchFileFormat() {
        assertEquals(-10, ValueType.EXPR.getTag());
        assertEquals(10, ValueType.EMPTY.getTag());
        assertEquals(20, ValueType.BOOLEAN.getTag());
        assertEquals(30, ValueType.INTEGER.getTag());
        assertEquals(40, ValueType.FLOAT.getTag());
        assertEquals(50, ValueType.ERROR.getTag());
        assertEquals(60, ValueType.STRING.getTag());
        assertEquals(70, ValueType.CELLRANGE.getTag());
        assertEquals(80, ValueType.ARRAY.getTag());
    }

    @Test
    void testFromTag() {
        for (ValueType type : ValueType.values()) {
            assertSame(type, ValueType.fromTag(type.getTag()));
        }
        assertNull(ValueType.fromTag(0));
        assertNull(ValueType.fromTag(65));
    }

    @Test
    void testFromValueIsCaseInsensitive() {
        assertEquals(ValueType.INTEGER, ValueType.fromValue("integer"));
        assertEquals(ValueType.CELLRANGE, ValueType.fromValue(" CellRange "));
        assertThrows(InvalidTypeException.class, () -> ValueType.fromValue("money"));
    }

    /**
     * Non-string values decide their own type, whatever the cell held before.
     */
    @Test
    void testInferenceIgnoresPriorTypeForNonStrings() {
        assertEquals(ValueType.BOOLEAN, ValueType.infer(CellValue.of(true), NEVER_ASKED));
        assertEquals(ValueType.INTEGER, ValueType.infer(CellValue.of(10L), NEVER_ASKED));
        assertEquals(ValueType.FLOAT, ValueType.infer(CellValue.of(10.0), NEVER_ASKED));
        assertEquals(ValueType.EMPTY, ValueType.infer(CellValue.empty(), NEVER_ASKED));
        assertEquals(ValueType.EMPTY, ValueType.infer(CellValue.of(""), NEVER_ASKED));
        assertEquals(ValueType.EMPTY, ValueType.infer(CellValue.of((String) null), NEVER_ASKED));
        assertEquals(ValueType.EXPR, ValueType.infer(CellValue.of("=max(A1:A5)"), NEVER_ASKED));
    }

    /**
     * A plain string becomes STRING over simple scalars and keeps any other prior type.
     */
    @Test
    void testPlainStringInferenceDependsOnPriorType() {
        EnumSet<ValueType> scalars = EnumSet.of(ValueType.EMPTY, ValueType.BOOLEAN, ValueType.INTEGER,
                ValueType.FLOAT, ValueType.ERROR);
        for (ValueType prior : ValueType.values()) {
            ValueType expected = scalars.contains(prior) ? ValueType.STRING : prior;
            assertEquals(expected, ValueType.infer(CellValue.of("asdf"), () -> prior), "prior " + prior);
        }
    }

    @Test
    void testDirectiveResolution() {
        CellValue value = CellValue.of(17L);
        assertEquals(ValueType.INTEGER, ValueTypeDirective.INFER.resolve(value, () -> ValueType.STRING));
        assertEquals(ValueType.STRING, ValueTypeDirective.KEEP.resolve(value, () -> ValueType.STRING));
        assertEquals(ValueType.ERROR,
                ValueTypeDirective.explicit(ValueType.ERROR).resolve(value, NEVER_ASKED));
    }

    @Test
    void testDirectiveParsing() {
        assertEquals(ValueTypeDirective.INFER, ValueTypeDirective.parse(null));
        assertEquals(ValueTypeDirective.INFER, ValueTypeDirective.parse("Infer"));
        assertEquals(ValueTypeDirective.KEEP, ValueTypeDirective.parse("keep"));
        assertEquals(ValueTypeDirective.explicit(ValueType.STRING), ValueTypeDirective.parse("string"));
        assertThrows(InvalidTypeException.class, () -> ValueTypeDirective.parse("sometimes"));
    }
}
