package com.catalog.matching.rules;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DimensionSpecTest {

    @Test
    void extractsThreadAndLength() {
        DimensionSpec spec = DimensionSpec.extract("grade 8 hex head cap screw 5/16-18x2-1/2");

        assertEquals("5/16-18", spec.thread());
        assertEquals("x2-1", spec.length());
    }

    @Test
    void lengthToleratesSpacing() {
        DimensionSpec spec = DimensionSpec.extract("carriage bolt 1/4-20 X 3");

        assertEquals("1/4-20", spec.thread());
        assertEquals("x3", spec.length());
    }

    @Test
    void absentDimensions() {
        DimensionSpec spec = DimensionSpec.extract("safety goggles");

        assertTrue(spec.threadSpec().isEmpty());
        assertTrue(spec.lengthSpec().isEmpty());
        assertFalse(spec.sameThread(DimensionSpec.extract("safety goggles")));
    }

    @Test
    void blankInput() {
        assertEquals(new DimensionSpec(null, null), DimensionSpec.extract(null));
        assertEquals(new DimensionSpec(null, null), DimensionSpec.extract(" "));
    }

    @Test
    void comparesSpecs() {
        DimensionSpec a = DimensionSpec.extract("5/16-18x2");
        DimensionSpec b = DimensionSpec.extract("hex bolt 5/16-18 x2");
        DimensionSpec c = DimensionSpec.extract("hex bolt 3/8-16 x2");

        assertTrue(a.sameThread(b));
        assertTrue(a.sameLength(b));
        assertFalse(a.sameThread(c));
        assertTrue(a.sameLength(c));
    }
}
