package com.krishnamouli.cohort.engine;

import com.krishnamouli.cohort.experiment.Variant;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VariantSelectorTest {

    private static final List<Variant> THIRDS = List.of(
            new Variant("A", 30),
            new Variant("B", 30),
            new Variant("C", 40));

    @Test
    void testCumulativeBoundaries() {
        assertEquals("A", VariantSelector.select(THIRDS, 0).getId());
        assertEquals("A", VariantSelector.select(THIRDS, 29).getId());
        assertEquals("B", VariantSelector.select(THIRDS, 30).getId());
        assertEquals("B", VariantSelector.select(THIRDS, 59).getId());
        assertEquals("C", VariantSelector.select(THIRDS, 60).getId());
        assertEquals("C", VariantSelector.select(THIRDS, 99).getId());
    }

    @Test
    void testUnderAllocatedTailGoesToLastVariant() {
        List<Variant> variants = List.of(new Variant("A", 40), new Variant("B", 30));
        assertEquals("A", VariantSelector.select(variants, 39).getId());
        assertEquals("B", VariantSelector.select(variants, 69).getId());
        assertEquals("B", VariantSelector.select(variants, 85).getId());
    }

    @Test
    void testOverAllocatedTailUnreachable() {
        List<Variant> variants = List.of(new Variant("A", 60), new Variant("B", 60), new Variant("C", 10));
        for (int bucket = 0; bucket < 100; bucket++) {
            assertNotEquals("C", VariantSelector.select(variants, bucket).getId());
        }
    }

    @Test
    void testZeroAllocationVariantSkipped() {
        List<Variant> variants = List.of(new Variant("A", 0), new Variant("B", 100));
        assertEquals("B", VariantSelector.select(variants, 0).getId());
    }

    @Test
    void testEmptyListSelectsNothing() {
        assertNull(VariantSelector.select(Collections.emptyList(), 10));
    }
}
