package com.configline.backend.override;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SegmentationTest {

    @Test
    void fnv1a32_matchesReferenceVectors() {
        assertEquals(0x811c9dc5L, Segmentation.fnv1a32(""));
        assertEquals(0xe40c292cL, Segmentation.fnv1a32("a"));
        assertEquals(0xbf9cf968L, Segmentation.fnv1a32("foobar"));
    }

    @Test
    void unit_isWithinHalfOpenRange() {
        for (int i = 0; i < 200; i++) {
            double u = Segmentation.unit("user-" + i, "seed");
            assertTrue(u >= 0.0 && u < 1.0);
        }
    }

    @Test
    void inRange_isLowerInclusiveUpperExclusive() {
        assertTrue(Segmentation.inRange(0.25, 25, 50));
        assertFalse(Segmentation.inRange(0.5, 25, 50));
        assertFalse(Segmentation.inRange(0.0, 0, 0));
    }
}
