package org.patterncompare.ui.fx;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ColorRampTest {

    private final ColorRamp jet = new ColorRamp(ColorRamp.Palette.JET);
    private final ColorRamp spectral = new ColorRamp(ColorRamp.Palette.SPECTRAL);

    @Test
    void nanCell_isTransparent() {
        assertEquals(ColorRamp.TRANSPARENT, jet.argb(Double.NaN, 0, 1));
        assertEquals(ColorRamp.TRANSPARENT, spectral.argb(Double.NaN, -40, 0));
    }

    @Test
    void endpointsAndMidpoint() {
        assertEquals(0xFF000080, jet.argb(0, 0, 10));
        assertEquals(0xFF800000, jet.argb(10, 0, 10));
        assertEquals(0xFF80FF80, jet.argb(5, 0, 10));

        assertEquals(0xFF000000, spectral.argbAt(0.0));
        assertEquals(0xFFCCCCCC, spectral.argbAt(1.0));
    }

    @Test
    void outOfRangeValues_areClamped() {
        assertEquals(jet.argb(0, 0, 10), jet.argb(-5, 0, 10));
        assertEquals(jet.argb(10, 0, 10), jet.argb(99, 0, 10));
        assertEquals(jet.argbAt(1.0), jet.argbAt(3.0));
    }

    @Test
    void flatOrUndefinedRange_usesMidpoint() {
        assertEquals(0.5, ColorRamp.normalize(3, 3, 3));
        assertEquals(0.5, ColorRamp.normalize(3, Double.NaN, Double.NaN));
        assertEquals(0xFF80FF80, jet.argb(7, 7, 7));
        assertEquals(0.25, ColorRamp.normalize(-30, -40, 0), 1e-12);
    }

    @Test
    void everyColourIsOpaque() {
        for (int i = 0; i <= 100; i++) {
            assertEquals(0xFF, spectral.argbAt(i / 100.0) >>> 24);
        }
    }
}
