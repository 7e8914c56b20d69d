package org.patterncompare.ui.fx;

import java.util.Objects;

/**
 * Maps cell values to packed ARGB colours for the heatmaps.
 * Pure logic (no JavaFX types) so it can be tested without a running toolkit.
 *
 * - NaN cells are fully transparent.
 * - Values are clamped to [min, max]; a flat range (min == max) uses the palette midpoint.
 */
public final class ColorRamp {

    public static final int TRANSPARENT = 0x00000000;

    /** Piecewise-linear palettes, stops given as (position, r, g, b) in [0, 1]. */
    public enum Palette {
        SPECTRAL(new double[][]{
                {0.00, 0.0000, 0.0000, 0.0000},
                {0.05, 0.4667, 0.0000, 0.5333},
                {0.10, 0.5333, 0.0000, 0.6000},
                {0.15, 0.0000, 0.0000, 0.6667},
                {0.20, 0.0000, 0.0000, 0.8667},
                {0.25, 0.0000, 0.4667, 0.8667},
                {0.30, 0.0000, 0.6000, 0.8667},
                {0.35, 0.0000, 0.6667, 0.6667},
                {0.40, 0.0000, 0.6667, 0.5333},
                {0.45, 0.0000, 0.6000, 0.0000},
                {0.50, 0.0000, 0.7333, 0.0000},
                {0.55, 0.0000, 0.8667, 0.0000},
                {0.60, 0.0000, 1.0000, 0.0000},
                {0.65, 0.7333, 1.0000, 0.0000},
                {0.70, 0.9333, 0.9333, 0.0000},
                {0.75, 1.0000, 0.8000, 0.0000},
                {0.80, 1.0000, 0.6000, 0.0000},
                {0.85, 1.0000, 0.0000, 0.0000},
                {0.90, 0.8667, 0.0000, 0.0000},
                {0.95, 0.8000, 0.0000, 0.0000},
                {1.00, 0.8000, 0.8000, 0.8000}
        }),
        JET(new double[][]{
                {0.000, 0.0, 0.0, 0.5},
                {0.125, 0.0, 0.0, 1.0},
                {0.375, 0.0, 1.0, 1.0},
                {0.625, 1.0, 1.0, 0.0},
                {0.875, 1.0, 0.0, 0.0},
                {1.000, 0.5, 0.0, 0.0}
        });

        private final double[][] stops;

        Palette(double[][] stops) {
            this.stops = stops;
        }
    }

    private final Palette palette;

    public ColorRamp(Palette palette) {
        this.palette = Objects.requireNonNull(palette, "palette must not be null");
    }

    /**
     * @return packed 0xAARRGGBB colour of value within [min, max]
     */
    public int argb(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return TRANSPARENT;
        }
        return argbAt(normalize(value, min, max));
    }

    /**
     * Colour at a palette position t in [0, 1] (clamped).
     */
    public int argbAt(double t) {
        double[][] stops = palette.stops;
        double p = Math.max(0.0, Math.min(1.0, t));

        int hi = 1;
        while (hi < stops.length - 1 && stops[hi][0] < p) {
            hi++;
        }
        double[] a = stops[hi - 1];
        double[] b = stops[hi];
        double span = b[0] - a[0];
        double f = span <= 0 ? 0.0 : (p - a[0]) / span;

        int r = channel(a[1] + f * (b[1] - a[1]));
        int g = channel(a[2] + f * (b[2] - a[2]));
        int bl = channel(a[3] + f * (b[3] - a[3]));
        return 0xFF000000 | (r << 16) | (g << 8) | bl;
    }

    static double normalize(double value, double min, double max) {
        if (Double.isNaN(min) || Double.isNaN(max) || max <= min) {
            return 0.5;
        }
        double t = (value - min) / (max - min);
        return Math.max(0.0, Math.min(1.0, t));
    }

    private static int channel(double unit) {
        return (int) Math.round(Math.max(0.0, Math.min(1.0, unit)) * 255.0);
    }
}
