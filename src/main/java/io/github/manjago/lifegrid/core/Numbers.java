package io.github.manjago.lifegrid.core;

/**
 * Small numeric helpers shared by the energy, density and reproduction code.
 */
public final class Numbers {

    private Numbers() {
    }

    public static double clamp(double value, double min, double max) {
        if (value < min) return min;
        if (value > max) return max;
        return value;
    }

    public static double clamp01(double value) {
        return clamp(value, 0.0, 1.0);
    }

    public static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    public static double lerp(double a, double b, double t) {
        return a + (b - a) * t;
    }

    /**
     * Returns {@code value} when it is finite, otherwise {@code fallback}.
     * NaN and infinities coming from genomes or callers are treated as "unset".
     */
    public static double finiteOr(double value, double fallback) {
        return Double.isFinite(value) ? value : fallback;
    }
}
