package com.photocheck.sdk.quality;

/**
 * Normalized margins in [0,1]. 1 means the threshold is met.
 */
final class Scores {

    private Scores() {}

    /** Lower bound: min(1, measured / threshold). */
    static double atLeast(double measured, double threshold) {
        if (threshold <= 0) return 1d;
        return clamp(measured / threshold);
    }

    /** Upper bound: min(1, threshold / measured). */
    static double atMost(double measured, double threshold) {
        if (measured <= threshold) return 1d;
        if (threshold <= 0) return 0d;
        return clamp(threshold / measured);
    }

    /** 1 inside [min, max], proportionally less outside. */
    static double band(double measured, double min, double max) {
        if (Double.isNaN(measured)) return 0d;
        if (measured < min) return atLeast(measured, min);
        if (measured > max) return atMost(measured, max);
        return 1d;
    }

    static double clamp(double v) {
        if (Double.isNaN(v) || v < 0) return 0d;
        return v > 1 ? 1d : v;
    }
}
