package com.example.brsr.service;

import java.util.Locale;

/**
 * Maps a raw indicator value onto a 0-100 scale before pillar weighting.
 * <ul>
 *   <li>{@code %}: the value itself</li>
 *   <li>intensity ({@code per}, {@code /}, {@code Intensity}): {@code 100 / (1 + v)}, lower is better</li>
 *   <li>{@code count}: {@code 100 - v}, lower is better</li>
 *   <li>{@code days}: {@code 100 - v / 90 * 100}, lower is better</li>
 *   <li>absolute quantities: neutral 50 until sector benchmarks exist</li>
 * </ul>
 * The result is always clamped to [0, 100].
 */
public final class IndicatorNormalizer {

    static final double NEUTRAL = 50.0;
    static final double COUNT_CEILING = 100.0;
    static final double DAYS_BASELINE = 90.0;

    private IndicatorNormalizer() {
    }

    public static double normalize(double value, String unit) {
        String u = unit == null ? "" : unit.trim().toLowerCase(Locale.ROOT);
        double normalized;
        if (u.equals("%")) {
            normalized = value;
        } else if (u.contains("per") || u.contains("/") || u.contains("intensity")) {
            normalized = 100.0 / (1.0 + value);
        } else if (u.equals("count")) {
            normalized = 100.0 - (value / COUNT_CEILING) * 100.0;
        } else if (u.equals("days")) {
            normalized = 100.0 - (value / DAYS_BASELINE) * 100.0;
        } else {
            normalized = NEUTRAL;
        }
        if (Double.isNaN(normalized)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, normalized));
    }
}
