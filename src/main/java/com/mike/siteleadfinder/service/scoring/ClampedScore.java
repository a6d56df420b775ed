package com.mike.siteleadfinder.service.scoring;

/**
 * A score forced into its range; {@code clamped} records whether the raw value was outside.
 */
public record ClampedScore(int value, boolean clamped) {

    public static ClampedScore clamp(int raw, int min, int max) {
        if (raw < min) return new ClampedScore(min, true);
        if (raw > max) return new ClampedScore(max, true);
        return new ClampedScore(raw, false);
    }
}
