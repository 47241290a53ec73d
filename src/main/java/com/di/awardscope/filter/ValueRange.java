package com.di.awardscope.filter;

/**
 * Closed range of contract amounts. {@link #ALL} ({@code [0, MAX]}) is the inactive default; any
 * other range is active and can only be evaluated against individual facts.
 */
public record ValueRange(double min, double max) {

    public static final ValueRange ALL = new ValueRange(0.0, Double.MAX_VALUE);

    public ValueRange {
        if (!(min >= 0) || !(max >= 0) || Double.isInfinite(min) || Double.isInfinite(max)) {
            throw new IllegalArgumentException("value range bounds must be finite and non-negative: [" + min + ", " + max + "]");
        }
        if (min > max) {
            throw new IllegalArgumentException("value range min " + min + " exceeds max " + max);
        }
    }

    public boolean isActive() {
        return min > 0.0 || max < Double.MAX_VALUE;
    }

    public boolean contains(double amount) {
        return amount >= min && amount <= max;
    }

    @Override
    public String toString() {
        return "[" + min + ", " + (max == Double.MAX_VALUE ? "MAX" : String.valueOf(max)) + "]";
    }
}
