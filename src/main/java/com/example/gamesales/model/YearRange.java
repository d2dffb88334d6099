package com.example.gamesales.model;

/**
 * Inclusive range of release years.
 */
public record YearRange(int min, int max) {

    public YearRange {
        if (min > max) {
            throw new IllegalArgumentException(
                    "year range is inverted: min=" + min + " max=" + max);
        }
    }

    public static YearRange of(int min, int max) {
        return new YearRange(min, max);
    }

    public boolean contains(int year) {
        return min <= year && year <= max;
    }

    /**
     * Returns the smallest range covering both this range and the given year.
     */
    public YearRange including(int year) {
        return new YearRange(Math.min(min, year), Math.max(max, year));
    }
}
