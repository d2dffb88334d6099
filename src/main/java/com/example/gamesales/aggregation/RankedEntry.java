package com.example.gamesales.aggregation;

import java.util.Comparator;

/**
 * One (key, value) pair of a ranking.
 */
public record RankedEntry<K extends Comparable<? super K>>(K key, double value) {

    /**
     * Value descending, then key ascending. The key order makes rankings
     * deterministic when values tie.
     */
    public static <K extends Comparable<? super K>> Comparator<RankedEntry<K>> ranking() {
        Comparator<RankedEntry<K>> byValueDescending = (a, b) -> Double.compare(b.value(), a.value());
        return byValueDescending.thenComparing(RankedEntry::key);
    }
}
