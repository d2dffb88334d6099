package com.example.gamesales.aggregation;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Group key to aggregate value, keys in ascending order.
 *
 * <p>Only groups that had at least one record appear; there are no zero-filled
 * entries.
 *
 * @param dimension name of the grouping column
 * @param measure what the values represent
 * @param values aggregate per key; copied into an unmodifiable sorted map
 */
public record AggregationTable<K extends Comparable<? super K>>(
        String dimension,
        Measure measure,
        SortedMap<K, Double> values
) {
    public AggregationTable {
        Objects.requireNonNull(dimension, "dimension must not be null");
        Objects.requireNonNull(measure, "measure must not be null");
        values = Collections.unmodifiableSortedMap(new TreeMap<>(values));
    }

    public static <K extends Comparable<? super K>> AggregationTable<K> of(
            String dimension, Measure measure, Map<K, Double> values) {
        return new AggregationTable<>(dimension, measure, new TreeMap<>(values));
    }

    public OptionalDouble value(K key) {
        Double value = values.get(key);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public boolean contains(K key) {
        return values.containsKey(key);
    }

    public int size() {
        return values.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Sum of all values, added in key order.
     */
    public double total() {
        double total = 0.0;
        for (double value : values.values()) {
            total += value;
        }
        return total;
    }

    /**
     * Entries ranked by value descending, ties by key ascending.
     */
    public List<RankedEntry<K>> ranked() {
        return values.entrySet().stream()
                .map(entry -> new RankedEntry<>(entry.getKey(), entry.getValue()))
                .sorted(RankedEntry.ranking())
                .toList();
    }
}
