package com.example.gamesales.aggregation;

/**
 * Sales and record count of one group, e.g. a platform's number of games
 * against what they sold.
 */
public record GroupPerformance<K extends Comparable<? super K>>(
        K key,
        double totalSales,
        long recordCount
) {
    /**
     * Average sales per record; 0.0 for an empty group.
     */
    public double averageSales() {
        return recordCount > 0 ? totalSales / recordCount : 0.0;
    }
}
