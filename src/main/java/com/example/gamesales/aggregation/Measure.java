package com.example.gamesales.aggregation;

/**
 * What the values of an {@link AggregationTable} represent.
 */
public enum Measure {
    /** Summed total sales, millions of units. */
    TOTAL_SALES,
    /** Number of records in the group; always a whole number despite the {@code double} storage. */
    RECORD_COUNT,
    /** Percentage of the table total, 0 to 100. */
    SHARE_PERCENT
}
