package com.example.gamesales.summary;

import com.example.gamesales.aggregation.AggregationEngine;
import com.example.gamesales.aggregation.Dimension;
import com.example.gamesales.aggregation.RankedEntry;
import com.example.gamesales.model.GameSale;

import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Computes {@link KpiSet}s over filtered views.
 *
 * <p>An empty view is a normal outcome of narrowing filters and yields
 * {@link KpiSet#empty()} rather than an error. The same holds for
 * {@link #largestGroup}, which returns {@link Optional#empty()}.
 */
public class SummaryCalculator {

    private final AggregationEngine aggregations;

    public SummaryCalculator() {
        this(new AggregationEngine());
    }

    public SummaryCalculator(AggregationEngine aggregations) {
        this.aggregations = Objects.requireNonNull(aggregations, "aggregations must not be null");
    }

    public KpiSet summarize(Iterable<GameSale> records) {
        long count = 0;
        double totalSales = 0.0;
        Set<String> genres = new HashSet<>();
        Set<String> platforms = new HashSet<>();
        Set<String> publishers = new HashSet<>();
        for (GameSale sale : records) {
            count++;
            totalSales += sale.totalSales();
            genres.add(sale.genre());
            platforms.add(sale.platform());
            publishers.add(sale.publisher());
        }
        if (count == 0) {
            return KpiSet.empty();
        }
        return new KpiSet(
                count,
                totalSales,
                genres.size(),
                platforms.size(),
                publishers.size(),
                aggregations.regionalTotals(records),
                largestGroup(records, Dimension.GENRE),
                largestGroup(records, Dimension.PLATFORM),
                largestGroup(records, Dimension.PUBLISHER));
    }

    /**
     * The group with the largest summed sales under a dimension, ties going to
     * the smallest key. Empty when there are no records.
     */
    public <K extends Comparable<? super K>> Optional<RankedEntry<K>> largestGroup(
            Iterable<GameSale> records, Dimension<K> dimension) {
        return aggregations.largest(aggregations.sumBy(records, dimension));
    }
}
