package com.example.gamesales.aggregation;

import com.example.gamesales.model.GameSale;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.BiConsumer;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Aggregates records into per-group record counts and sales sums in one pass.
 *
 * <p>Memory grows with the number of distinct keys, not with the number of
 * records: each group holds a count and a running sum.
 *
 * <p>Example usage:
 * <pre>{@code
 * List<GroupPerformance<String>> byPlatform =
 *     GroupedSalesAggregator.by(Dimension.PLATFORM).aggregate(view);
 * }</pre>
 *
 * @param <K> group key type
 */
public class GroupedSalesAggregator<K extends Comparable<? super K>>
        implements Aggregator<GameSale, GroupedSalesAggregator.Accumulator<K>, List<GroupPerformance<K>>> {

    private final Dimension<K> dimension;

    public GroupedSalesAggregator(Dimension<K> dimension) {
        this.dimension = Objects.requireNonNull(dimension, "dimension must not be null");
    }

    public static <K extends Comparable<? super K>> GroupedSalesAggregator<K> by(Dimension<K> dimension) {
        return new GroupedSalesAggregator<>(dimension);
    }

    public Dimension<K> dimension() {
        return dimension;
    }

    /**
     * Running count and sum of one group.
     */
    static final class GroupTotals {
        private long count;
        private double sum;

        void add(double sales) {
            count++;
            sum += sales;
        }

        void merge(GroupTotals other) {
            count += other.count;
            sum += other.sum;
        }
    }

    /**
     * Mutable per-key totals.
     */
    public static class Accumulator<K extends Comparable<? super K>> {
        private final Dimension<K> dimension;
        private final Map<K, GroupTotals> groups = new HashMap<>();

        Accumulator(Dimension<K> dimension) {
            this.dimension = dimension;
        }

        public void accumulate(GameSale sale) {
            groups.computeIfAbsent(dimension.keyOf(sale), key -> new GroupTotals()).add(sale.totalSales());
        }

        public Accumulator<K> combine(Accumulator<K> other) {
            other.groups.forEach((key, totals) -> groups.computeIfAbsent(key, k -> new GroupTotals()).merge(totals));
            return this;
        }

        /**
         * One entry per group that received at least one record, keys ascending.
         */
        public List<GroupPerformance<K>> finish() {
            List<GroupPerformance<K>> result = new ArrayList<>(groups.size());
            new TreeMap<>(groups).forEach((key, totals) ->
                    result.add(new GroupPerformance<>(key, totals.sum, totals.count)));
            return List.copyOf(result);
        }
    }

    @Override
    public Supplier<Accumulator<K>> supplier() {
        return () -> new Accumulator<>(dimension);
    }

    @Override
    public BiConsumer<Accumulator<K>, GameSale> accumulator() {
        return Accumulator::accumulate;
    }

    @Override
    public BinaryOperator<Accumulator<K>> combiner() {
        return Accumulator::combine;
    }

    @Override
    public Function<Accumulator<K>, List<GroupPerformance<K>>> finisher() {
        return Accumulator::finish;
    }
}
