package com.example.gamesales.aggregation;

import com.example.gamesales.model.GameSale;
import com.example.gamesales.model.RegionalSales;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Grouped sums and counts, rankings and ratios over a filtered set of records.
 *
 * <p>Every method is a pure function of its arguments and returns freshly
 * allocated, unmodifiable results. Sums are plain double accumulation in record
 * order; no rounding happens here.
 *
 * <p>Example usage:
 * <pre>{@code
 * AggregationEngine engine = new AggregationEngine();
 * AggregationTable<String> byPlatform = engine.sumBy(view, Dimension.PLATFORM);
 * List<RankedEntry<String>> top10 = engine.topN(byPlatform, 10);
 * CrossTab<String, String> heatmap =
 *     engine.crossTabulate(view, Dimension.PUBLISHER, Dimension.PLATFORM, 10, 10);
 * }</pre>
 */
public class AggregationEngine {

    /**
     * Sums total sales per group. Groups without records are absent.
     */
    public <K extends Comparable<? super K>> AggregationTable<K> sumBy(
            Iterable<GameSale> records, Dimension<K> dimension) {
        Map<K, Double> sums = new HashMap<>();
        for (GroupPerformance<K> group : performanceBy(records, dimension)) {
            sums.put(group.key(), group.totalSales());
        }
        return AggregationTable.of(dimension.name(), Measure.TOTAL_SALES, sums);
    }

    /**
     * Counts records per group. Groups without records are absent.
     */
    public <K extends Comparable<? super K>> AggregationTable<K> countBy(
            Iterable<GameSale> records, Dimension<K> dimension) {
        Map<K, Double> counts = new HashMap<>();
        for (GroupPerformance<K> group : performanceBy(records, dimension)) {
            counts.put(group.key(), (double) group.recordCount());
        }
        return AggregationTable.of(dimension.name(), Measure.RECORD_COUNT, counts);
    }

    /**
     * Sales, record count and average per group, keys ascending.
     */
    public <K extends Comparable<? super K>> List<GroupPerformance<K>> performanceBy(
            Iterable<GameSale> records, Dimension<K> dimension) {
        return GroupedSalesAggregator.by(dimension).aggregate(records);
    }

    /**
     * The {@code n} entries with the largest values, value descending.
     * Equal values are ordered by ascending key, so the result is the same on
     * every call. The result has {@code min(n, table.size())} entries.
     *
     * @throws IllegalArgumentException if {@code n} is negative
     */
    public <K extends Comparable<? super K>> List<RankedEntry<K>> topN(AggregationTable<K> table, int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must not be negative: " + n);
        }
        List<RankedEntry<K>> ranked = table.ranked();
        return ranked.size() <= n ? ranked : List.copyOf(ranked.subList(0, n));
    }

    /**
     * The single largest entry of a table, or empty for an empty table.
     * Ties go to the smallest key.
     */
    public <K extends Comparable<? super K>> Optional<RankedEntry<K>> largest(AggregationTable<K> table) {
        return topN(table, 1).stream().findFirst();
    }

    /**
     * Dense matrix of summed sales over the top keys of two dimensions.
     *
     * <p>The top {@code topRows} keys of {@code rowDimension} and the top
     * {@code topColumns} keys of {@code columnDimension} are each ranked on their
     * own sums over all given records. Only records in both key sets contribute;
     * pairs without records are filled with 0.0.
     *
     * @throws IllegalArgumentException if a top size is negative
     */
    public <R extends Comparable<? super R>, C extends Comparable<? super C>> CrossTab<R, C> crossTabulate(
            Iterable<GameSale> records,
            Dimension<R> rowDimension,
            Dimension<C> columnDimension,
            int topRows,
            int topColumns) {
        List<R> rows = sortedKeys(topN(sumBy(records, rowDimension), topRows));
        List<C> columns = sortedKeys(topN(sumBy(records, columnDimension), topColumns));

        Map<R, Map<C, Double>> cells = new LinkedHashMap<>();
        for (R row : rows) {
            Map<C, Double> line = new LinkedHashMap<>();
            for (C column : columns) {
                line.put(column, 0.0);
            }
            cells.put(row, line);
        }
        for (GameSale sale : records) {
            Map<C, Double> line = cells.get(rowDimension.keyOf(sale));
            if (line == null) {
                continue;
            }
            C column = columnDimension.keyOf(sale);
            Double current = line.get(column);
            if (current != null) {
                line.put(column, current + sale.totalSales());
            }
        }
        return new CrossTab<>(rowDimension.name(), columnDimension.name(), rows, columns, cells);
    }

    /**
     * Converts a table into percentages of its total. An empty table stays
     * empty; when the total is zero every share is 0.0.
     */
    public <K extends Comparable<? super K>> AggregationTable<K> shares(AggregationTable<K> table) {
        double total = table.total();
        Map<K, Double> shares = new HashMap<>();
        table.values().forEach((key, value) -> shares.put(key, total != 0.0 ? value / total * 100.0 : 0.0));
        return AggregationTable.of(table.dimension(), Measure.SHARE_PERCENT, shares);
    }

    /**
     * Sales per region over all records.
     */
    public RegionalSales regionalTotals(Iterable<GameSale> records) {
        return StreamSupport.stream(records.spliterator(), false)
                .collect(RegionalSalesCollector.toRegionalSales());
    }

    /**
     * Sales per region for each group, keys ascending; e.g. per year for the
     * evolution of each market over time.
     */
    public <K extends Comparable<? super K>> SortedMap<K, RegionalSales> regionalBreakdownBy(
            Iterable<GameSale> records, Dimension<K> dimension) {
        TreeMap<K, RegionalSales> breakdown = StreamSupport.stream(records.spliterator(), false)
                .collect(Collectors.groupingBy(dimension.key(), TreeMap::new, RegionalSalesCollector.toRegionalSales()));
        return Collections.unmodifiableSortedMap(breakdown);
    }

    private static <K extends Comparable<? super K>> List<K> sortedKeys(List<RankedEntry<K>> entries) {
        List<K> keys = new ArrayList<>(entries.size());
        for (RankedEntry<K> entry : entries) {
            keys.add(entry.key());
        }
        Collections.sort(keys);
        return keys;
    }
}
