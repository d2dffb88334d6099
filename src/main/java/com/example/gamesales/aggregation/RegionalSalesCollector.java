package com.example.gamesales.aggregation;

import com.example.gamesales.model.GameSale;
import com.example.gamesales.model.RegionalSales;

import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collector;

/**
 * A Collector that sums sales per region.
 *
 * <p>Only the five running totals are kept, whatever the size of the stream.
 *
 * <p>Example usage:
 * <pre>{@code
 * RegionalSales totals = view.stream().collect(RegionalSalesCollector.toRegionalSales());
 *
 * Map<Integer, RegionalSales> perYear = view.stream().collect(
 *     Collectors.groupingBy(GameSale::year, TreeMap::new, RegionalSalesCollector.toRegionalSales()));
 * }</pre>
 */
public class RegionalSalesCollector implements Collector<GameSale, RegionalSalesCollector.Accumulator, RegionalSales> {

    /**
     * Mutable running totals.
     */
    public static class Accumulator {
        private long count;
        private double northAmerica;
        private double europe;
        private double japan;
        private double other;

        public void accumulate(GameSale sale) {
            count++;
            northAmerica += sale.naSales();
            europe += sale.euSales();
            japan += sale.jpSales();
            other += sale.otherSales();
        }

        public Accumulator combine(Accumulator that) {
            this.count += that.count;
            this.northAmerica += that.northAmerica;
            this.europe += that.europe;
            this.japan += that.japan;
            this.other += that.other;
            return this;
        }

        public RegionalSales finish() {
            return new RegionalSales(count, northAmerica, europe, japan, other);
        }
    }

    public static RegionalSalesCollector toRegionalSales() {
        return new RegionalSalesCollector();
    }

    @Override
    public Supplier<Accumulator> supplier() {
        return Accumulator::new;
    }

    @Override
    public BiConsumer<Accumulator, GameSale> accumulator() {
        return Accumulator::accumulate;
    }

    @Override
    public BinaryOperator<Accumulator> combiner() {
        return Accumulator::combine;
    }

    @Override
    public Function<Accumulator, RegionalSales> finisher() {
        return Accumulator::finish;
    }

    @Override
    public Set<Characteristics> characteristics() {
        // Sums are insensitive to encounter order
        return Set.of(Characteristics.UNORDERED);
    }
}
