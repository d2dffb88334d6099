package com.example.gamesales.aggregation;

import java.util.function.BiConsumer;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * One-pass reduction of a filtered view into a result, shaped like a
 * {@link java.util.stream.Collector} but driven by a plain for-each loop.
 *
 * <p>Implementations keep per-group state in the accumulator, so memory grows
 * with the number of groups rather than the number of records. Partial
 * accumulators built over disjoint parts of a view can be merged with
 * {@link #combiner()}.
 *
 * @param <T> record type
 * @param <A> mutable accumulator
 * @param <R> result
 */
public interface Aggregator<T, A, R> {

    Supplier<A> supplier();

    BiConsumer<A, T> accumulator();

    BinaryOperator<A> combiner();

    Function<A, R> finisher();

    /**
     * Feeds every record of {@code records} to a fresh accumulator, in
     * iteration order, and finishes it.
     */
    default R aggregate(Iterable<? extends T> records) {
        A acc = supplier().get();
        BiConsumer<A, T> add = accumulator();
        for (T item : records) {
            add.accept(acc, item);
        }
        return finisher().apply(acc);
    }
}
