package com.example.gamesales.store;

import com.example.gamesales.model.GameSale;
import com.example.gamesales.model.YearRange;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Immutable, ordered set of {@link GameSale} records loaded from one source.
 *
 * <p>Alongside the records the store keeps the distinct values of each
 * filterable category and the observed year range; these seed the default
 * filter selection and the options offered to a user.
 *
 * <p><b>Thread Safety:</b> instances never change after construction and may
 * be shared freely between threads.
 */
public final class RecordStore {

    private final String source;
    private final List<GameSale> records;
    private final SortedSet<String> genres;
    private final SortedSet<String> platforms;
    private final SortedSet<String> publishers;
    private final YearRange years;

    private RecordStore(String source, List<GameSale> records) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.records = List.copyOf(records);
        this.genres = distinct(this.records, GameSale::genre);
        this.platforms = distinct(this.records, GameSale::platform);
        this.publishers = distinct(this.records, GameSale::publisher);
        this.years = observedYears(this.records);
    }

    /**
     * Creates a store over already normalized records, kept in the given order.
     *
     * @param source a label identifying where the records came from
     * @param records the records; copied
     */
    public static RecordStore of(String source, List<GameSale> records) {
        return new RecordStore(source, records);
    }

    public String source() {
        return source;
    }

    /**
     * Returns all records in load order. The list is unmodifiable.
     */
    public List<GameSale> records() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Distinct genres, sorted.
     */
    public SortedSet<String> genres() {
        return genres;
    }

    /**
     * Distinct platforms, sorted.
     */
    public SortedSet<String> platforms() {
        return platforms;
    }

    /**
     * Distinct publishers, sorted.
     */
    public SortedSet<String> publishers() {
        return publishers;
    }

    /**
     * Smallest and largest year present, or empty when the store has no records.
     */
    public Optional<YearRange> yearRange() {
        return Optional.ofNullable(years);
    }

    private static SortedSet<String> distinct(List<GameSale> records, Function<GameSale, String> column) {
        SortedSet<String> values = new TreeSet<>();
        for (GameSale sale : records) {
            values.add(column.apply(sale));
        }
        return Collections.unmodifiableSortedSet(values);
    }

    private static YearRange observedYears(List<GameSale> records) {
        YearRange range = null;
        for (GameSale sale : records) {
            range = range == null ? YearRange.of(sale.year(), sale.year()) : range.including(sale.year());
        }
        return range;
    }

    @Override
    public String toString() {
        return "RecordStore{source=" + source + ", records=" + records.size() + "}";
    }
}
