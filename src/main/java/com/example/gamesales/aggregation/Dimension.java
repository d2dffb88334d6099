package com.example.gamesales.aggregation;

import com.example.gamesales.model.GameSale;

import java.util.Objects;
import java.util.function.Function;

/**
 * A column records can be grouped by.
 *
 * @param name column name, as in the source file
 * @param key extracts the group key from a record
 * @param <K> key type; its natural order breaks ranking ties
 */
public record Dimension<K extends Comparable<? super K>>(String name, Function<GameSale, K> key) {

    public static final Dimension<String> GENRE = new Dimension<>("Genre", GameSale::genre);
    public static final Dimension<String> PLATFORM = new Dimension<>("Platform", GameSale::platform);
    public static final Dimension<String> PUBLISHER = new Dimension<>("Publisher", GameSale::publisher);
    public static final Dimension<Integer> YEAR = new Dimension<>("Year", GameSale::year);

    public Dimension {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(key, "key must not be null");
    }

    public K keyOf(GameSale sale) {
        return key.apply(sale);
    }

    @Override
    public String toString() {
        return name;
    }
}
