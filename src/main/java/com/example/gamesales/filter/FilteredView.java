package com.example.gamesales.filter;

import com.example.gamesales.model.GameSale;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * The records that satisfied a {@link FilterSelection}, in store order.
 *
 * <p>Views are freshly built for each request and never modified, so they can
 * be handed to any number of aggregations.
 */
public record FilteredView(List<GameSale> records, FilterSelection selection) implements Iterable<GameSale> {

    public FilteredView {
        records = List.copyOf(records);
        Objects.requireNonNull(selection, "selection must not be null");
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public Stream<GameSale> stream() {
        return records.stream();
    }

    @Override
    public Iterator<GameSale> iterator() {
        return records.iterator();
    }
}
