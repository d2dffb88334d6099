package com.example.gamesales.filter;

import com.example.gamesales.model.GameSale;
import com.example.gamesales.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Builds {@link FilteredView}s from a {@link RecordStore} and a {@link FilterSelection}.
 *
 * <p>The engine is stateless: the same store and selection always give the
 * same view, and the store is only read.
 *
 * <p>Example usage:
 * <pre>{@code
 * FilterSelection selection = FilterSelection.defaults(store)
 *     .withGenres(Set.of("Action"))
 *     .withYears(2010, 2020);
 * FilteredView view = new FilterEngine().apply(store, selection);
 * }</pre>
 */
public class FilterEngine {

    private static final Logger log = LoggerFactory.getLogger(FilterEngine.class);

    /**
     * Returns the records of the store that satisfy every active constraint.
     *
     * @param store the records to filter
     * @param selection the constraints
     * @return the matching records, in store order
     */
    public FilteredView apply(RecordStore store, FilterSelection selection) {
        Objects.requireNonNull(store, "store must not be null");
        Objects.requireNonNull(selection, "selection must not be null");
        List<GameSale> matched = select(store.records(), SalePredicates.matching(selection));
        log.debug("Filter on {} kept {} of {} records", store.source(), matched.size(), store.size());
        return new FilteredView(matched, selection);
    }

    /**
     * Narrows an existing view by one more predicate. The selection recorded
     * on the result is the one of the input view.
     */
    public FilteredView narrow(FilteredView view, Predicate<GameSale> predicate) {
        return new FilteredView(select(view.records(), predicate), view.selection());
    }

    private static List<GameSale> select(List<GameSale> source, Predicate<GameSale> predicate) {
        List<GameSale> matched = new ArrayList<>();
        for (GameSale sale : source) {
            if (predicate.test(sale)) {
                matched.add(sale);
            }
        }
        return matched;
    }
}
