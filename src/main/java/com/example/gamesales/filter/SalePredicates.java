package com.example.gamesales.filter;

import com.example.gamesales.model.GameSale;
import com.example.gamesales.model.YearRange;

import java.util.Set;
import java.util.function.Predicate;

/**
 * Record predicates for each filter dimension.
 *
 * <p>Membership tests are exact and case-sensitive; values were normalized
 * when the store was loaded.
 */
public final class SalePredicates {

    private SalePredicates() {
    }

    public static Predicate<GameSale> genreIn(Set<String> genres) {
        return sale -> genres.contains(sale.genre());
    }

    public static Predicate<GameSale> platformIn(Set<String> platforms) {
        return sale -> platforms.contains(sale.platform());
    }

    public static Predicate<GameSale> publisherIn(Set<String> publishers) {
        return sale -> publishers.contains(sale.publisher());
    }

    public static Predicate<GameSale> yearWithin(YearRange years) {
        return sale -> years.contains(sale.year());
    }

    /**
     * Combines every active dimension of a selection with logical AND.
     */
    public static Predicate<GameSale> matching(FilterSelection selection) {
        Predicate<GameSale> predicate = genreIn(selection.genres())
                .and(platformIn(selection.platforms()))
                .and(yearWithin(selection.years()));
        if (selection.filtersPublishers()) {
            predicate = predicate.and(publisherIn(selection.publishers()));
        }
        return predicate;
    }
}
