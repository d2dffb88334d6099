package com.example.gamesales.filter;

import com.example.gamesales.model.YearRange;
import com.example.gamesales.store.RecordStore;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The constraints a user has chosen, combined with logical AND.
 *
 * <p>Genre and platform are always filtered. Publisher is only filtered when
 * the field is present; an absent publisher filter means "do not filter on
 * publisher", while a present but empty set matches nothing. The same holds
 * for an empty genre or platform set.
 *
 * @param genres genres to keep
 * @param platforms platforms to keep
 * @param publishers publishers to keep, or {@code null} when the dimension is not filtered
 * @param years inclusive release-year bounds
 */
public record FilterSelection(
        Set<String> genres,
        Set<String> platforms,
        Set<String> publishers,
        YearRange years
) {
    public FilterSelection {
        genres = Set.copyOf(Objects.requireNonNull(genres, "genres must not be null"));
        platforms = Set.copyOf(Objects.requireNonNull(platforms, "platforms must not be null"));
        publishers = publishers == null ? null : Set.copyOf(publishers);
        Objects.requireNonNull(years, "years must not be null");
    }

    /**
     * Everything in the store selected, publisher not filtered.
     */
    public static FilterSelection defaults(RecordStore store) {
        return new FilterSelection(store.genres(), store.platforms(), null, defaultYears(store));
    }

    /**
     * Everything in the store selected, publisher filter active with every publisher.
     */
    public static FilterSelection defaultsWithPublishers(RecordStore store) {
        return new FilterSelection(store.genres(), store.platforms(), store.publishers(), defaultYears(store));
    }

    private static YearRange defaultYears(RecordStore store) {
        return store.yearRange().orElse(YearRange.of(Integer.MIN_VALUE, Integer.MAX_VALUE));
    }

    /**
     * Publisher filter, empty when the dimension is not filtered.
     */
    public Optional<Set<String>> publisherFilter() {
        return Optional.ofNullable(publishers);
    }

    public boolean filtersPublishers() {
        return publishers != null;
    }

    public FilterSelection withGenres(Collection<String> genres) {
        return new FilterSelection(Set.copyOf(genres), platforms, publishers, years);
    }

    public FilterSelection withPlatforms(Collection<String> platforms) {
        return new FilterSelection(genres, Set.copyOf(platforms), publishers, years);
    }

    public FilterSelection withPublishers(Collection<String> publishers) {
        return new FilterSelection(genres, platforms, Set.copyOf(publishers), years);
    }

    public FilterSelection withoutPublisherFilter() {
        return new FilterSelection(genres, platforms, null, years);
    }

    public FilterSelection withYears(int min, int max) {
        return new FilterSelection(genres, platforms, publishers, YearRange.of(min, max));
    }
}
