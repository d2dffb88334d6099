package com.example.gamesales.summary;

import com.example.gamesales.aggregation.RankedEntry;
import com.example.gamesales.model.RegionalSales;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;
import java.util.Optional;

/**
 * Scalar summaries of a filtered view.
 *
 * <p>For an empty view every count and sum is zero and every leader is
 * {@link Optional#empty()}; see {@link #empty()}.
 *
 * @param recordCount number of records
 * @param totalSales summed total sales
 * @param distinctGenres genres present
 * @param distinctPlatforms platforms present
 * @param distinctPublishers publishers present
 * @param regionalSales sales per region
 * @param topGenre genre with the largest summed sales
 * @param topPlatform platform with the largest summed sales
 * @param topPublisher publisher with the largest summed sales
 */
public record KpiSet(
        long recordCount,
        double totalSales,
        int distinctGenres,
        int distinctPlatforms,
        int distinctPublishers,
        RegionalSales regionalSales,
        Optional<RankedEntry<String>> topGenre,
        Optional<RankedEntry<String>> topPlatform,
        Optional<RankedEntry<String>> topPublisher
) {
    public KpiSet {
        Objects.requireNonNull(regionalSales, "regionalSales must not be null");
        Objects.requireNonNull(topGenre, "topGenre must not be null");
        Objects.requireNonNull(topPlatform, "topPlatform must not be null");
        Objects.requireNonNull(topPublisher, "topPublisher must not be null");
    }

    /**
     * The summary of a view with no records.
     */
    public static KpiSet empty() {
        return new KpiSet(0, 0.0, 0, 0, 0, RegionalSales.zero(),
                Optional.empty(), Optional.empty(), Optional.empty());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return recordCount == 0;
    }
}
