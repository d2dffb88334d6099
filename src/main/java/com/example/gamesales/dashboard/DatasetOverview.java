package com.example.gamesales.dashboard;

import com.example.gamesales.model.YearRange;

import java.util.Optional;

/**
 * Headline figures of the whole, unfiltered dataset.
 */
public record DatasetOverview(
        long recordCount,
        double totalSales,
        int distinctGenres,
        int distinctPlatforms,
        int distinctPublishers,
        Optional<YearRange> years
) {
}
