package com.example.gamesales.dashboard;

import com.example.gamesales.aggregation.CrossTab;
import com.example.gamesales.aggregation.GroupPerformance;
import com.example.gamesales.aggregation.RankedEntry;

import java.util.List;
import java.util.Optional;

/**
 * Publisher and platform view of a selection.
 *
 * @param topPublisher best-selling publisher, empty when nothing matched
 * @param topPlatform best-selling platform, empty when nothing matched
 * @param distinctPublishers publishers present
 * @param topPublishers publishers ranked by summed sales
 * @param platformPerformance sales, game count and average per platform
 * @param publisherByPlatform sales of the top publishers on the top platforms
 */
public record MarketAnalysis(
        Optional<RankedEntry<String>> topPublisher,
        Optional<RankedEntry<String>> topPlatform,
        int distinctPublishers,
        List<RankedEntry<String>> topPublishers,
        List<GroupPerformance<String>> platformPerformance,
        CrossTab<String, String> publisherByPlatform
) {
}
