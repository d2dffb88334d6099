package com.example.gamesales.dashboard;

import com.example.gamesales.aggregation.AggregationTable;
import com.example.gamesales.aggregation.RankedEntry;
import com.example.gamesales.summary.KpiSet;

import java.util.List;

/**
 * First look at a selection: how much sold, when, and in which genres and platforms.
 *
 * @param kpis summary of the filtered view
 * @param salesByYear summed sales per release year, years ascending
 * @param salesByGenre every genre ranked by summed sales
 * @param topGenres best-selling genres
 * @param topPlatforms best-selling platforms
 */
public record InitialAnalysis(
        KpiSet kpis,
        AggregationTable<Integer> salesByYear,
        List<RankedEntry<String>> salesByGenre,
        List<RankedEntry<String>> topGenres,
        List<RankedEntry<String>> topPlatforms
) {
}
