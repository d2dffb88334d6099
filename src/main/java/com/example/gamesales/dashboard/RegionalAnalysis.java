package com.example.gamesales.dashboard;

import com.example.gamesales.model.Region;
import com.example.gamesales.model.RegionalSales;

import java.util.Map;
import java.util.SortedMap;

/**
 * Comparison of the four sales regions for a selection.
 *
 * @param totals sales per region
 * @param shares each region's percentage of the regional total
 * @param byYear sales per region for each release year, years ascending
 */
public record RegionalAnalysis(
        RegionalSales totals,
        Map<Region, Double> shares,
        SortedMap<Integer, RegionalSales> byYear
) {
}
