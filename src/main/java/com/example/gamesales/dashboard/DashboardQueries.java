package com.example.gamesales.dashboard;

import com.example.gamesales.aggregation.AggregationEngine;
import com.example.gamesales.aggregation.AggregationTable;
import com.example.gamesales.aggregation.Dimension;
import com.example.gamesales.config.DashboardSettings;
import com.example.gamesales.filter.FilterEngine;
import com.example.gamesales.filter.FilterSelection;
import com.example.gamesales.filter.FilteredView;
import com.example.gamesales.model.RegionalSales;
import com.example.gamesales.store.RecordStore;
import com.example.gamesales.summary.KpiSet;
import com.example.gamesales.summary.SummaryCalculator;

import java.util.Objects;

/**
 * Entry point for presentation code: one method per dashboard page.
 *
 * <p>Each call filters the shared store with the given selection and returns
 * an immutable snapshot holding everything the page renders. Nothing is kept
 * between calls, so one instance can serve any number of concurrent viewers.
 *
 * <p>Example usage:
 * <pre>{@code
 * DashboardQueries queries = new DashboardQueries(store);
 * FilterSelection selection = FilterSelection.defaults(store).withYears(2000, 2010);
 * InitialAnalysis page = queries.initialAnalysis(selection);
 * }</pre>
 */
public class DashboardQueries {

    private final RecordStore store;
    private final DashboardSettings settings;
    private final FilterEngine filters;
    private final AggregationEngine aggregations;
    private final SummaryCalculator summaries;

    public DashboardQueries(RecordStore store) {
        this(store, DashboardSettings.DEFAULTS);
    }

    public DashboardQueries(RecordStore store, DashboardSettings settings) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.filters = new FilterEngine();
        this.aggregations = new AggregationEngine();
        this.summaries = new SummaryCalculator(aggregations);
    }

    public RecordStore store() {
        return store;
    }

    /**
     * Filtered records for a selection.
     */
    public FilteredView view(FilterSelection selection) {
        return filters.apply(store, selection);
    }

    /**
     * Headline figures of the unfiltered dataset.
     */
    public DatasetOverview overview() {
        KpiSet kpis = summaries.summarize(store.records());
        return new DatasetOverview(
                kpis.recordCount(),
                kpis.totalSales(),
                kpis.distinctGenres(),
                kpis.distinctPlatforms(),
                kpis.distinctPublishers(),
                store.yearRange());
    }

    public InitialAnalysis initialAnalysis(FilterSelection selection) {
        FilteredView view = view(selection);
        AggregationTable<String> byGenre = aggregations.sumBy(view, Dimension.GENRE);
        return new InitialAnalysis(
                summaries.summarize(view),
                aggregations.sumBy(view, Dimension.YEAR),
                byGenre.ranked(),
                aggregations.topN(byGenre, settings.topGenres()),
                aggregations.topN(aggregations.sumBy(view, Dimension.PLATFORM), settings.topPlatforms()));
    }

    public RegionalAnalysis regionalAnalysis(FilterSelection selection) {
        FilteredView view = view(selection);
        RegionalSales totals = aggregations.regionalTotals(view);
        return new RegionalAnalysis(
                totals,
                totals.shares(),
                aggregations.regionalBreakdownBy(view, Dimension.YEAR));
    }

    /**
     * Publisher and platform page. Pass a selection with an active publisher
     * filter to restrict publishers; without one every publisher is included.
     */
    public MarketAnalysis marketAnalysis(FilterSelection selection) {
        FilteredView view = view(selection);
        KpiSet kpis = summaries.summarize(view);
        return new MarketAnalysis(
                kpis.topPublisher(),
                kpis.topPlatform(),
                kpis.distinctPublishers(),
                aggregations.topN(aggregations.sumBy(view, Dimension.PUBLISHER), settings.topPublishers()),
                aggregations.performanceBy(view, Dimension.PLATFORM),
                aggregations.crossTabulate(view, Dimension.PUBLISHER, Dimension.PLATFORM,
                        settings.heatmapPublishers(), settings.heatmapPlatforms()));
    }
}
