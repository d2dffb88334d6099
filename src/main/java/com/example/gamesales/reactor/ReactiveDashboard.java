package com.example.gamesales.reactor;

import com.example.gamesales.dashboard.DashboardQueries;
import com.example.gamesales.dashboard.DatasetOverview;
import com.example.gamesales.dashboard.InitialAnalysis;
import com.example.gamesales.dashboard.MarketAnalysis;
import com.example.gamesales.dashboard.RegionalAnalysis;
import com.example.gamesales.filter.FilterSelection;
import com.example.gamesales.model.GameSale;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Reactive facade over {@link DashboardQueries} using Project Reactor.
 *
 * <p>Queries are CPU-bound and run on the given scheduler (the parallel
 * scheduler by default), so a UI event loop is never blocked by a
 * recomputation. The store is shared read-only; every subscription computes
 * its own snapshot.
 *
 * <p>Example usage:
 * <pre>{@code
 * ReactiveDashboard dashboard = new ReactiveDashboard(new DashboardQueries(store));
 *
 * // One page, once
 * dashboard.initialAnalysis(selection).subscribe(page -> render(page));
 *
 * // Recompute whenever the user changes a filter
 * dashboard.onSelectionChange(selectionEvents, DashboardQueries::marketAnalysis)
 *     .subscribe(page -> render(page));
 * }</pre>
 */
public class ReactiveDashboard {

    private final DashboardQueries queries;
    private final Scheduler scheduler;

    public ReactiveDashboard(DashboardQueries queries) {
        this(queries, Schedulers.parallel());
    }

    /**
     * Creates a facade running queries on a custom scheduler, e.g.
     * {@link Schedulers#immediate()} in tests.
     */
    public ReactiveDashboard(DashboardQueries queries, Scheduler scheduler) {
        this.queries = Objects.requireNonNull(queries, "queries must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    }

    public Mono<DatasetOverview> overview() {
        return Mono.fromCallable(queries::overview).subscribeOn(scheduler);
    }

    public Mono<InitialAnalysis> initialAnalysis(FilterSelection selection) {
        return page(selection, DashboardQueries::initialAnalysis);
    }

    public Mono<RegionalAnalysis> regionalAnalysis(FilterSelection selection) {
        return page(selection, DashboardQueries::regionalAnalysis);
    }

    public Mono<MarketAnalysis> marketAnalysis(FilterSelection selection) {
        return page(selection, DashboardQueries::marketAnalysis);
    }

    /**
     * Emits the records of a selection's view in store order. The view is
     * computed per subscriber.
     */
    public Flux<GameSale> records(FilterSelection selection) {
        return Flux.defer(() -> Flux.fromIterable(queries.view(selection)))
                .subscribeOn(scheduler);
    }

    /**
     * Recomputes a page for every selection that differs from the previous one.
     *
     * <p>Snapshots are emitted in the order the selections arrived; repeated
     * identical selections are skipped.
     *
     * @param selections selection changes, e.g. from UI widgets
     * @param page the page query, such as {@code DashboardQueries::initialAnalysis}
     * @return one snapshot per distinct consecutive selection
     */
    public <P> Flux<P> onSelectionChange(
            Flux<FilterSelection> selections,
            BiFunction<DashboardQueries, FilterSelection, P> page) {
        return selections
                .distinctUntilChanged()
                .concatMap(selection -> page(selection, page));
    }

    private <P> Mono<P> page(FilterSelection selection, BiFunction<DashboardQueries, FilterSelection, P> page) {
        return Mono.fromCallable(() -> page.apply(queries, selection))
                .subscribeOn(scheduler);
    }
}
