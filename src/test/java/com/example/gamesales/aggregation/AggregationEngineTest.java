package com.example.gamesales.aggregation;

import com.example.gamesales.GameSaleFixtures;
import com.example.gamesales.filter.FilterEngine;
import com.example.gamesales.filter.FilterSelection;
import com.example.gamesales.filter.FilteredView;
import com.example.gamesales.model.GameSale;
import com.example.gamesales.model.RegionalSales;
import com.example.gamesales.model.YearRange;
import com.example.gamesales.store.RecordStore;
import com.example.gamesales.store.RecordStoreLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;

import static com.example.gamesales.GameSaleFixtures.sale;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for AggregationEngine - grouping, ranking, cross-tabulation and ratios.
 */
class AggregationEngineTest {

    private static RecordStore sample;

    private final AggregationEngine engine = new AggregationEngine();

    @BeforeAll
    static void loadSample() throws Exception {
        sample = new RecordStoreLoader().load(GameSaleFixtures.samplePath());
    }

    private static AggregationTable<String> table(Map<String, Double> values) {
        return AggregationTable.of("Genre", Measure.TOTAL_SALES, values);
    }

    // =========================================================================
    // SUM AND COUNT
    // =========================================================================

    @Test
    @DisplayName("Scenario: Action on PS4 and Wii from 2010 to 2020")
    void endToEndScenario() {
        // Given
        RecordStore store = GameSaleFixtures.scenarioStore();
        FilterSelection selection = new FilterSelection(
                Set.of("Action"), Set.of("PS4", "Wii"), null, YearRange.of(2010, 2020));
        FilteredView view = new FilterEngine().apply(store, selection);

        // When
        AggregationTable<String> byPlatform = engine.sumBy(view, Dimension.PLATFORM);
        List<RankedEntry<String>> top = engine.topN(byPlatform, 1);

        // Then
        assertThat(view.size()).isEqualTo(2);
        assertThat(view.stream().mapToDouble(GameSale::totalSales).sum()).isEqualTo(5.0);
        assertThat(byPlatform.values()).containsExactly(entry("PS4", 3.0), entry("Wii", 2.0));
        assertThat(byPlatform.measure()).isEqualTo(Measure.TOTAL_SALES);
        assertThat(top).containsExactly(new RankedEntry<>("PS4", 3.0));
    }

    @Test
    @DisplayName("Groups without records are absent")
    void emptyGroupsAreAbsent() {
        RecordStore store = GameSaleFixtures.scenarioStore();
        FilteredView view = new FilterEngine().apply(store, FilterSelection.defaults(store).withPlatforms(Set.of("PS4")));

        AggregationTable<String> byGenre = engine.sumBy(view, Dimension.GENRE);

        assertThat(byGenre.values()).containsOnlyKeys("Action", "Sports");
        assertThat(byGenre.contains("Racing")).isFalse();
        assertThat(byGenre.value("Racing")).isEmpty();
        assertThat(byGenre.value("Action")).hasValue(3.0);
    }

    @Test
    @DisplayName("Should count records per group")
    void shouldCountRecords() {
        AggregationTable<String> byGenre = engine.countBy(sample.records(), Dimension.GENRE);

        assertThat(byGenre.measure()).isEqualTo(Measure.RECORD_COUNT);
        assertThat(byGenre.value("Action")).hasValue(3.0);
        assertThat(byGenre.value("Sports")).hasValue(1.0);
        assertThat(byGenre.total()).isEqualTo(sample.size());
        assertThat(byGenre.values().values()).allSatisfy(count -> assertThat(count % 1.0).isZero());
    }

    @Test
    @DisplayName("Should group by year with ascending integer keys")
    void shouldGroupByYear() {
        AggregationTable<Integer> byYear = engine.sumBy(GameSaleFixtures.scenarioStore().records(), Dimension.YEAR);

        assertThat(byYear.values().keySet()).containsExactly(2010, 2015, 2020);
        assertThat(byYear.value(2015)).hasValue(4.0);
    }

    @Test
    @DisplayName("Group sums add up to the total of the view")
    void groupSumsAreConserved() {
        double total = sample.records().stream().mapToDouble(GameSale::totalSales).sum();

        assertThat(engine.sumBy(sample.records(), Dimension.PLATFORM).total()).isCloseTo(total, within(1e-9));
        assertThat(engine.sumBy(sample.records(), Dimension.PUBLISHER).total()).isCloseTo(total, within(1e-9));
        assertThat(engine.sumBy(sample.records(), Dimension.YEAR).total()).isCloseTo(total, within(1e-9));
    }

    @Test
    @DisplayName("Aggregation tables are unmodifiable")
    void tablesAreUnmodifiable() {
        AggregationTable<String> byGenre = engine.sumBy(sample.records(), Dimension.GENRE);

        assertThatThrownBy(() -> byGenre.values().put("Puzzle", 1.0))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    // =========================================================================
    // TOP-N
    // =========================================================================

    @Test
    @DisplayName("Top-N is sorted by value with ties broken by ascending key")
    void topNBreaksTiesByKey() {
        AggregationTable<String> table = table(Map.of("b", 2.0, "a", 2.0, "c", 5.0, "d", 1.0));

        List<RankedEntry<String>> top = engine.topN(table, 3);

        assertThat(top).containsExactly(
                new RankedEntry<>("c", 5.0),
                new RankedEntry<>("a", 2.0),
                new RankedEntry<>("b", 2.0));
    }

    @Test
    @DisplayName("Top-N length is the smaller of n and the number of keys")
    void topNLength() {
        AggregationTable<String> table = table(Map.of("b", 2.0, "a", 2.0, "c", 5.0, "d", 1.0));

        assertThat(engine.topN(table, 10)).hasSize(4);
        assertThat(engine.topN(table, 0)).isEmpty();
        assertThat(engine.topN(table(Map.of()), 5)).isEmpty();
    }

    @Test
    @DisplayName("Top-N is repeatable on unchanged input")
    void topNIsDeterministic() {
        AggregationTable<String> byPublisher = engine.sumBy(sample.records(), Dimension.PUBLISHER);

        List<RankedEntry<String>> first = engine.topN(byPublisher, 3);
        List<RankedEntry<String>> second = engine.topN(byPublisher, 3);

        assertThat(second).isEqualTo(first);
        assertThat(first).extracting(RankedEntry::key)
                .containsExactly("Nintendo", "Take-Two Interactive", "Activision");
        assertThat(first).extracting(RankedEntry::value).isSortedAccordingTo((a, b) -> Double.compare(b, a));
    }

    @Test
    @DisplayName("Should reject a negative n")
    void shouldRejectNegativeN() {
        assertThatThrownBy(() -> engine.topN(table(Map.of("a", 1.0)), -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Largest entry is empty for an empty table")
    void largestOfEmptyTable() {
        assertThat(engine.largest(table(Map.of()))).isEmpty();
        assertThat(engine.largest(table(Map.of("x", 1.0, "w", 1.0)))).contains(new RankedEntry<>("w", 1.0));
    }

    // =========================================================================
    // CROSS-TABULATION
    // =========================================================================

    @Test
    @DisplayName("Cross-tab keeps the top keys of each dimension and zero-fills missing pairs")
    void crossTabZeroFills() {
        // Given
        List<GameSale> records = List.of(
                sale("1", "Action", "X", "A", 2000, 5.0),
                sale("2", "Action", "Y", "A", 2000, 1.0),
                sale("3", "Action", "X", "B", 2000, 2.0),
                sale("4", "Action", "Z", "C", 2000, 10.0),
                sale("5", "Action", "Z", "B", 2000, 0.5));

        // When
        CrossTab<String, String> tab = engine.crossTabulate(records, Dimension.PUBLISHER, Dimension.PLATFORM, 2, 2);

        // Then
        assertThat(tab.rowDimension()).isEqualTo("Publisher");
        assertThat(tab.columnDimension()).isEqualTo("Platform");
        assertThat(tab.rows()).containsExactly("A", "C");
        assertThat(tab.columns()).containsExactly("X", "Z");
        assertThat(tab.value("A", "X")).isEqualTo(5.0);
        assertThat(tab.value("A", "Z")).isEqualTo(0.0);
        assertThat(tab.value("C", "X")).isEqualTo(0.0);
        assertThat(tab.value("C", "Z")).isEqualTo(10.0);
        assertThat(tab.value("B", "X")).isEqualTo(0.0);
        assertThat(tab.cells().get("A")).containsOnlyKeys("X", "Z");
        assertThat(tab.total()).isEqualTo(15.0);
    }

    @Test
    @DisplayName("Cross-tab of an empty view is empty")
    void crossTabOfEmptyView() {
        CrossTab<String, String> tab = engine.crossTabulate(List.of(), Dimension.PUBLISHER, Dimension.PLATFORM, 10, 10);

        assertThat(tab.isEmpty()).isTrue();
        assertThat(tab.cells()).isEmpty();
    }

    // =========================================================================
    // RATIOS AND PERFORMANCE
    // =========================================================================

    @Test
    @DisplayName("Shares are percentages of the table total")
    void sharesArePercentages() {
        AggregationTable<String> shares = engine.shares(table(Map.of("a", 1.0, "b", 3.0)));

        assertThat(shares.measure()).isEqualTo(Measure.SHARE_PERCENT);
        assertThat(shares.value("a").getAsDouble()).isCloseTo(25.0, within(1e-9));
        assertThat(shares.value("b").getAsDouble()).isCloseTo(75.0, within(1e-9));
        assertThat(engine.shares(table(Map.of())).isEmpty()).isTrue();
        assertThat(engine.shares(table(Map.of("a", 0.0))).value("a")).hasValue(0.0);
    }

    @Test
    @DisplayName("Should compute sales, count and average per platform")
    void shouldComputePerformance() {
        List<GroupPerformance<String>> performance =
                engine.performanceBy(GameSaleFixtures.scenarioStore().records(), Dimension.PLATFORM);

        assertThat(performance).containsExactly(
                new GroupPerformance<>("PS4", 4.0, 2),
                new GroupPerformance<>("Wii", 2.5, 2));
        assertThat(performance.get(1).averageSales()).isEqualTo(1.25);
    }

    @Test
    @DisplayName("Should total sales per region and per year")
    void shouldTotalRegions() {
        // Given
        List<GameSale> records = List.of(
                new GameSale("a", "PS2", 2001, "Action", "Sony", 1.0, 2.0, 3.0, 4.0),
                new GameSale("b", "PS2", 2002, "Action", "Sony", 0.5, 0.5, 0.0, 0.0),
                new GameSale("c", "PS2", 2001, "Action", "Sony", 1.0, 0.0, 0.0, 0.0));

        // When
        RegionalSales totals = engine.regionalTotals(records);
        SortedMap<Integer, RegionalSales> byYear = engine.regionalBreakdownBy(records, Dimension.YEAR);

        // Then
        assertThat(totals).isEqualTo(new RegionalSales(3, 2.5, 2.5, 3.0, 4.0));
        assertThat(byYear.keySet()).containsExactly(2001, 2002);
        assertThat(byYear.get(2001)).isEqualTo(new RegionalSales(2, 2.0, 2.0, 3.0, 4.0));
        assertThat(byYear.get(2002).total()).isEqualTo(1.0);
    }
}
