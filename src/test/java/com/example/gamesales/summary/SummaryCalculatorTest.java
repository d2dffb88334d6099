package com.example.gamesales.summary;

import com.example.gamesales.GameSaleFixtures;
import com.example.gamesales.aggregation.Dimension;
import com.example.gamesales.aggregation.RankedEntry;
import com.example.gamesales.filter.FilterEngine;
import com.example.gamesales.filter.FilterSelection;
import com.example.gamesales.filter.FilteredView;
import com.example.gamesales.model.GameSale;
import com.example.gamesales.model.Region;
import com.example.gamesales.store.RecordStore;
import com.example.gamesales.store.RecordStoreLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.example.gamesales.GameSaleFixtures.sale;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SummaryCalculatorTest {

    private final SummaryCalculator calculator = new SummaryCalculator();

    @Test
    @DisplayName("Should summarize the scenario store")
    void shouldSummarizeScenario() {
        KpiSet kpis = calculator.summarize(GameSaleFixtures.scenarioStore().records());

        assertThat(kpis.recordCount()).isEqualTo(4);
        assertThat(kpis.totalSales()).isEqualTo(6.5);
        assertThat(kpis.distinctGenres()).isEqualTo(3);
        assertThat(kpis.distinctPlatforms()).isEqualTo(2);
        assertThat(kpis.distinctPublishers()).isEqualTo(1);
        assertThat(kpis.topGenre()).contains(new RankedEntry<>("Action", 5.0));
        assertThat(kpis.topPlatform()).contains(new RankedEntry<>("PS4", 4.0));
        assertThat(kpis.topPublisher()).contains(new RankedEntry<>("Nintendo", 6.5));
        assertThat(kpis.regionalSales().get(Region.NORTH_AMERICA)).isEqualTo(6.5);
        assertThat(kpis.isEmpty()).isFalse();
    }

    @Test
    @DisplayName("Should summarize the sample dataset")
    void shouldSummarizeSample() throws Exception {
        // Given
        RecordStore store = new RecordStoreLoader().load(GameSaleFixtures.samplePath());
        double expectedTotal = store.records().stream().mapToDouble(GameSale::totalSales).sum();

        // When
        KpiSet kpis = calculator.summarize(store.records());

        // Then
        assertThat(kpis.recordCount()).isEqualTo(10);
        assertThat(kpis.totalSales()).isCloseTo(expectedTotal, within(1e-9));
        assertThat(kpis.regionalSales().total()).isCloseTo(expectedTotal, within(1e-9));
        assertThat(kpis.distinctGenres()).isEqualTo(8);
        assertThat(kpis.distinctPlatforms()).isEqualTo(7);
        assertThat(kpis.distinctPublishers()).isEqualTo(5);
        assertThat(kpis.topGenre()).map(RankedEntry::key).contains("Sports");
        assertThat(kpis.topPlatform()).map(RankedEntry::key).contains("Wii");
        assertThat(kpis.topPublisher()).map(RankedEntry::key).contains("Nintendo");
    }

    @Test
    @DisplayName("Scenario: an empty genre selection yields the empty summary")
    void emptyViewYieldsEmptySummary() {
        // Given
        RecordStore store = GameSaleFixtures.scenarioStore();
        FilteredView view = new FilterEngine().apply(store, FilterSelection.defaults(store).withGenres(Set.of()));

        // When
        KpiSet kpis = calculator.summarize(view);

        // Then
        assertThat(view.isEmpty()).isTrue();
        assertThat(kpis).isEqualTo(KpiSet.empty());
        assertThat(kpis.isEmpty()).isTrue();
        assertThat(kpis.totalSales()).isZero();
        assertThat(kpis.topGenre()).isEmpty();
        assertThat(kpis.topPlatform()).isEmpty();
        assertThat(kpis.topPublisher()).isEmpty();
    }

    @Test
    @DisplayName("Largest group ties go to the smallest key")
    void largestGroupTieBreak() {
        List<GameSale> records = List.of(
                sale("a", "Sports", "Wii", 2001, 2.0),
                sale("b", "Action", "PS2", 2001, 2.0));

        assertThat(calculator.largestGroup(records, Dimension.GENRE)).contains(new RankedEntry<>("Action", 2.0));
        assertThat(calculator.largestGroup(records, Dimension.PLATFORM)).contains(new RankedEntry<>("PS2", 2.0));
        assertThat(calculator.largestGroup(List.of(), Dimension.YEAR)).isEmpty();
    }

    @Test
    @DisplayName("Summary is consistent with the filtered view it was computed over")
    void summaryMatchesView() {
        RecordStore store = GameSaleFixtures.scenarioStore();
        FilteredView view = new FilterEngine().apply(store, FilterSelection.defaults(store).withYears(2015, 2020));

        KpiSet kpis = calculator.summarize(view);

        assertThat(kpis.recordCount()).isEqualTo(view.size());
        assertThat(kpis.totalSales()).isEqualTo(4.5);
        assertThat(kpis.topPlatform()).contains(new RankedEntry<>("PS4", 4.0));
    }
}
