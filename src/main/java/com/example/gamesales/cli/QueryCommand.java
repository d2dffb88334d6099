package com.example.gamesales.cli;

import com.example.gamesales.config.GameSalesConfig;
import com.example.gamesales.dashboard.DashboardQueries;
import com.example.gamesales.filter.FilterSelection;
import com.example.gamesales.model.YearRange;
import com.example.gamesales.store.DataLoadException;
import com.example.gamesales.store.RecordStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.typesafe.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Runs one dashboard page query and prints the snapshot as JSON.
 */
@Command(
    name = "query",
    description = "Filter the dataset and print one dashboard page as JSON"
)
public class QueryCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(QueryCommand.class);

    enum Page {
        OVERVIEW, INITIAL, REGIONAL, MARKET
    }

    @Option(names = {"--source"}, description = "CSV to load (default: gamesales.data.clean-path)")
    private Path source;

    @Option(names = {"--page"}, defaultValue = "initial",
            description = "Page to compute: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private Page page;

    @Option(names = {"--genre"}, split = ",", description = "Genres to keep (default: all)")
    private List<String> genres;

    @Option(names = {"--platform"}, split = ",", description = "Platforms to keep (default: all)")
    private List<String> platforms;

    @Option(names = {"--publisher"}, split = ",", description = "Publishers to keep (default: not filtered)")
    private List<String> publishers;

    @Option(names = {"--from-year"}, description = "First release year (default: earliest in the data)")
    private Integer fromYear;

    @Option(names = {"--to-year"}, description = "Last release year (default: latest in the data)")
    private Integer toYear;

    @ParentCommand
    private GameSalesCommand parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter stdout = spec.commandLine().getOut();
        PrintWriter stderr = spec.commandLine().getErr();

        GameSalesConfig config;
        try {
            config = parent.config();
        } catch (ConfigException | IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            stderr.println("Error: invalid configuration: " + e.getMessage());
            return 1;
        }
        Path dataset = source != null ? source : config.cleanDataPath();

        RecordStore store;
        try {
            store = parent.stores().get(dataset);
        } catch (DataLoadException e) {
            log.error("Loading failed: {}", e.getMessage());
            stderr.println("Error: " + e.getMessage());
            return 1;
        }

        FilterSelection selection;
        try {
            selection = selection(store);
        } catch (IllegalArgumentException e) {
            stderr.println("Error: " + e.getMessage());
            return 2;
        }

        DashboardQueries queries = new DashboardQueries(store, config.dashboardSettings());
        Object snapshot = switch (page) {
            case OVERVIEW -> queries.overview();
            case INITIAL -> queries.initialAnalysis(selection);
            case REGIONAL -> queries.regionalAnalysis(selection);
            case MARKET -> queries.marketAnalysis(selection);
        };

        try {
            stdout.println(GameSalesCommand.jsonMapper().writeValueAsString(snapshot));
            stdout.flush();
            return 0;
        } catch (JsonProcessingException e) {
            log.error("Could not render {} page", page, e);
            stderr.println("Error: could not render page: " + e.getOriginalMessage());
            return 1;
        }
    }

    private FilterSelection selection(RecordStore store) {
        FilterSelection selection = FilterSelection.defaults(store);
        if (genres != null) {
            selection = selection.withGenres(genres);
        }
        if (platforms != null) {
            selection = selection.withPlatforms(platforms);
        }
        if (publishers != null) {
            selection = selection.withPublishers(publishers);
        }
        YearRange years = selection.years();
        if (fromYear != null || toYear != null) {
            selection = selection.withYears(
                    fromYear != null ? fromYear : years.min(),
                    toYear != null ? toYear : years.max());
        }
        return selection;
    }
}
