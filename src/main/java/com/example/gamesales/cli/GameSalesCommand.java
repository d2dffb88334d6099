package com.example.gamesales.cli;

import com.example.gamesales.config.GameSalesConfig;
import com.example.gamesales.store.RecordStoreLoader;
import com.example.gamesales.store.StoreCache;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

/**
 * Command line entry point.
 *
 * <pre>
 * game-sales clean --raw data/vgsales_raw.csv --out data/vgsales_clean.csv
 * game-sales query --page market --genre Action,Sports --from-year 2005 --to-year 2015
 * </pre>
 */
@Command(
    name = "game-sales",
    mixinStandardHelpOptions = true,
    version = "game-sales 1.0",
    description = "Filter and aggregate video game sales",
    subcommands = {
        CleanCommand.class,
        QueryCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class GameSalesCommand implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "HOCON configuration file layered over the built-in defaults"
    )
    private File configFile;

    private GameSalesConfig config;

    private StoreCache stores;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Creates a fully configured CommandLine, shared by {@link #main} and tests.
     */
    public static CommandLine createCommandLine() {
        CommandLine commandLine = new CommandLine(new GameSalesCommand());
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    /**
     * The configuration, loaded on first use.
     *
     * @throws com.typesafe.config.ConfigException if the file cannot be parsed
     * @throws IllegalArgumentException if the file is missing or holds invalid values
     */
    GameSalesConfig config() {
        if (config == null) {
            GameSalesConfig loaded = configFile != null ? GameSalesConfig.load(configFile) : GameSalesConfig.load();
            loaded.loadSettings();
            loaded.dashboardSettings();
            config = loaded;
        }
        return config;
    }

    /**
     * Stores loaded by this process. Without a configuration file the
     * process-wide {@link StoreCache#shared()} cache is used.
     */
    StoreCache stores() {
        if (stores == null) {
            stores = configFile != null
                    ? new StoreCache(new RecordStoreLoader(config().loadSettings()))
                    : StoreCache.shared();
        }
        return stores;
    }

    static ObjectMapper jsonMapper() {
        return new ObjectMapper()
                .registerModule(new Jdk8Module())
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
