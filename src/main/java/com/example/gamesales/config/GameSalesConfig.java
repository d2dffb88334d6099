package com.example.gamesales.config;

import com.example.gamesales.model.YearRange;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Typed view over the {@code gamesales} block of the HOCON configuration.
 *
 * <p>Lowest to highest precedence: {@code reference.conf} on the classpath,
 * {@code application.conf}, an optional explicit file, system properties.
 */
public final class GameSalesConfig {

    private static final String ROOT = "gamesales";

    private final Config config;

    private GameSalesConfig(Config config) {
        this.config = config.getConfig(ROOT);
    }

    /**
     * Loads the default configuration stack.
     */
    public static GameSalesConfig load() {
        return new GameSalesConfig(ConfigFactory.load());
    }

    /**
     * Loads the configuration with an explicit file layered over the defaults.
     *
     * @throws IllegalArgumentException if the file does not exist
     */
    public static GameSalesConfig load(File configFile) {
        if (!configFile.exists()) {
            throw new IllegalArgumentException("Configuration file not found: " + configFile.getAbsolutePath());
        }
        Config fileConfig = ConfigFactory.parseFile(configFile);
        return new GameSalesConfig(ConfigFactory.systemProperties()
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.defaultApplication())
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve());
    }

    /**
     * Wraps an already resolved configuration, e.g. one built in a test.
     */
    public static GameSalesConfig from(Config config) {
        return new GameSalesConfig(Objects.requireNonNull(config, "config must not be null")
                .withFallback(ConfigFactory.defaultReference()).resolve());
    }

    public Path rawDataPath() {
        return Path.of(config.getString("data.raw-path"));
    }

    public Path cleanDataPath() {
        return Path.of(config.getString("data.clean-path"));
    }

    public LoadSettings loadSettings() {
        return new LoadSettings(
                YearRange.of(config.getInt("load.min-year"), config.getInt("load.max-year")),
                config.getString("load.unknown-category"));
    }

    public DashboardSettings dashboardSettings() {
        return new DashboardSettings(
                config.getInt("dashboard.top-genres"),
                config.getInt("dashboard.top-platforms"),
                config.getInt("dashboard.top-publishers"),
                config.getInt("dashboard.heatmap-publishers"),
                config.getInt("dashboard.heatmap-platforms"));
    }
}
