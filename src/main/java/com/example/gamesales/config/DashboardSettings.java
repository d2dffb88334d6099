package com.example.gamesales.config;

/**
 * Ranking sizes used by the dashboard page queries.
 */
public record DashboardSettings(
        int topGenres,
        int topPlatforms,
        int topPublishers,
        int heatmapPublishers,
        int heatmapPlatforms
) {
    public static final DashboardSettings DEFAULTS = new DashboardSettings(5, 10, 15, 10, 10);

    public DashboardSettings {
        requireNonNegative("topGenres", topGenres);
        requireNonNegative("topPlatforms", topPlatforms);
        requireNonNegative("topPublishers", topPublishers);
        requireNonNegative("heatmapPublishers", heatmapPublishers);
        requireNonNegative("heatmapPlatforms", heatmapPlatforms);
    }

    private static void requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
    }
}
