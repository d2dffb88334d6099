package com.example.gamesales.config;

import com.example.gamesales.model.YearRange;

import java.util.Objects;

/**
 * Normalization rules applied while loading a dataset.
 *
 * @param validYears rows whose year falls outside this range are dropped
 * @param unknownCategory value substituted for a missing genre or publisher
 */
public record LoadSettings(YearRange validYears, String unknownCategory) {

    public static final LoadSettings DEFAULTS = new LoadSettings(YearRange.of(1980, 2025), "Unknown");

    public LoadSettings {
        Objects.requireNonNull(validYears, "validYears must not be null");
        Objects.requireNonNull(unknownCategory, "unknownCategory must not be null");
    }
}
