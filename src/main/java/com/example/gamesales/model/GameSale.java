package com.example.gamesales.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One game-sales entry: a title released on one platform, with sales per
 * region in millions of units.
 *
 * <p>{@link #totalSales()} is derived from the four regional figures and is
 * never stored, so it cannot drift from them.
 */
@JsonPropertyOrder({"name", "platform", "year", "genre", "publisher",
        "naSales", "euSales", "jpSales", "otherSales", "totalSales"})
public record GameSale(
        String name,
        String platform,
        int year,
        String genre,
        String publisher,
        double naSales,
        double euSales,
        double jpSales,
        double otherSales
) {
    public GameSale {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(platform, "platform must not be null");
        Objects.requireNonNull(genre, "genre must not be null");
        Objects.requireNonNull(publisher, "publisher must not be null");
    }

    /**
     * Sum of the four regional figures, added in NA, EU, JP, Other order.
     */
    @JsonProperty("totalSales")
    public double totalSales() {
        return naSales + euSales + jpSales + otherSales;
    }

    /**
     * Returns the sales figure for a single region.
     */
    public double salesIn(Region region) {
        return switch (region) {
            case NORTH_AMERICA -> naSales;
            case EUROPE -> euSales;
            case JAPAN -> jpSales;
            case OTHER -> otherSales;
        };
    }
}
