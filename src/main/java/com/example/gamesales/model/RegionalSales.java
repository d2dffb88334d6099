package com.example.gamesales.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Sales summed per region over a set of records.
 *
 * <p>Built by {@link com.example.gamesales.aggregation.RegionalSalesCollector}.
 *
 * @param count number of records accumulated
 */
public record RegionalSales(
        long count,
        double northAmerica,
        double europe,
        double japan,
        double other
) {
    /**
     * Totals of no records.
     */
    public static RegionalSales zero() {
        return new RegionalSales(0, 0.0, 0.0, 0.0, 0.0);
    }

    public double get(Region region) {
        return switch (region) {
            case NORTH_AMERICA -> northAmerica;
            case EUROPE -> europe;
            case JAPAN -> japan;
            case OTHER -> other;
        };
    }

    /**
     * Sum of all four regions.
     */
    public double total() {
        return northAmerica + europe + japan + other;
    }

    /**
     * Percentage of the regional total taken by one region, in the range 0 to 100.
     * Returns 0.0 when nothing was sold.
     */
    public double share(Region region) {
        double total = total();
        return total > 0.0 ? get(region) / total * 100.0 : 0.0;
    }

    /**
     * Percentage shares of every region, in {@link Region} order.
     */
    public Map<Region, Double> shares() {
        Map<Region, Double> shares = new EnumMap<>(Region.class);
        for (Region region : Region.values()) {
            shares.put(region, share(region));
        }
        return shares;
    }
}
