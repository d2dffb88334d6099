package com.example.gamesales.model;

/**
 * Sales regions present in the dataset, in the column order of the source file.
 */
public enum Region {
    NORTH_AMERICA("NA_Sales"),
    EUROPE("EU_Sales"),
    JAPAN("JP_Sales"),
    OTHER("Other_Sales");

    private final String column;

    Region(String column) {
        this.column = column;
    }

    /**
     * Header name of this region's column in the source CSV.
     */
    public String column() {
        return column;
    }
}
