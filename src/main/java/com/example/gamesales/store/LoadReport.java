package com.example.gamesales.store;

/**
 * Row counts gathered while loading one source.
 *
 * @param rowsRead data rows in the source, header excluded
 * @param rowsDroppedForYear rows whose year was missing or outside the valid range
 * @param duplicatesDropped rows identical to an earlier kept row
 * @param unknownCategoriesFilled genre and publisher cells replaced by the unknown category
 * @param rowsKept records in the resulting store
 */
public record LoadReport(
        long rowsRead,
        long rowsDroppedForYear,
        long duplicatesDropped,
        long unknownCategoriesFilled,
        long rowsKept
) {
}
