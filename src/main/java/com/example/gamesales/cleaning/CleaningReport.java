package com.example.gamesales.cleaning;

import java.nio.file.Path;

/**
 * Outcome of one cleaning run.
 *
 * @param source raw file read
 * @param target cleaned file written
 * @param rowsRead data rows in the raw file
 * @param rowsWritten records in the cleaned file
 * @param duplicatesDropped exact duplicate rows removed
 * @param rowsDroppedForYear rows with a missing or out-of-range year
 * @param unknownCategoriesFilled genre and publisher cells set to the unknown category
 */
public record CleaningReport(
        Path source,
        Path target,
        long rowsRead,
        long rowsWritten,
        long duplicatesDropped,
        long rowsDroppedForYear,
        long unknownCategoriesFilled
) {
}
