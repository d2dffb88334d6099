package com.example.gamesales.cleaning;

import com.example.gamesales.store.DataLoadException;
import com.example.gamesales.store.LoadReport;
import com.example.gamesales.store.RecordStoreLoader;
import com.example.gamesales.store.RecordStoreLoader.LoadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Offline pre-processing step: reads the raw dataset, applies the load-time
 * normalization and writes the cleaned file the dashboard reads at run time.
 *
 * <p>Because loading normalizes idempotently, the cleaned file loads into the
 * same records as the raw one; cleaning only saves the work at startup.
 */
public class DatasetCleaner {

    private static final Logger log = LoggerFactory.getLogger(DatasetCleaner.class);

    private final RecordStoreLoader loader;
    private final CleanedCsvWriter writer;

    public DatasetCleaner(RecordStoreLoader loader) {
        this(loader, new CleanedCsvWriter());
    }

    public DatasetCleaner(RecordStoreLoader loader, CleanedCsvWriter writer) {
        this.loader = Objects.requireNonNull(loader, "loader must not be null");
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
    }

    /**
     * Cleans {@code source} into {@code target}.
     *
     * @throws DataLoadException if the raw file cannot be loaded; nothing is written
     * @throws IOException if the cleaned file cannot be written
     */
    public CleaningReport clean(Path source, Path target) throws DataLoadException, IOException {
        LoadResult result = loader.loadWithReport(source);
        writer.write(result.store().records(), target);

        LoadReport load = result.report();
        CleaningReport report = new CleaningReport(
                source,
                target,
                load.rowsRead(),
                load.rowsKept(),
                load.duplicatesDropped(),
                load.rowsDroppedForYear(),
                load.unknownCategoriesFilled());
        log.info("Cleaned {} -> {}: {} of {} rows written", source, target, report.rowsWritten(), report.rowsRead());
        return report;
    }
}
