package com.example.gamesales.store;

import com.example.gamesales.config.LoadSettings;
import com.example.gamesales.model.GameSale;
import com.example.gamesales.model.Region;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads a sales CSV into a {@link RecordStore}, normalizing as it goes.
 *
 * <p>Normalization steps, applied to every row:
 * <ol>
 *   <li>a missing or out-of-range year drops the row</li>
 *   <li>a missing genre or publisher becomes the configured unknown category</li>
 *   <li>a row equal to an earlier kept row is dropped</li>
 * </ol>
 * Total sales are always derived from the regional columns; a {@code Total_Sales}
 * or {@code Global_Sales} column in the source is ignored. Because the steps are
 * idempotent, a file written by {@link com.example.gamesales.cleaning.DatasetCleaner}
 * loads into the same store as the raw file it came from.
 *
 * <p>Anything else that does not parse fails the whole load with a
 * {@link DataLoadException}.
 *
 * <p>Example usage:
 * <pre>{@code
 * RecordStore store = new RecordStoreLoader().load(Path.of("data/vgsales_clean.csv"));
 * }</pre>
 */
public class RecordStoreLoader {

    private static final Logger log = LoggerFactory.getLogger(RecordStoreLoader.class);

    public static final String NAME = "Name";
    public static final String PLATFORM = "Platform";
    public static final String YEAR = "Year";
    public static final String GENRE = "Genre";
    public static final String PUBLISHER = "Publisher";

    // Descriptive columns, followed by one sales column per region
    static final List<String> REQUIRED_COLUMNS = requiredColumns();

    // Cells treated as "no value", the same tokens common CSV tooling reads as missing.
    private static final Set<String> MISSING_TOKENS = Set.of(
            "", "#N/A", "#N/A N/A", "#NA", "-1.#IND", "-1.#QNAN", "-NaN", "-nan",
            "1.#IND", "1.#QNAN", "<NA>", "N/A", "NA", "NULL", "NaN", "None", "n/a", "nan", "null");

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final LoadSettings settings;
    private final CsvMapper csvMapper;

    public RecordStoreLoader() {
        this(LoadSettings.DEFAULTS);
    }

    public RecordStoreLoader(LoadSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    /**
     * Result of a load: the store and the counts gathered while building it.
     */
    public record LoadResult(RecordStore store, LoadReport report) {
    }

    public LoadSettings settings() {
        return settings;
    }

    /**
     * Loads a CSV file into a store.
     *
     * @param source path of the CSV file
     * @return the loaded store
     * @throws DataLoadException if the file is unreadable or malformed
     */
    public RecordStore load(Path source) throws DataLoadException {
        return loadWithReport(source).store();
    }

    /**
     * Loads a CSV file and also returns the normalization counts.
     *
     * @throws DataLoadException if the file is unreadable or malformed
     */
    public LoadResult loadWithReport(Path source) throws DataLoadException {
        if (!Files.isRegularFile(source) || !Files.isReadable(source)) {
            throw new DataLoadException("Dataset not found or not readable: " + source);
        }
        try (Reader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8)) {
            return read(reader, source.toString());
        } catch (IOException e) {
            throw new DataLoadException("Failed to read dataset " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads CSV content from a reader. The reader is not closed.
     *
     * @param reader CSV content, header row first
     * @param sourceName label used in error messages and as the store's source
     * @throws DataLoadException if the content is malformed
     */
    public LoadResult read(Reader reader, String sourceName) throws DataLoadException {
        try (MappingIterator<String[]> rows = csvMapper.readerFor(String[].class).readValues(reader)) {
            if (!rows.hasNextValue()) {
                throw new DataLoadException("Dataset " + sourceName + " is empty: no header row");
            }
            Map<String, Integer> columns = indexColumns(rows.nextValue(), sourceName);

            Set<GameSale> kept = new LinkedHashSet<>();
            long rowsRead = 0;
            long droppedForYear = 0;
            long duplicates = 0;
            long filled = 0;

            while (rows.hasNextValue()) {
                String[] row = rows.nextValue();
                rowsRead++;
                RowReader cells = new RowReader(row, columns, sourceName, rowsRead);

                Integer year = cells.year();
                if (year == null || !settings.validYears().contains(year)) {
                    droppedForYear++;
                    continue;
                }

                String genre = cells.category(GENRE);
                String publisher = cells.category(PUBLISHER);
                if (genre == null) {
                    genre = settings.unknownCategory();
                    filled++;
                }
                if (publisher == null) {
                    publisher = settings.unknownCategory();
                    filled++;
                }

                Map<Region, Double> sales = new EnumMap<>(Region.class);
                for (Region region : Region.values()) {
                    sales.put(region, cells.sales(region.column()));
                }
                GameSale sale = new GameSale(
                        cells.name(),
                        cells.platform(),
                        year,
                        genre,
                        publisher,
                        sales.get(Region.NORTH_AMERICA),
                        sales.get(Region.EUROPE),
                        sales.get(Region.JAPAN),
                        sales.get(Region.OTHER));
                if (!kept.add(sale)) {
                    duplicates++;
                }
            }

            RecordStore store = RecordStore.of(sourceName, new ArrayList<>(kept));
            LoadReport report = new LoadReport(rowsRead, droppedForYear, duplicates, filled, store.size());
            log.info("Loaded {}: {} rows read, {} kept, {} dropped for year, {} duplicates dropped",
                    sourceName, rowsRead, store.size(), droppedForYear, duplicates);
            return new LoadResult(store, report);
        } catch (IOException e) {
            throw new DataLoadException("Failed to parse dataset " + sourceName + ": " + e.getMessage(), e);
        }
    }

    private static List<String> requiredColumns() {
        List<String> columns = new ArrayList<>(List.of(NAME, PLATFORM, YEAR, GENRE, PUBLISHER));
        for (Region region : Region.values()) {
            columns.add(region.column());
        }
        return List.copyOf(columns);
    }

    private static Map<String, Integer> indexColumns(String[] header, String sourceName) throws DataLoadException {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            String name = header[i];
            if (i == 0 && !name.isEmpty() && name.charAt(0) == BYTE_ORDER_MARK) {
                name = name.substring(1);
            }
            columns.putIfAbsent(name, i);
        }
        List<String> missing = new ArrayList<>();
        for (String required : REQUIRED_COLUMNS) {
            if (!columns.containsKey(required)) {
                missing.add(required);
            }
        }
        if (!missing.isEmpty()) {
            throw new DataLoadException("Dataset " + sourceName + " is missing required columns " + missing);
        }
        return columns;
    }

    private static boolean isMissing(String cell) {
        return cell == null || MISSING_TOKENS.contains(cell);
    }

    /**
     * Typed access to the cells of one data row.
     */
    private static final class RowReader {

        private final String[] row;
        private final Map<String, Integer> columns;
        private final String sourceName;
        private final long rowNumber;

        RowReader(String[] row, Map<String, Integer> columns, String sourceName, long rowNumber) {
            this.row = row;
            this.columns = columns;
            this.sourceName = sourceName;
            this.rowNumber = rowNumber;
        }

        String cell(String column) {
            int index = columns.get(column);
            return index < row.length ? row[index] : null;
        }

        String name() {
            String value = cell(NAME);
            return isMissing(value) ? "" : value;
        }

        String platform() throws DataLoadException {
            String value = cell(PLATFORM);
            if (isMissing(value)) {
                throw error(PLATFORM, "missing value");
            }
            return value;
        }

        /**
         * Returns null for a missing category so the caller can substitute it.
         */
        String category(String column) {
            String value = cell(column);
            return isMissing(value) ? null : value;
        }

        /**
         * Returns null for a missing year; such rows are dropped, not rejected.
         */
        Integer year() throws DataLoadException {
            String value = cell(YEAR);
            if (isMissing(value)) {
                return null;
            }
            double parsed;
            try {
                parsed = Double.parseDouble(value);
            } catch (NumberFormatException e) {
                throw error(YEAR, "unparseable year '" + value + "'");
            }
            if (!Double.isFinite(parsed) || parsed != Math.rint(parsed)
                    || parsed < Integer.MIN_VALUE || parsed > Integer.MAX_VALUE) {
                throw error(YEAR, "unparseable year '" + value + "'");
            }
            return (int) parsed;
        }

        double sales(String column) throws DataLoadException {
            String value = cell(column);
            if (isMissing(value)) {
                throw error(column, "missing sales value");
            }
            double parsed;
            try {
                parsed = Double.parseDouble(value);
            } catch (NumberFormatException e) {
                throw error(column, "non-numeric sales value '" + value + "'");
            }
            if (!Double.isFinite(parsed) || parsed < 0.0) {
                throw error(column, "sales value must be a non-negative number, got '" + value + "'");
            }
            // -0 and 0 must compare equal for deduplication
            return parsed + 0.0;
        }

        DataLoadException error(String column, String problem) {
            return new DataLoadException(
                    "Dataset " + sourceName + ", data row " + rowNumber + ", column " + column + ": " + problem);
        }
    }
}
