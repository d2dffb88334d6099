package com.example.gamesales.cleaning;

import com.example.gamesales.model.GameSale;
import com.example.gamesales.model.Region;
import com.example.gamesales.store.RecordStoreLoader;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes records as CSV in the cleaned-file layout: the source columns
 * followed by the derived {@code Total_Sales}.
 */
public class CleanedCsvWriter {

    public static final String TOTAL_SALES = "Total_Sales";

    private static final CsvSchema SCHEMA = schema();

    private final CsvMapper csvMapper = new CsvMapper();

    /**
     * Writes the records to a file, creating parent directories as needed and
     * replacing any existing file.
     */
    public void write(Iterable<GameSale> records, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            write(records, writer);
        }
    }

    /**
     * Writes the header and one row per record. The writer is flushed, not closed.
     */
    public void write(Iterable<GameSale> records, Writer writer) throws IOException {
        SequenceWriter rows = csvMapper.writer(SCHEMA).writeValues(writer);
        for (GameSale sale : records) {
            rows.write(toRow(sale));
        }
        rows.flush();
    }

    private static CsvSchema schema() {
        CsvSchema.Builder builder = CsvSchema.builder()
                .addColumn(RecordStoreLoader.NAME)
                .addColumn(RecordStoreLoader.PLATFORM)
                .addNumberColumn(RecordStoreLoader.YEAR)
                .addColumn(RecordStoreLoader.GENRE)
                .addColumn(RecordStoreLoader.PUBLISHER);
        for (Region region : Region.values()) {
            builder.addNumberColumn(region.column());
        }
        return builder.addNumberColumn(TOTAL_SALES).build().withHeader();
    }

    private static Map<String, Object> toRow(GameSale sale) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(RecordStoreLoader.NAME, sale.name());
        row.put(RecordStoreLoader.PLATFORM, sale.platform());
        row.put(RecordStoreLoader.YEAR, sale.year());
        row.put(RecordStoreLoader.GENRE, sale.genre());
        row.put(RecordStoreLoader.PUBLISHER, sale.publisher());
        for (Region region : Region.values()) {
            row.put(region.column(), sale.salesIn(region));
        }
        row.put(TOTAL_SALES, sale.totalSales());
        return row;
    }
}
