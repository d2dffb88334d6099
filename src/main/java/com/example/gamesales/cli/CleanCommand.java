package com.example.gamesales.cli;

import com.example.gamesales.cleaning.CleaningReport;
import com.example.gamesales.cleaning.DatasetCleaner;
import com.example.gamesales.config.GameSalesConfig;
import com.example.gamesales.store.DataLoadException;
import com.example.gamesales.store.RecordStoreLoader;
import com.typesafe.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Writes the cleaned dataset from the raw one.
 */
@Command(
    name = "clean",
    description = "Deduplicate, drop out-of-range years, fill unknown categories and add Total_Sales"
)
public class CleanCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CleanCommand.class);

    @Option(names = {"--raw"}, description = "Raw CSV to read (default: gamesales.data.raw-path)")
    private Path raw;

    @Option(names = {"--out"}, description = "Cleaned CSV to write (default: gamesales.data.clean-path)")
    private Path out;

    @ParentCommand
    private GameSalesCommand parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter stdout = spec.commandLine().getOut();
        PrintWriter stderr = spec.commandLine().getErr();

        GameSalesConfig config;
        try {
            config = parent.config();
        } catch (ConfigException | IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            stderr.println("Error: invalid configuration: " + e.getMessage());
            return 1;
        }
        Path source = raw != null ? raw : config.rawDataPath();
        Path target = out != null ? out : config.cleanDataPath();

        try {
            CleaningReport report = new DatasetCleaner(new RecordStoreLoader(config.loadSettings()))
                    .clean(source, target);
            stdout.printf("Raw rows: %d%n", report.rowsRead());
            stdout.printf("Clean rows: %d%n", report.rowsWritten());
            stdout.printf("Duplicates dropped: %d%n", report.duplicatesDropped());
            stdout.printf("Dropped for year: %d%n", report.rowsDroppedForYear());
            stdout.printf("Clean file saved to: %s%n", report.target());
            stdout.flush();
            return 0;
        } catch (DataLoadException e) {
            log.error("Cleaning failed: {}", e.getMessage());
            stderr.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Could not write {}", target, e);
            stderr.println("Error: could not write " + target + ": " + e.getMessage());
            return 1;
        }
    }
}
