package com.propertyintel.housekeeping.output;

import com.opencsv.CSVWriter;
import com.propertyintel.housekeeping.config.HousekeepingReportProperties;
import com.propertyintel.housekeeping.exception.ReportWriteException;
import com.propertyintel.housekeeping.model.ReportTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes report tables to CSV files.
 *
 * Output path pattern: {runDir}/{table file name}
 * e.g. reports/report_20250314_074500/summary_by_day.csv
 *
 * Cells are already formatted by the assembler, so identical payloads produce
 * byte-identical files.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvWriter {

    private final HousekeepingReportProperties properties;

    public Path write(ReportTable table, Path outputDir) {
        Path outputPath = outputDir.resolve(table.getFileName());

        try (CSVWriter writer = new CSVWriter(
                Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getOutput().isIncludeHeader()) {
                writer.writeNext(table.getColumns().toArray(new String[0]));
            }

            for (var row : table.getRows()) {
                writer.writeNext(row.toArray(new String[0]));
            }

            log.debug("Written {} rows to CSV: {}", table.getRows().size(), outputPath);
            return outputPath;

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new ReportWriteException("CSV write failed: " + outputPath, e);
        }
    }
}
