package com.propertyintel.housekeeping.service;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import com.propertyintel.housekeeping.exception.SourceNotFoundException;
import com.propertyintel.housekeeping.model.RawTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads a property-management CSV export into an untyped {@link RawTable}.
 *
 * The first line is the header. Exports saved from Excel often start with a
 * UTF-8 BOM and pad headers with spaces, so header names are trimmed and the
 * BOM dropped. Blank lines are skipped; short rows are padded to header width.
 */
@Component
@Slf4j
public class CsvTableReader {

    private static final char BOM = '\uFEFF';

    /** Fails fast when the file is missing, before anything is parsed. */
    public void requireExists(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new SourceNotFoundException(path);
        }
    }

    public RawTable read(Path path) {
        requireExists(path);

        List<String[]> lines;
        try (CSVReader reader = new CSVReader(
                new InputStreamReader(Files.newInputStream(path), StandardCharsets.UTF_8))) {
            lines = reader.readAll();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        } catch (CsvException e) {
            throw new IllegalArgumentException("Malformed CSV in " + path + ": " + e.getMessage(), e);
        }

        String source = path.getFileName().toString();
        if (lines.isEmpty()) {
            log.warn("{} is empty", source);
            return new RawTable(source, List.of(), List.of());
        }

        List<String> columns = Arrays.stream(lines.get(0)).map(this::cleanHeader).toList();

        List<String[]> rows = new ArrayList<>();
        int blank = 0;
        for (int i = 1; i < lines.size(); i++) {
            String[] cols = lines.get(i);
            if (isBlank(cols)) {
                blank++;
                continue;
            }
            rows.add(cols.length >= columns.size() ? cols : pad(cols, columns.size()));
        }

        log.info("Parsed {} rows from {} ({} blank lines skipped)", rows.size(), source, blank);
        return new RawTable(source, columns, rows);
    }

    private String cleanHeader(String header) {
        if (header == null) return "";
        String h = header.trim();
        if (!h.isEmpty() && h.charAt(0) == BOM) h = h.substring(1).trim();
        return h;
    }

    private boolean isBlank(String[] cols) {
        return Arrays.stream(cols).allMatch(c -> c == null || c.isBlank());
    }

    private String[] pad(String[] cols, int width) {
        String[] padded = new String[width];
        Arrays.fill(padded, "");
        System.arraycopy(cols, 0, padded, 0, cols.length);
        return padded;
    }
}
