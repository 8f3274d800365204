package com.propertyintel.housekeeping.output;

import com.propertyintel.housekeeping.exception.ReportWriteException;
import com.propertyintel.housekeeping.model.ReportPayload;
import com.propertyintel.housekeeping.model.ReportTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Writes every artifact of a report run into its own timestamped folder:
 * one CSV per table, one PNG per chart, then report.html.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReportWriter {

    private static final DateTimeFormatter RUN_DIR_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final CsvWriter csvWriter;
    private final ChartRenderer chartRenderer;
    private final HtmlReportWriter htmlReportWriter;

    /** {baseDir}/report_{yyyyMMdd_HHmmss} */
    public Path createRunDirectory(Path baseDir, LocalDateTime now) {
        Path dir = baseDir.resolve("report_" + now.format(RUN_DIR_FORMAT));
        try {
            Files.createDirectories(dir);
            return dir;
        } catch (IOException e) {
            throw new ReportWriteException("Cannot create output directory: " + dir, e);
        }
    }

    public List<Path> write(ReportPayload payload, Path outputDir) {
        List<Path> files = new ArrayList<>();

        for (ReportTable table : payload.getTables().values()) {
            files.add(csvWriter.write(table, outputDir));
        }
        log.info("Written {} CSV summaries to {}", files.size(), outputDir);

        List<Path> charts = chartRenderer.render(payload.allCharts(), outputDir);
        files.addAll(charts);

        Set<String> renderedNames = charts.stream()
                .map(p -> p.getFileName().toString())
                .collect(Collectors.toSet());
        files.add(htmlReportWriter.write(payload, outputDir, renderedNames));

        return List.copyOf(files);
    }
}
