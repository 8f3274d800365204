package com.propertyintel.housekeeping.runner;

import com.propertyintel.housekeeping.config.HousekeepingReportProperties;
import com.propertyintel.housekeeping.service.ReportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Command-line entry: builds one report on startup and exits.
 *
 * Short options override the bound properties:
 *   --housekeeping=&lt;csv&gt;  --room-usage=&lt;csv&gt;  --out=&lt;dir&gt;  --top=&lt;n&gt;
 *
 * A missing input file or column propagates out of the runner, which makes
 * SpringApplication.run fail and the process exit non-zero.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "housekeeping-report.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ReportRunner implements ApplicationRunner {

    private final ReportService reportService;
    private final HousekeepingReportProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        applyOptions(args);

        ReportService.ReportResult result = reportService.run(
                Path.of(properties.getInput().getHousekeepingCsv()),
                Path.of(properties.getInput().getRoomUsageCsv()));

        log.info("Output directory: {}", result.outputDir().toAbsolutePath());
        result.files().forEach(f -> log.info("  {}", f.getFileName()));
    }

    void applyOptions(ApplicationArguments args) {
        option(args, "housekeeping").ifPresent(v -> properties.getInput().setHousekeepingCsv(v));
        option(args, "room-usage").ifPresent(v -> properties.getInput().setRoomUsageCsv(v));
        option(args, "out").ifPresent(v -> properties.getOutput().setBaseDir(v));
        option(args, "top").ifPresent(v -> {
            try {
                properties.setTopN(Math.max(1, Integer.parseInt(v.trim())));
            } catch (NumberFormatException e) {
                log.warn("Ignoring non-numeric --top value '{}', keeping {}", v, properties.effectiveTopN());
            }
        });
    }

    private Optional<String> option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) return Optional.empty();
        return Optional.of(values.get(values.size() - 1));
    }
}
