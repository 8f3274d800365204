package com.propertyintel.housekeeping.output;

import com.propertyintel.housekeeping.config.HousekeepingReportProperties;
import com.propertyintel.housekeeping.exception.ReportWriteException;
import com.propertyintel.housekeeping.model.ChartSpec;
import com.propertyintel.housekeeping.model.ReportPayload;
import com.propertyintel.housekeeping.model.ReportTable;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Renders report.html from {@code templates/report.html}.
 * <p>
 * Every payload value reaches the page through {@code th:text}, which HTML-escapes
 * it, so names and statuses from the export can never inject markup.
 * Only charts that were actually rendered are referenced.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class HtmlReportWriter {

    static final String REPORT_FILE = "report.html";

    private static final String TEMPLATE_PREFIX = "templates/";
    private static final String TEMPLATE_SUFFIX = ".html";
    private static final String TEMPLATE_NAME = "report";
    private static final DateTimeFormatter GENERATED_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final HousekeepingReportProperties properties;

    private TemplateEngine templateEngine;

    @PostConstruct
    void initializeTemplateEngine() {
        ClassLoaderTemplateResolver resolver = new ClassLoaderTemplateResolver();
        resolver.setPrefix(TEMPLATE_PREFIX);
        resolver.setSuffix(TEMPLATE_SUFFIX);
        resolver.setTemplateMode(TemplateMode.HTML);
        resolver.setCharacterEncoding(StandardCharsets.UTF_8.name());
        resolver.setCheckExistence(true);

        templateEngine = new TemplateEngine();
        templateEngine.setTemplateResolver(resolver);
        log.debug("Report template engine initialized with prefix {}", TEMPLATE_PREFIX);
    }

    public Path write(ReportPayload payload, Path outputDir, Set<String> renderedCharts) {
        Path target = outputDir.resolve(REPORT_FILE);
        String html = render(payload, outputDir.getFileName().toString(), renderedCharts);
        try {
            Files.writeString(target, html, StandardCharsets.UTF_8);
            log.info("HTML report written: {}", target);
            return target;
        } catch (IOException e) {
            throw new ReportWriteException("Error writing the HTML report: " + target, e);
        }
    }

    String render(ReportPayload payload, String folderName, Set<String> renderedCharts) {
        int maxRows = Math.max(1, properties.getOutput().getHtmlMaxRows());

        Map<String, ReportTable> tables = new LinkedHashMap<>();
        payload.getTables().forEach((name, table) -> tables.put(name, table.limit(maxRows)));
        ReportTable rotation = payload.table(ReportPayload.UNIQUENESS_BY_USER);
        if (rotation != null) {
            tables.put(ReportPayload.UNIQUENESS_BY_USER,
                    rotation.limit(Math.max(1, properties.getOutput().getRotationTableMaxRows())));
        }

        Context context = new Context(Locale.ROOT);
        context.setVariable("title", payload.getTitle());
        context.setVariable("generatedAt", payload.getGeneratedAt().format(GENERATED_FORMAT));
        context.setVariable("folderName", folderName);
        context.setVariable("hskKpis", payload.getHousekeepingKpis());
        context.setVariable("hskNotes", payload.getHousekeepingNotes());
        context.setVariable("hskCharts", rendered(payload.getHousekeepingCharts(), renderedCharts));
        context.setVariable("usageKpis", payload.getRoomUsageKpis());
        context.setVariable("usageNotes", payload.getRoomUsageNotes());
        context.setVariable("usageCharts", rendered(payload.getRoomUsageCharts(), renderedCharts));
        context.setVariable("rotationChart", payload.getRotationChart() != null
                && renderedCharts.contains(payload.getRotationChart().getFileName()) ? payload.getRotationChart() : null);
        context.setVariable("callouts", payload.getRotationCallouts());
        context.setVariable("calloutMinActions", payload.getCalloutMinActions());
        context.setVariable("bands", properties.getRotation());
        context.setVariable("tables", tables);

        return templateEngine.process(TEMPLATE_NAME, context);
    }

    private List<ChartSpec> rendered(List<ChartSpec> charts, Set<String> renderedCharts) {
        return charts.stream().filter(c -> renderedCharts.contains(c.getFileName())).toList();
    }
}
