package com.propertyintel.housekeeping.service;

import com.propertyintel.housekeeping.config.HousekeepingReportProperties;
import com.propertyintel.housekeeping.output.ChartRenderer;
import com.propertyintel.housekeeping.output.CsvWriter;
import com.propertyintel.housekeeping.output.HtmlReportWriter;
import com.propertyintel.housekeeping.output.HtmlWriters;
import com.propertyintel.housekeeping.output.ReportWriter;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Wires the report pipeline by hand, the same way the application context does.
 */
public final class TestPipeline {

    public static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 17, 6, 30, 0);

    private TestPipeline() {
    }

    public static Clock fixedClock() {
        return Clock.fixed(Instant.parse("2025-03-17T06:30:00Z"), ZoneOffset.UTC);
    }

    public static ReportService reportService(HousekeepingReportProperties properties, Clock clock) {
        return new ReportService(
                new CsvTableReader(),
                new RowNormalizer(properties, new NameAnonymizer()),
                new FactDeriver(properties),
                new ChangeLogAggregator(),
                new RoomUsageAggregator(),
                new RotationScorer(properties),
                new ReportAssembler(properties),
                reportWriter(properties),
                properties,
                clock);
    }

    public static ReportWriter reportWriter(HousekeepingReportProperties properties) {
        HtmlReportWriter html = htmlReportWriter(properties);
        return new ReportWriter(new CsvWriter(properties), new ChartRenderer(), html);
    }

    public static HtmlReportWriter htmlReportWriter(HousekeepingReportProperties properties) {
        return HtmlWriters.initialized(properties);
    }
}
