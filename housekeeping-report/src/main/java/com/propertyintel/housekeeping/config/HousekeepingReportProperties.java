package com.propertyintel.housekeeping.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "housekeeping-report")
@Data
public class HousekeepingReportProperties {

    private Input input = new Input();
    private Output output = new Output();
    private Rotation rotation = new Rotation();
    private Runner runner = new Runner();

    /** How many rows appear in top-N charts and tables. Values below 1 are treated as 1. */
    private int topN = 10;

    public int effectiveTopN() {
        return Math.max(1, topN);
    }

    @Data
    public static class Input {
        private String housekeepingCsv = "Housekeeping Change Log.csv";
        private String roomUsageCsv = "Room Usage.csv";
        /** Primary format of the housekeeping Date column, e.g. 03/14/2025 07:45 */
        private String dateFormat = "M/d/yyyy H:mm";
        private boolean anonymizeNames = false;
    }

    @Data
    public static class Output {
        private String baseDir = "reports";
        private boolean includeHeader = true;
        private String title = "Housekeeping & Room Usage Report";
        private int htmlMaxRows = 200;
        private int rotationTableMaxRows = 50;
    }

    /**
     * Rotation quality bands are inclusive-lower / exclusive-upper:
     * [0, veryLowUpper) Very Low, [veryLowUpper, lowUpper) Low,
     * [lowUpper, moderateUpper) Moderate, [moderateUpper, 1] High.
     */
    @Data
    public static class Rotation {
        private double veryLowUpper = 0.20;
        private double lowUpper = 0.40;
        private double moderateUpper = 0.60;
        private int calloutMinActions = 10;
        private int calloutLimit = 8;
    }

    @Data
    public static class Runner {
        private boolean enabled = true;
    }
}
