package com.propertyintel.housekeeping.runner;

import com.propertyintel.housekeeping.config.HousekeepingReportProperties;
import com.propertyintel.housekeeping.exception.SourceNotFoundException;
import com.propertyintel.housekeeping.service.ReportService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReportRunnerTest {

    private HousekeepingReportProperties properties;
    private ReportService reportService;
    private ReportRunner runner;

    @BeforeEach
    void setUp() {
        properties = new HousekeepingReportProperties();
        reportService = mock(ReportService.class);
        runner = new ReportRunner(reportService, properties);
    }

    @Test
    void applyOptions_overridesProperties() {
        runner.applyOptions(new DefaultApplicationArguments(
                "--housekeeping=hk.csv", "--room-usage=usage.csv", "--out=/tmp/out", "--top=3"));

        assertThat(properties.getInput().getHousekeepingCsv()).isEqualTo("hk.csv");
        assertThat(properties.getInput().getRoomUsageCsv()).isEqualTo("usage.csv");
        assertThat(properties.getOutput().getBaseDir()).isEqualTo("/tmp/out");
        assertThat(properties.getTopN()).isEqualTo(3);
    }

    @Test
    void applyOptions_keepsDefaultsWithoutOptions() {
        runner.applyOptions(new DefaultApplicationArguments());

        assertThat(properties.getInput().getHousekeepingCsv()).isEqualTo("Housekeeping Change Log.csv");
        assertThat(properties.getInput().getRoomUsageCsv()).isEqualTo("Room Usage.csv");
        assertThat(properties.getOutput().getBaseDir()).isEqualTo("reports");
        assertThat(properties.getTopN()).isEqualTo(10);
    }

    @Test
    void applyOptions_topIsAtLeastOne() {
        runner.applyOptions(new DefaultApplicationArguments("--top=0"));

        assertThat(properties.getTopN()).isEqualTo(1);
    }

    @Test
    void applyOptions_ignoresNonNumericTop() {
        runner.applyOptions(new DefaultApplicationArguments("--top=many"));

        assertThat(properties.getTopN()).isEqualTo(10);
    }

    @Test
    void run_passesResolvedPaths() throws Exception {
        when(reportService.run(any(), any()))
                .thenReturn(new ReportService.ReportResult(Path.of("reports", "report_20250317_063000"), List.of(), null));

        runner.run(new DefaultApplicationArguments("--housekeeping=a.csv", "--room-usage=b.csv"));

        verify(reportService).run(Path.of("a.csv"), Path.of("b.csv"));
    }

    @Test
    void run_propagatesFailures() {
        when(reportService.run(any(), any())).thenThrow(new SourceNotFoundException(Path.of("a.csv")));

        assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments("--housekeeping=a.csv")))
                .isInstanceOf(SourceNotFoundException.class);
    }
}
