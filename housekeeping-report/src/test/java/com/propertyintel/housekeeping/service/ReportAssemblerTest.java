package com.propertyintel.housekeeping.service;

import com.propertyintel.housekeeping.config.HousekeepingReportProperties;
import com.propertyintel.housekeeping.model.ChartSpec;
import com.propertyintel.housekeeping.model.HousekeepingAnalysis;
import com.propertyintel.housekeeping.model.HousekeepingRow;
import com.propertyintel.housekeeping.model.Kpi;
import com.propertyintel.housekeeping.model.ReportPayload;
import com.propertyintel.housekeeping.model.ReportTable;
import com.propertyintel.housekeeping.model.RoomUsageAnalysis;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.propertyintel.housekeeping.service.TestRows.hsk;
import static com.propertyintel.housekeeping.service.TestRows.usage;
import static org.assertj.core.api.Assertions.assertThat;

class ReportAssemblerTest {

    private HousekeepingReportProperties properties;
    private ReportService service;
    private ReportAssembler assembler;

    private HousekeepingAnalysis hsk;
    private RoomUsageAnalysis usage;

    @BeforeEach
    void setUp() {
        properties = new HousekeepingReportProperties();
        service = TestPipeline.reportService(properties, TestPipeline.fixedClock());
        assembler = new ReportAssembler(properties);

        hsk = service.analyzeHousekeeping(List.of(
                hsk("101", "King", "Dirty", "Clean", "alice", "03/15/2025 08:00"),
                hsk("101", "King", "Clean", "Clean", "alice", "03/15/2025 09:00"),
                hsk("102", "King", "Clean", "Inspected", "bob", "03/14/2025 10:00"),
                hsk("201", "Suite", "Dirty", "Clean", "bob", "03/14/2025 11:00"),
                hsk("202", "Suite", "Dirty", "Clean", "carol", "garbage"),
                hsk("203", "Double", "Clean", "Clean", "carol", "03/16/2025 12:00"),
                hsk("204", "Double", "Dirty", "Inspected", "carol", "03/16/2025 13:00")));
        usage = service.analyzeRoomUsage(List.of(
                usage("R1", "Suite", "3", "Ocean/View"),
                usage("R2", "Suite", "2", "Ocean"),
                usage("K1", "King", "n/a", "")));
    }

    @Test
    @DisplayName("tables come out in a fixed order with fixed CSV names")
    void tableLayout() {
        ReportPayload payload = assembler.assemble(hsk, usage, TestPipeline.NOW);

        assertThat(payload.getTables().keySet()).containsExactly(
                ReportPayload.HSK_KPIS, ReportPayload.BY_DAY, ReportPayload.BY_ROOM_TYPE,
                ReportPayload.BY_HK_AFTER, ReportPayload.BY_USER, ReportPayload.TRANSITION_MATRIX,
                ReportPayload.USAGE_KPIS, ReportPayload.USAGE_BY_ROOM_TYPE, ReportPayload.USAGE_TOP_ROOMS,
                ReportPayload.USAGE_BY_FEATURE, ReportPayload.UNIQUENESS_BY_USER);
        assertThat(payload.getTables().values()).extracting(ReportTable::getFileName).containsExactly(
                "summary_kpis.csv", "summary_by_day.csv", "summary_by_room_type.csv", "summary_by_hk_after.csv",
                "summary_by_user.csv", "summary_hsk_transition_matrix.csv", "room_usage_kpis.csv",
                "room_usage_by_room_type.csv", "room_usage_top_rooms.csv", "room_usage_by_feature.csv",
                "username_room_rotation_uniqueness.csv");
    }

    @Test
    void housekeepingKpis() {
        List<Kpi> kpis = assembler.housekeepingKpis(hsk);

        assertThat(kpis).extracting(Kpi::getName).containsExactly("rows", "changed_rows", "change_rate",
                "unique_rooms", "unique_users", "date_parse_success_rate", "first_day", "last_day");
        assertThat(kpis).extracting(Kpi::getValue)
                .containsExactly("7", "5", "0.7143", "6", "3", "0.8571", "2025-03-14", "2025-03-16");
    }

    @Test
    void roomUsageKpis() {
        List<Kpi> kpis = assembler.roomUsageKpis(usage);

        assertThat(kpis).extracting(Kpi::getName).containsExactly("rows", "unique_rooms", "room_types",
                "total_nights", "avg_nights_per_room", "distinct_features", "unparsable_nights");
        assertThat(kpis).extracting(Kpi::getValue).containsExactly("3", "3", "2", "5", "1.67", "2", "1");
    }

    @Test
    void changeTableCells() {
        ReportTable byType = assembler.assemble(hsk, usage, TestPipeline.NOW).table(ReportPayload.BY_ROOM_TYPE);

        assertThat(byType.getColumns()).containsExactly("Room Type", "rows", "unique_rooms", "changed", "change_rate");
        assertThat(byType.getRows().get(0)).containsExactly("King", "3", "2", "2", "0.6667");
    }

    @Test
    @DisplayName("transition matrix has a row per Before status and a column per After status")
    void matrixTable() {
        ReportTable matrix = assembler.assemble(hsk, usage, TestPipeline.NOW).table(ReportPayload.TRANSITION_MATRIX);

        assertThat(matrix.getColumns()).containsExactly("HSK Status Before", "Clean", "Inspected");
        assertThat(matrix.getRows()).containsExactly(
                List.of("Clean", "2", "1"),
                List.of("Dirty", "3", "1"));
    }

    @Test
    void rotationTable() {
        ReportTable rotation = assembler.assemble(hsk, usage, TestPipeline.NOW).table(ReportPayload.UNIQUENESS_BY_USER);

        assertThat(rotation.getColumns()).containsExactly("Username", "total_actions", "unique_rooms",
                "status_changes", "room_uniqueness_rate", "rotation_quality", "room_randomness",
                "room_randomness_rank");
        // alice: 2 actions on room 101
        assertThat(rotation.getRows().get(0)).containsExactly("alice", "2", "1", "1", "0.5", "Moderate", "0", "3");
    }

    @Test
    void notes() {
        List<String> notes = assembler.housekeepingNotes(hsk);

        assertThat(notes).contains(
                "Most changed room type: King (2 changes across 3 rows, 66.7% changed).",
                "Top closing housekeeper: carol (2 changes).",
                "Most active username: carol (3 actions, 2 changes).",
                "Most common status change: Dirty → Clean (3 rows).",
                "Date coverage: 2025-03-14 to 2025-03-16 (3 days with activity).");
        assertThat(notes).anyMatch(n -> n.startsWith("1 rows have an unreadable Date"));
        // nobody reaches the callout floor
        assertThat(notes).noneMatch(n -> n.startsWith("Lowest room rotation"));

        assertThat(assembler.roomUsageNotes(usage)).containsExactly(
                "Most used room type: Suite (5 nights across 2 rooms).",
                "Most used room: R1 (Suite, 3 nights).",
                "Top feature: Ocean (5 nights, 2 mentions).");
    }

    @Test
    @DisplayName("charts keep their report order and file names")
    void chartOrder() {
        ReportPayload payload = assembler.assemble(hsk, usage, TestPipeline.NOW);

        assertThat(payload.allCharts()).extracting(ChartSpec::getFileName).containsExactly(
                "hsk_by_day.png", "hsk_top_room_types.png", "hsk_top_hk_after.png", "hsk_top_users.png",
                "usage_nights_by_room_type.png", "usage_top_rooms.png", "usage_top_features.png",
                "rotation_uniqueness_by_user.png");

        ChartSpec byDay = payload.getHousekeepingCharts().get(0);
        assertThat(byDay.getKind()).isEqualTo(ChartSpec.Kind.LINE);
        assertThat(byDay.getCategories()).containsExactly("2025-03-14", "2025-03-15", "2025-03-16");
        assertThat(byDay.getSeries().keySet()).containsExactly("rows", "changed");
    }

    @Test
    void topNLimitsCharts() {
        properties.setTopN(1);

        List<ChartSpec> charts = assembler.housekeepingCharts(hsk);
        ChartSpec rotation = assembler.rotationChart(hsk.getRotation());

        assertThat(charts.get(1).getCategories()).containsExactly("King");
        assertThat(rotation.getCategories()).containsExactly("alice");
        assertThat(rotation.getSeries().keySet()).containsExactly("room_uniqueness_rate", "room_randomness");
    }

    @Test
    void calloutNoteNamesTheWorstRotator() {
        List<HousekeepingRow> rows = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            rows.add(hsk(i < 9 ? "101" : "102", "King", "Dirty", "Clean", "dave", "03/14/2025 08:00"));
        }
        HousekeepingAnalysis busy = service.analyzeHousekeeping(rows);

        assertThat(assembler.housekeepingNotes(busy))
                .contains("Lowest room rotation with 10+ actions: dave (2 unique rooms / 10 actions = 0.2, Low).");
    }

    @Test
    @DisplayName("empty inputs yield empty tables, no notes and no charts")
    void emptyInputs() {
        HousekeepingAnalysis emptyHsk = service.analyzeHousekeeping(List.of());
        RoomUsageAnalysis emptyUsage = service.analyzeRoomUsage(List.of());

        ReportPayload payload = assembler.assemble(emptyHsk, emptyUsage, TestPipeline.NOW);

        assertThat(payload.getTables()).hasSize(11);
        assertThat(payload.table(ReportPayload.BY_DAY).isEmpty()).isTrue();
        assertThat(payload.getHousekeepingNotes()).isEmpty();
        assertThat(payload.getRoomUsageNotes()).isEmpty();
        assertThat(payload.allCharts()).isEmpty();
        assertThat(payload.getRotationChart()).isNull();
        assertThat(payload.getHousekeepingKpis()).extracting(Kpi::getValue)
                .containsExactly("0", "0", "0", "0", "0", "0", "n/a", "n/a");
    }
}
