package com.propertyintel.housekeeping.service;

import com.propertyintel.housekeeping.config.HousekeepingReportProperties;
import com.propertyintel.housekeeping.model.ChangeSummary;
import com.propertyintel.housekeeping.model.ChartSpec;
import com.propertyintel.housekeeping.model.HousekeepingAnalysis;
import com.propertyintel.housekeeping.model.HousekeepingFact;
import com.propertyintel.housekeeping.model.Kpi;
import com.propertyintel.housekeeping.model.NightsSummary;
import com.propertyintel.housekeeping.model.ReportPayload;
import com.propertyintel.housekeeping.model.ReportTable;
import com.propertyintel.housekeeping.model.RoomNights;
import com.propertyintel.housekeeping.model.RoomUsageAnalysis;
import com.propertyintel.housekeeping.model.RoomUsageFact;
import com.propertyintel.housekeeping.model.RotationRecord;
import com.propertyintel.housekeeping.model.TransitionMatrix;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static com.propertyintel.housekeeping.model.ReportPayload.*;

/**
 * Merges every aggregate into the single {@link ReportPayload} handed to the writers.
 *
 * Table names, CSV file names, chart file names and their order are fixed so
 * two runs over the same input lay out identically. No file is touched here.
 */
@Component
@RequiredArgsConstructor
public class ReportAssembler {

    private static final List<String> CHANGE_COLUMNS = List.of("rows", "unique_rooms", "changed", "change_rate");

    private final HousekeepingReportProperties properties;

    public ReportPayload assemble(HousekeepingAnalysis hsk, RoomUsageAnalysis usage, LocalDateTime generatedAt) {
        List<Kpi> hskKpis = housekeepingKpis(hsk);
        List<Kpi> usageKpis = roomUsageKpis(usage);

        Map<String, ReportTable> tables = new LinkedHashMap<>();
        put(tables, kpiTable(HSK_KPIS, "summary_kpis.csv", hskKpis));
        put(tables, changeTable(BY_DAY, "summary_by_day.csv", "Day", hsk.getByDay()));
        put(tables, changeTable(BY_ROOM_TYPE, "summary_by_room_type.csv", "Room Type", hsk.getByRoomType()));
        put(tables, changeTable(BY_HK_AFTER, "summary_by_hk_after.csv", "Housekeeper After", hsk.getByClosingHousekeeper()));
        put(tables, changeTable(BY_USER, "summary_by_user.csv", "Username", hsk.getByUsername()));
        put(tables, matrixTable(hsk.getTransitionMatrix()));
        put(tables, kpiTable(USAGE_KPIS, "room_usage_kpis.csv", usageKpis));
        put(tables, nightsTable(USAGE_BY_ROOM_TYPE, "room_usage_by_room_type.csv", "Room Type", "rows", usage.getByRoomType()));
        put(tables, topRoomsTable(usage.getTopRooms()));
        put(tables, nightsTable(USAGE_BY_FEATURE, "room_usage_by_feature.csv", "Feature", "mentions", usage.getByFeature()));
        put(tables, rotationTable(hsk.getRotation()));

        return ReportPayload.builder()
                .title(properties.getOutput().getTitle())
                .generatedAt(generatedAt)
                .housekeepingKpis(hskKpis)
                .housekeepingNotes(housekeepingNotes(hsk))
                .housekeepingCharts(housekeepingCharts(hsk))
                .roomUsageKpis(usageKpis)
                .roomUsageNotes(roomUsageNotes(usage))
                .roomUsageCharts(roomUsageCharts(usage))
                .rotationChart(rotationChart(hsk.getRotation()))
                .rotationCallouts(hsk.getRotationCallouts())
                .calloutMinActions(properties.getRotation().getCalloutMinActions())
                .tables(tables)
                .build();
    }

    // ── KPIs ─────────────────────────────────────────────────────────────────

    List<Kpi> housekeepingKpis(HousekeepingAnalysis hsk) {
        List<HousekeepingFact> facts = hsk.getFacts();
        long changed = facts.stream().filter(HousekeepingFact::isChanged).count();
        List<ChangeSummary> days = realDays(hsk.getByDay());

        return List.of(
                new Kpi("rows", String.valueOf(facts.size())),
                new Kpi("changed_rows", String.valueOf(changed)),
                new Kpi("change_rate", Numbers.format(Numbers.ratio(changed, facts.size(), 4))),
                new Kpi("unique_rooms", String.valueOf(facts.stream().map(HousekeepingFact::roomNumber).distinct().count())),
                new Kpi("unique_users", String.valueOf(hsk.getByUsername().size())),
                new Kpi("date_parse_success_rate", Numbers.format(Numbers.round(hsk.getDateParseSuccessRate(), 4))),
                new Kpi("first_day", days.isEmpty() ? "n/a" : days.get(0).getKey()),
                new Kpi("last_day", days.isEmpty() ? "n/a" : days.get(days.size() - 1).getKey())
        );
    }

    List<Kpi> roomUsageKpis(RoomUsageAnalysis usage) {
        List<RoomUsageFact> facts = usage.getFacts();
        long rooms = facts.stream().map(RoomUsageFact::roomNumber).distinct().count();
        double nights = facts.stream().mapToDouble(RoomUsageFact::getNights).sum();

        return List.of(
                new Kpi("rows", String.valueOf(facts.size())),
                new Kpi("unique_rooms", String.valueOf(rooms)),
                new Kpi("room_types", String.valueOf(usage.getByRoomType().size())),
                new Kpi("total_nights", Numbers.format(Numbers.round(nights, 4))),
                new Kpi("avg_nights_per_room", Numbers.format(Numbers.ratio(nights, rooms, 2))),
                new Kpi("distinct_features", String.valueOf(usage.getByFeature().size())),
                new Kpi("unparsable_nights", String.valueOf(facts.stream().filter(RoomUsageFact::isNightsUnparsable).count()))
        );
    }

    // ── Executive notes ──────────────────────────────────────────────────────

    List<String> housekeepingNotes(HousekeepingAnalysis hsk) {
        List<String> notes = new ArrayList<>();

        first(hsk.getByRoomType()).ifPresent(t -> notes.add(String.format(Locale.ROOT,
                "Most changed room type: %s (%d changes across %d rows, %s changed).",
                t.getKey(), t.getChanged(), t.getRows(), percent(t.getChangeRate()))));

        first(hsk.getByClosingHousekeeper()).ifPresent(h -> notes.add(String.format(Locale.ROOT,
                "Top closing housekeeper: %s (%d changes).", h.getKey(), h.getChanged())));

        first(hsk.getByUsername()).ifPresent(u -> notes.add(String.format(Locale.ROOT,
                "Most active username: %s (%d actions, %d changes).", u.getKey(), u.getRows(), u.getChanged())));

        hsk.getChangedTransitions().entrySet().stream().findFirst().ifPresent(e -> notes.add(String.format(Locale.ROOT,
                "Most common status change: %s (%d rows).", e.getKey(), e.getValue())));

        List<ChangeSummary> days = realDays(hsk.getByDay());
        if (!days.isEmpty()) {
            notes.add(String.format(Locale.ROOT, "Date coverage: %s to %s (%d days with activity).",
                    days.get(0).getKey(), days.get(days.size() - 1).getKey(), days.size()));
        }

        long unparsed = hsk.getFacts().stream().filter(f -> f.getTimestamp() == null).count();
        if (unparsed > 0) {
            notes.add(String.format(Locale.ROOT,
                    "%d rows have an unreadable Date and are grouped under %s in the daily view.",
                    unparsed, ChangeLogAggregator.UNPARSED_DAY));
        }

        first(hsk.getRotationCallouts()).ifPresent(r -> notes.add(String.format(Locale.ROOT,
                "Lowest room rotation with %d+ actions: %s (%d unique rooms / %d actions = %s, %s).",
                properties.getRotation().getCalloutMinActions(), r.getUsername(), r.getUniqueRooms(),
                r.getTotalActions(), Numbers.format(r.getRoomUniquenessRate()), r.getRotationQuality().getLabel())));

        return List.copyOf(notes);
    }

    List<String> roomUsageNotes(RoomUsageAnalysis usage) {
        List<String> notes = new ArrayList<>();

        first(usage.getByRoomType()).ifPresent(t -> notes.add(String.format(Locale.ROOT,
                "Most used room type: %s (%s nights across %d rooms).",
                t.getKey(), Numbers.format(t.getTotalNights()), t.getRooms())));

        first(usage.getTopRooms()).ifPresent(r -> notes.add(String.format(Locale.ROOT,
                "Most used room: %s (%s, %s nights).",
                r.getRoomNumber(), r.getRoomType(), Numbers.format(r.getTotalNights()))));

        first(usage.getByFeature()).ifPresent(f -> notes.add(String.format(Locale.ROOT,
                "Top feature: %s (%s nights, %d mentions).",
                f.getKey(), Numbers.format(f.getTotalNights()), f.getCount())));

        return List.copyOf(notes);
    }

    // ── Charts ───────────────────────────────────────────────────────────────

    List<ChartSpec> housekeepingCharts(HousekeepingAnalysis hsk) {
        int n = properties.effectiveTopN();
        List<ChartSpec> charts = new ArrayList<>();

        List<ChangeSummary> days = realDays(hsk.getByDay());
        if (!days.isEmpty()) {
            charts.add(ChartSpec.builder()
                    .title("Actions and changes by day")
                    .fileName("hsk_by_day.png")
                    .kind(ChartSpec.Kind.LINE)
                    .categoryAxisLabel("Day")
                    .valueAxisLabel("Rows")
                    .categories(keys(days, ChangeSummary::getKey))
                    .series(series("rows", values(days, ChangeSummary::getRows), "changed", values(days, ChangeSummary::getChanged)))
                    .build());
        }
        addChangeChart(charts, "Top room types by changes", "hsk_top_room_types.png", "Room Type",
                top(hsk.getByRoomType(), n), "changed", ChangeSummary::getChanged);
        addChangeChart(charts, "Top housekeepers (After) by changes", "hsk_top_hk_after.png", "Housekeeper After",
                top(hsk.getByClosingHousekeeper(), n), "changed", ChangeSummary::getChanged);
        addChangeChart(charts, "Top usernames by actions", "hsk_top_users.png", "Username",
                top(hsk.getByUsername(), n), "rows", ChangeSummary::getRows);
        return List.copyOf(charts);
    }

    List<ChartSpec> roomUsageCharts(RoomUsageAnalysis usage) {
        int n = properties.effectiveTopN();
        List<ChartSpec> charts = new ArrayList<>();

        List<NightsSummary> types = top(usage.getByRoomType(), n);
        if (!types.isEmpty()) {
            charts.add(barChart("Nights by room type", "usage_nights_by_room_type.png", "Room Type",
                    keys(types, NightsSummary::getKey), "total_nights", values(types, NightsSummary::getTotalNights)));
        }
        List<RoomNights> rooms = usage.getTopRooms();
        if (!rooms.isEmpty()) {
            charts.add(barChart("Top rooms by nights", "usage_top_rooms.png", "Room Number",
                    keys(rooms, RoomNights::getRoomNumber), "total_nights", values(rooms, RoomNights::getTotalNights)));
        }
        List<NightsSummary> features = usage.getTopFeatures();
        if (!features.isEmpty()) {
            charts.add(barChart("Top features by nights", "usage_top_features.png", "Feature",
                    keys(features, NightsSummary::getKey), "total_nights", values(features, NightsSummary::getTotalNights)));
        }
        return List.copyOf(charts);
    }

    ChartSpec rotationChart(List<RotationRecord> rotation) {
        if (rotation.isEmpty()) return null;
        List<RotationRecord> shown = top(rotation, properties.effectiveTopN());
        return ChartSpec.builder()
                .title("Room uniqueness rate by username")
                .fileName("rotation_uniqueness_by_user.png")
                .kind(ChartSpec.Kind.HORIZONTAL_BAR)
                .categoryAxisLabel("Username")
                .valueAxisLabel("Rate")
                .categories(keys(shown, RotationRecord::getUsername))
                .series(series(
                        "room_uniqueness_rate", values(shown, RotationRecord::getRoomUniquenessRate),
                        "room_randomness", values(shown, RotationRecord::getRoomRandomness)))
                .build();
    }

    // ── Tables ───────────────────────────────────────────────────────────────

    private ReportTable kpiTable(String name, String fileName, List<Kpi> kpis) {
        return new ReportTable(name, fileName,
                kpis.stream().map(Kpi::getName).toList(),
                List.of(kpis.stream().map(Kpi::getValue).toList()));
    }

    private ReportTable changeTable(String name, String fileName, String keyColumn, List<ChangeSummary> groups) {
        List<String> columns = new ArrayList<>();
        columns.add(keyColumn);
        columns.addAll(CHANGE_COLUMNS);
        return new ReportTable(name, fileName, columns, groups.stream()
                .map(g -> List.of(g.getKey(), String.valueOf(g.getRows()), String.valueOf(g.getUniqueRooms()),
                        String.valueOf(g.getChanged()), Numbers.format(g.getChangeRate())))
                .toList());
    }

    private ReportTable matrixTable(TransitionMatrix matrix) {
        List<String> columns = new ArrayList<>();
        columns.add("HSK Status Before");
        columns.addAll(matrix.getAfterStatuses());

        List<List<String>> rows = new ArrayList<>();
        for (String before : matrix.getBeforeStatuses()) {
            List<String> row = new ArrayList<>();
            row.add(before);
            for (String after : matrix.getAfterStatuses()) {
                row.add(String.valueOf(matrix.count(before, after)));
            }
            rows.add(row);
        }
        return new ReportTable(TRANSITION_MATRIX, "summary_hsk_transition_matrix.csv", columns, rows);
    }

    private ReportTable nightsTable(String name, String fileName, String keyColumn, String countColumn,
                                    List<NightsSummary> groups) {
        return new ReportTable(name, fileName,
                List.of(keyColumn, countColumn, "rooms", "total_nights", "avg_nights_per_room"),
                groups.stream()
                        .map(g -> List.of(g.getKey(), String.valueOf(g.getCount()), String.valueOf(g.getRooms()),
                                Numbers.format(g.getTotalNights()), Numbers.format(g.getAvgNightsPerRoom())))
                        .toList());
    }

    private ReportTable topRoomsTable(List<RoomNights> rooms) {
        return new ReportTable(USAGE_TOP_ROOMS, "room_usage_top_rooms.csv",
                List.of("Room Number", "Room Type", "stays", "total_nights"),
                rooms.stream()
                        .map(r -> List.of(r.getRoomNumber(), r.getRoomType(), String.valueOf(r.getStays()),
                                Numbers.format(Numbers.round(r.getTotalNights(), 4))))
                        .toList());
    }

    private ReportTable rotationTable(List<RotationRecord> rotation) {
        return new ReportTable(UNIQUENESS_BY_USER, "username_room_rotation_uniqueness.csv",
                List.of("Username", "total_actions", "unique_rooms", "status_changes", "room_uniqueness_rate",
                        "rotation_quality", "room_randomness", "room_randomness_rank"),
                rotation.stream()
                        .map(r -> List.of(r.getUsername(), String.valueOf(r.getTotalActions()),
                                String.valueOf(r.getUniqueRooms()), String.valueOf(r.getStatusChanges()),
                                Numbers.format(r.getRoomUniquenessRate()), r.getRotationQuality().getLabel(),
                                Numbers.format(r.getRoomRandomness()), String.valueOf(r.getRoomRandomnessRank())))
                        .toList());
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private void put(Map<String, ReportTable> tables, ReportTable table) {
        tables.put(table.getName(), table);
    }

    private void addChangeChart(List<ChartSpec> charts, String title, String fileName, String axis,
                                List<ChangeSummary> groups, String seriesName,
                                Function<ChangeSummary, Number> value) {
        if (groups.isEmpty()) return;
        charts.add(barChart(title, fileName, axis, keys(groups, ChangeSummary::getKey), seriesName, values(groups, value)));
    }

    private ChartSpec barChart(String title, String fileName, String axis, List<String> categories,
                               String seriesName, List<Number> values) {
        return ChartSpec.builder()
                .title(title)
                .fileName(fileName)
                .kind(ChartSpec.Kind.BAR)
                .categoryAxisLabel(axis)
                .valueAxisLabel(seriesName)
                .categories(categories)
                .series(series(seriesName, values))
                .build();
    }

    private static Map<String, List<Number>> series(String name, List<Number> values) {
        Map<String, List<Number>> series = new LinkedHashMap<>();
        series.put(name, values);
        return series;
    }

    private static Map<String, List<Number>> series(String name, List<Number> values,
                                                    String secondName, List<Number> secondValues) {
        Map<String, List<Number>> series = series(name, values);
        series.put(secondName, secondValues);
        return series;
    }

    private static <T> List<String> keys(List<T> items, Function<T, String> key) {
        return items.stream().map(key).toList();
    }

    private static <T> List<Number> values(List<T> items, Function<T, ? extends Number> value) {
        return items.stream().<Number>map(value).toList();
    }

    private static <T> List<T> top(List<T> items, int n) {
        return items.size() <= n ? items : items.subList(0, n);
    }

    private static <T> Optional<T> first(List<T> items) {
        return items.isEmpty() ? Optional.empty() : Optional.of(items.get(0));
    }

    private static List<ChangeSummary> realDays(List<ChangeSummary> byDay) {
        return byDay.stream().filter(d -> !ChangeLogAggregator.UNPARSED_DAY.equals(d.getKey())).toList();
    }

    private static String percent(double rate) {
        return String.format(Locale.ROOT, "%.1f%%", rate * 100);
    }
}
