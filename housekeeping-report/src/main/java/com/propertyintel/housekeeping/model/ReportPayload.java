package com.propertyintel.housekeeping.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Everything the rendering layer needs for one run. Built once, never mutated.
 */
@Value
@Builder
public class ReportPayload {

    public static final String HSK_KPIS = "hsk_kpis";
    public static final String BY_DAY = "by_day";
    public static final String BY_ROOM_TYPE = "by_room_type";
    public static final String BY_HK_AFTER = "by_hk_after";
    public static final String BY_USER = "by_user";
    public static final String TRANSITION_MATRIX = "transition_matrix";
    public static final String USAGE_KPIS = "usage_kpis";
    public static final String USAGE_BY_ROOM_TYPE = "usage_by_room_type";
    public static final String USAGE_TOP_ROOMS = "usage_top_rooms";
    public static final String USAGE_BY_FEATURE = "usage_by_feature";
    public static final String UNIQUENESS_BY_USER = "uniqueness_by_user";

    String title;
    LocalDateTime generatedAt;

    List<Kpi> housekeepingKpis;
    List<String> housekeepingNotes;
    List<ChartSpec> housekeepingCharts;

    List<Kpi> roomUsageKpis;
    List<String> roomUsageNotes;
    List<ChartSpec> roomUsageCharts;

    /** Null when there is no rotation data */
    ChartSpec rotationChart;
    List<RotationRecord> rotationCallouts;
    int calloutMinActions;

    /** Keyed by the constants above, in declaration order */
    Map<String, ReportTable> tables;

    public ReportTable table(String name) {
        return tables.get(name);
    }

    /** Every chart in report order */
    public List<ChartSpec> allCharts() {
        List<ChartSpec> all = new ArrayList<>(housekeepingCharts);
        all.addAll(roomUsageCharts);
        if (rotationChart != null) all.add(rotationChart);
        return all;
    }
}
