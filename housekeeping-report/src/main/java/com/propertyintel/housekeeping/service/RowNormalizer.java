package com.propertyintel.housekeeping.service;

import com.propertyintel.housekeeping.config.HousekeepingReportProperties;
import com.propertyintel.housekeeping.exception.SchemaException;
import com.propertyintel.housekeeping.model.HousekeepingRow;
import com.propertyintel.housekeeping.model.RawTable;
import com.propertyintel.housekeeping.model.RoomUsageRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Validates the header of each export and turns its rows into trimmed, typed rows.
 *
 * Housekeeping Change Log columns:
 *   Room Number, Room Type, FD Status, HSK Status Before, HSK Status After,
 *   Housekeeper Before, Housekeeper After, Username, Date
 *
 * Room Usage columns:
 *   Room Number, Room Type, Number of Nights, Orientation/Features
 *
 * Extra columns are ignored. Row count is always preserved.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RowNormalizer {

    public static final String ROOM_NUMBER = "Room Number";
    public static final String ROOM_TYPE = "Room Type";
    public static final String FD_STATUS = "FD Status";
    public static final String HSK_BEFORE = "HSK Status Before";
    public static final String HSK_AFTER = "HSK Status After";
    public static final String HK_BEFORE = "Housekeeper Before";
    public static final String HK_AFTER = "Housekeeper After";
    public static final String USERNAME = "Username";
    public static final String DATE = "Date";
    public static final String NIGHTS = "Number of Nights";
    public static final String FEATURES = "Orientation/Features";

    public static final List<String> HOUSEKEEPING_COLUMNS = List.of(
            ROOM_NUMBER, ROOM_TYPE, FD_STATUS, HSK_BEFORE, HSK_AFTER, HK_BEFORE, HK_AFTER, USERNAME, DATE);

    public static final List<String> ROOM_USAGE_COLUMNS = List.of(
            ROOM_NUMBER, ROOM_TYPE, NIGHTS, FEATURES);

    static final String UNKNOWN = "Unknown";

    private final HousekeepingReportProperties properties;
    private final NameAnonymizer nameAnonymizer;

    /**
     * Checks that every required column is present, reporting all missing columns at once.
     *
     * @throws SchemaException if any required column is absent
     */
    public void validate(RawTable table, List<String> required) {
        List<String> missing = required.stream()
                .filter(c -> !table.columns().contains(c))
                .toList();
        if (!missing.isEmpty()) {
            throw new SchemaException(table.source(), missing);
        }
    }

    public List<HousekeepingRow> normalizeHousekeeping(RawTable table) {
        validate(table, HOUSEKEEPING_COLUMNS);

        int roomNumber = table.indexOf(ROOM_NUMBER);
        int roomType = table.indexOf(ROOM_TYPE);
        int fdStatus = table.indexOf(FD_STATUS);
        int hskBefore = table.indexOf(HSK_BEFORE);
        int hskAfter = table.indexOf(HSK_AFTER);
        int hkBefore = table.indexOf(HK_BEFORE);
        int hkAfter = table.indexOf(HK_AFTER);
        int username = table.indexOf(USERNAME);
        int date = table.indexOf(DATE);

        List<HousekeepingRow> rows = table.rows().stream()
                .map(cols -> HousekeepingRow.builder()
                        .roomNumber(cell(cols, roomNumber))
                        .roomType(cell(cols, roomType))
                        .fdStatus(cell(cols, fdStatus))
                        .hskStatusBefore(cell(cols, hskBefore))
                        .hskStatusAfter(cell(cols, hskAfter))
                        .housekeeperBefore(name(cell(cols, hkBefore)))
                        .housekeeperAfter(name(cell(cols, hkAfter)))
                        .username(name(cell(cols, username)))
                        .date(cell(cols, date))
                        .build())
                .toList();

        log.debug("Normalized {} housekeeping rows from {}", rows.size(), table.source());
        return rows;
    }

    public List<RoomUsageRow> normalizeRoomUsage(RawTable table) {
        validate(table, ROOM_USAGE_COLUMNS);

        int roomNumber = table.indexOf(ROOM_NUMBER);
        int roomType = table.indexOf(ROOM_TYPE);
        int nights = table.indexOf(NIGHTS);
        int features = table.indexOf(FEATURES);

        List<RoomUsageRow> rows = table.rows().stream()
                .map(cols -> RoomUsageRow.builder()
                        .roomNumber(cell(cols, roomNumber))
                        .roomType(cell(cols, roomType))
                        .numberOfNights(cell(cols, nights))
                        .features(cell(cols, features))
                        .build())
                .toList();

        log.debug("Normalized {} room usage rows from {}", rows.size(), table.source());
        return rows;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String cell(String[] cols, int idx) {
        if (idx >= cols.length || cols[idx] == null) return "";
        return cols[idx].trim();
    }

    private String name(String value) {
        String v = properties.getInput().isAnonymizeNames() ? nameAnonymizer.anonymize(value) : value;
        return v.isBlank() ? UNKNOWN : v;
    }
}
