package com.propertyintel.housekeeping.service;

import com.propertyintel.housekeeping.config.HousekeepingReportProperties;
import com.propertyintel.housekeeping.exception.SchemaException;
import com.propertyintel.housekeeping.model.HousekeepingRow;
import com.propertyintel.housekeeping.model.RawTable;
import com.propertyintel.housekeeping.model.RoomUsageRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RowNormalizerTest {

    private final HousekeepingReportProperties properties = new HousekeepingReportProperties();
    private final RowNormalizer normalizer = new RowNormalizer(properties, new NameAnonymizer());

    @Test
    @DisplayName("every field is trimmed and blank name columns become Unknown")
    void normalizeHousekeeping_trimsAndDefaults() {
        RawTable table = new RawTable("hsk.csv", RowNormalizer.HOUSEKEEPING_COLUMNS, List.<String[]>of(
                new String[]{" 101 ", " King ", "Vacant", " Dirty", "Clean ", "  ", "", " ", " 03/14/2025 07:45 "}));

        List<HousekeepingRow> rows = normalizer.normalizeHousekeeping(table);

        assertThat(rows).hasSize(1);
        HousekeepingRow row = rows.get(0);
        assertThat(row.getRoomNumber()).isEqualTo("101");
        assertThat(row.getRoomType()).isEqualTo("King");
        assertThat(row.getHskStatusBefore()).isEqualTo("Dirty");
        assertThat(row.getHskStatusAfter()).isEqualTo("Clean");
        assertThat(row.getHousekeeperBefore()).isEqualTo("Unknown");
        assertThat(row.getHousekeeperAfter()).isEqualTo("Unknown");
        assertThat(row.getUsername()).isEqualTo("Unknown");
        assertThat(row.getDate()).isEqualTo("03/14/2025 07:45");
    }

    @Test
    @DisplayName("columns are found by name, not position, and extra columns are ignored")
    void normalizeHousekeeping_columnOrderIndependent() {
        List<String> columns = List.of("Date", "Extra", "Username", "Housekeeper After", "Housekeeper Before",
                "HSK Status After", "HSK Status Before", "FD Status", "Room Type", "Room Number");
        RawTable table = new RawTable("hsk.csv", columns, List.<String[]>of(
                new String[]{"3/1/2025 8:00", "x", "alice", "Ana", "Bea", "Clean", "Dirty", "Occupied", "Suite", "204"}));

        HousekeepingRow row = normalizer.normalizeHousekeeping(table).get(0);

        assertThat(row.getRoomNumber()).isEqualTo("204");
        assertThat(row.getUsername()).isEqualTo("alice");
        assertThat(row.getHousekeeperAfter()).isEqualTo("Ana");
        assertThat(row.getFdStatus()).isEqualTo("Occupied");
    }

    @Test
    @DisplayName("all missing columns are reported at once")
    void validate_listsEveryMissingColumn() {
        RawTable table = new RawTable("hsk.csv", List.of("Room Number", "Room Type", "Username"), List.of());

        assertThatThrownBy(() -> normalizer.normalizeHousekeeping(table))
                .hasMessageContaining("hsk.csv")
                .hasMessageContaining("FD Status")
                .hasMessageContaining("Date")
                .isInstanceOfSatisfying(SchemaException.class, e -> assertThat(e.getMissingColumns()).containsExactly(
                        "FD Status", "HSK Status Before", "HSK Status After",
                        "Housekeeper Before", "Housekeeper After", "Date"));
    }

    @Test
    void normalizeRoomUsage_keepsRowCount() {
        RawTable table = new RawTable("usage.csv", RowNormalizer.ROOM_USAGE_COLUMNS, List.of(
                new String[]{"R1", "Suite", " 3 ", "Ocean/View"},
                new String[]{"R2", "Suite", "abc", ""}));

        List<RoomUsageRow> rows = normalizer.normalizeRoomUsage(table);

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).getNumberOfNights()).isEqualTo("3");
        assertThat(rows.get(1).getNumberOfNights()).isEqualTo("abc");
    }

    @Test
    void normalizeRoomUsage_missingFeaturesColumn() {
        RawTable table = new RawTable("usage.csv", List.of("Room Number", "Room Type", "Number of Nights"), List.of());

        assertThatThrownBy(() -> normalizer.normalizeRoomUsage(table))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("Orientation/Features");
    }

    @Test
    @DisplayName("name columns are anonymized when enabled")
    void normalizeHousekeeping_anonymizesNames() {
        properties.getInput().setAnonymizeNames(true);
        RawTable table = new RawTable("hsk.csv", RowNormalizer.HOUSEKEEPING_COLUMNS, List.<String[]>of(
                new String[]{"101", "King", "Vacant", "Dirty", "Clean", "Smith, Jane", "Maria Lopez", "", "3/1/2025 8:00"}));

        HousekeepingRow row = normalizer.normalizeHousekeeping(table).get(0);

        assertThat(row.getHousekeeperBefore()).isEqualTo("Jane S.");
        assertThat(row.getHousekeeperAfter()).isEqualTo("Maria L.");
        assertThat(row.getUsername()).isEqualTo("Unknown");
    }
}
