package com.propertyintel.housekeeping.model;

import java.util.List;

/**
 * A CSV file as read from disk: trimmed header names and untyped string rows.
 *
 * @param source  display name of the input, used in logs and error messages
 * @param columns header names in file order
 * @param rows    data rows, each padded to the header width
 */
public record RawTable(String source, List<String> columns, List<String[]> rows) {

    public RawTable {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public int indexOf(String column) {
        return columns.indexOf(column);
    }

    public int size() {
        return rows.size();
    }
}
