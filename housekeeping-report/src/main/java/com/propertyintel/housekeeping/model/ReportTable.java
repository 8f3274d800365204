package com.propertyintel.housekeeping.model;

import lombok.Value;

import java.util.List;

/**
 * A rendered aggregate: display-ready string cells plus the CSV file it is written to.
 */
@Value
public class ReportTable {

    String name;
    String fileName;
    List<String> columns;
    List<List<String>> rows;

    public ReportTable(String name, String fileName, List<String> columns, List<List<String>> rows) {
        this.name = name;
        this.fileName = fileName;
        this.columns = List.copyOf(columns);
        this.rows = rows.stream().map(List::copyOf).toList();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public ReportTable limit(int maxRows) {
        if (rows.size() <= maxRows) return this;
        return new ReportTable(name, fileName, columns, rows.subList(0, maxRows));
    }
}
