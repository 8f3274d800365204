package com.propertyintel.housekeeping.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * One chart of the report. The file name is part of the report contract:
 * report.html refers to the PNG by this name.
 */
@Value
@Builder
public class ChartSpec {

    public enum Kind { BAR, HORIZONTAL_BAR, LINE }

    String title;
    String fileName;
    Kind kind;
    String categoryAxisLabel;
    String valueAxisLabel;
    List<String> categories;

    /** Series name to values, one value per category, in insertion order */
    Map<String, List<Number>> series;
}
