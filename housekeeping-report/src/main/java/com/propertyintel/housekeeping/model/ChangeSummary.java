package com.propertyintel.housekeeping.model;

import lombok.Value;

/**
 * Housekeeping rows folded over one grouping key (day, room type, housekeeper or username).
 */
@Value
public class ChangeSummary {

    String key;
    long rows;
    long uniqueRooms;
    long changed;

    /** changed / rows, rounded to 4 decimals; 0 for an empty group */
    double changeRate;
}
