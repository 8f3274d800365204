package com.propertyintel.housekeeping.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RoomUsageFact {

    RoomUsageRow row;

    /** Non-negative; 0 when Number of Nights was not numeric */
    double nights;

    /** True when Number of Nights was present but could not be read as a number */
    boolean nightsUnparsable;

    /** Orientation/Features tokens in source order */
    List<String> features;

    public String roomNumber() {
        return row.getRoomNumber();
    }

    public String roomType() {
        return row.getRoomType();
    }
}
