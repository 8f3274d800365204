package com.propertyintel.housekeeping.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RoomUsageRow {

    String roomNumber;
    String roomType;
    String numberOfNights;
    String features;
}
