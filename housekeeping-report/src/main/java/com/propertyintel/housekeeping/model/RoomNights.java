package com.propertyintel.housekeeping.model;

import lombok.Value;

@Value
public class RoomNights {

    String roomNumber;

    /** Room type of the first row seen for this room */
    String roomType;

    long stays;
    double totalNights;
}
