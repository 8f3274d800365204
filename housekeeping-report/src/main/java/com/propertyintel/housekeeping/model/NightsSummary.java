package com.propertyintel.housekeeping.model;

import lombok.Value;

/**
 * Room usage rows folded over a room type or a feature token.
 */
@Value
public class NightsSummary {

    String key;

    /** Source rows for a room type, token mentions for a feature */
    long count;

    long rooms;
    double totalNights;

    /** totalNights / rooms, rounded to 2 decimals */
    double avgNightsPerRoom;
}
