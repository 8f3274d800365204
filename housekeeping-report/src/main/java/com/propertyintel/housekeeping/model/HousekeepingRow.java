package com.propertyintel.housekeeping.model;

import lombok.Builder;
import lombok.Value;

/**
 * One trimmed line of the housekeeping change log.
 * Name columns are never blank: missing values are stored as "Unknown".
 */
@Value
@Builder
public class HousekeepingRow {

    String roomNumber;
    String roomType;
    String fdStatus;
    String hskStatusBefore;
    String hskStatusAfter;
    String housekeeperBefore;
    String housekeeperAfter;
    String username;

    /** Date column as exported, parsed later by the fact deriver */
    String date;
}
