package com.propertyintel.housekeeping.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

@Value
@Builder
public class HousekeepingFact {

    HousekeepingRow row;

    /** HSK Status Before differs from HSK Status After */
    boolean changed;

    /** "Before → After" */
    String transition;

    /** Null when the Date column could not be parsed */
    LocalDateTime timestamp;

    public Optional<LocalDate> day() {
        return Optional.ofNullable(timestamp).map(LocalDateTime::toLocalDate);
    }

    public String roomNumber() {
        return row.getRoomNumber();
    }
}
