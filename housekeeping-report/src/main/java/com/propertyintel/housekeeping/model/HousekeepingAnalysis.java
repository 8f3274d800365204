package com.propertyintel.housekeeping.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Aggregates and rotation scores derived from the housekeeping change log.
 */
@Value
@Builder
public class HousekeepingAnalysis {

    List<HousekeepingFact> facts;
    double dateParseSuccessRate;
    List<ChangeSummary> byDay;
    List<ChangeSummary> byRoomType;
    List<ChangeSummary> byClosingHousekeeper;
    List<ChangeSummary> byUsername;
    TransitionMatrix transitionMatrix;

    /** "Before → After" labels of changed rows only, most frequent first */
    Map<String, Long> changedTransitions;

    List<RotationRecord> rotation;
    List<RotationRecord> rotationCallouts;
}
