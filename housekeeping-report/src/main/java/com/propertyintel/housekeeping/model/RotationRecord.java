package com.propertyintel.housekeeping.model;

import lombok.Builder;
import lombok.Value;

/**
 * How evenly one username spreads actions over rooms.
 *
 * Two independent signals are reported side by side:
 *  - roomUniquenessRate = uniqueRooms / totalActions
 *  - roomRandomness     = 1 - sum(share_of_room^2), the complement of the Herfindahl index
 */
@Value
@Builder(toBuilder = true)
public class RotationRecord {

    String username;
    long totalActions;
    long uniqueRooms;
    long statusChanges;
    double roomUniquenessRate;
    RotationQuality rotationQuality;
    double roomRandomness;

    /** Dense rank by roomRandomness descending, 1 = most even spread */
    int roomRandomnessRank;
}
