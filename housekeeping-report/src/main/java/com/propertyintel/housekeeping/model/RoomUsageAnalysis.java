package com.propertyintel.housekeeping.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RoomUsageAnalysis {

    List<RoomUsageFact> facts;
    List<FeatureFact> featureFacts;
    List<NightsSummary> byRoomType;
    List<NightsSummary> byFeature;
    List<RoomNights> topRooms;
    List<NightsSummary> topFeatures;
}
