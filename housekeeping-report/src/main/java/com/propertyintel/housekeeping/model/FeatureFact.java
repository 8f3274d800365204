package com.propertyintel.housekeeping.model;

/**
 * One feature token of one room usage row, carrying that row's nights.
 */
public record FeatureFact(String feature, String roomNumber, double nights) {
}
