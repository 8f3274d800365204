package com.propertyintel.housekeeping.model;

public enum RotationQuality {

    VERY_LOW("Very Low"),
    LOW("Low"),
    MODERATE("Moderate"),
    HIGH("High");

    private final String label;

    RotationQuality(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
