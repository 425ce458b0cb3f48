package com.example.traffic_optimizer.entity.enumclass;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OverallRating {

    EXCELLENT("excellent"),
    GOOD("good"),
    MODERATE("moderate"),
    POOR("poor"),
    AVOID("avoid");

    private final String label;

    OverallRating(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static OverallRating fromMultiplier(double multiplier) {
        if (multiplier >= 2.0) return AVOID;
        if (multiplier >= 1.6) return POOR;
        if (multiplier >= 1.3) return MODERATE;
        if (multiplier <= 0.9) return EXCELLENT;
        return GOOD;
    }
}
