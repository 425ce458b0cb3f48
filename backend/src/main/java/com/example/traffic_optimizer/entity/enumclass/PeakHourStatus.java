package com.example.traffic_optimizer.entity.enumclass;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PeakHourStatus {

    IN_PEAK("in_peak"),
    APPROACHING_PEAK("approaching_peak"),
    OFF_PEAK("off_peak"),
    NIGHT("night");

    private final String label;

    PeakHourStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
