package com.example.traffic_optimizer.entity.enumclass;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 *  혼잡도 단계 (배수 기준 단일 분류)
 */
public enum TrafficLevel {

    LOW("low", "#22c55e"),
    MODERATE("moderate", "#f59e0b"),
    HIGH("high", "#ef4444");

    public static final double HIGH_THRESHOLD = 1.6;
    public static final double MODERATE_THRESHOLD = 1.2;

    private final String label;
    private final String color;

    TrafficLevel(String label, String color) {
        this.label = label;
        this.color = color;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public String getColor() {
        return color;
    }

    public static TrafficLevel classify(double multiplier) {
        if (multiplier >= HIGH_THRESHOLD) return HIGH;
        if (multiplier >= MODERATE_THRESHOLD) return MODERATE;
        return LOW;
    }
}
