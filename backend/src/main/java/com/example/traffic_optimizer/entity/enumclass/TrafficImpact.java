package com.example.traffic_optimizer.entity.enumclass;

public enum TrafficImpact {
    MAJOR_IMPROVEMENT,
    MODERATE_IMPROVEMENT,
    MINOR_IMPROVEMENT,
    TEMPORARY_DISRUPTION;

    public boolean isImprovement() {
        return this == MAJOR_IMPROVEMENT || this == MODERATE_IMPROVEMENT;
    }
}
