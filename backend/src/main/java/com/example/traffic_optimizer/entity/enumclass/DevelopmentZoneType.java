package com.example.traffic_optimizer.entity.enumclass;

public enum DevelopmentZoneType {
    IT_PARK,
    RESIDENTIAL,
    COMMERCIAL,
    MIXED_USE,
    INDUSTRIAL,
    SEZ,
    AIRPORT,
    PORT,
    UNIVERSITY
}
