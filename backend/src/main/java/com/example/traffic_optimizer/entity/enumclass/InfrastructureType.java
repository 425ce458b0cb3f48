package com.example.traffic_optimizer.entity.enumclass;

public enum InfrastructureType {
    METRO_LINE,
    FLYOVER,
    RING_ROAD,
    EXPRESSWAY,
    BUS_CORRIDOR,
    ROAD_WIDENING,
    UNDERPASS,
    BRIDGE,
    SIGNAL_SYSTEM
}
