package com.example.traffic_optimizer.entity.enumclass;

public enum BusRouteType {
    CITY,
    EXPRESS,
    AC,
    VOLVO,
    METRO_FEEDER
}
