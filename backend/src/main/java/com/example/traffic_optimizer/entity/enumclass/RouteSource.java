package com.example.traffic_optimizer.entity.enumclass;

/**
 *  기본 거리/시간 출처
 */
public enum RouteSource {
    CALLER,
    ROUTING_PROVIDER,
    GREAT_CIRCLE_FALLBACK
}
