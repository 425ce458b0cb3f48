package com.example.traffic_optimizer.entity.enumclass;

public enum ConstructionStatus {

    ACTIVE,
    DELAYED,
    COMPLETED;

    /**
     *  실시간 점수 계산 대상 여부
     */
    public boolean isLive() {
        return this == ACTIVE || this == DELAYED;
    }
}
