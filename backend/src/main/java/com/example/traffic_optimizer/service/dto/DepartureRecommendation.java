package com.example.traffic_optimizer.service.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DepartureRecommendation {

    // 15분 이내 출발 가능한 최선 슬롯 (없으면 null)
    private DepartureSlot leaveNow;

    private boolean goodToLeaveNow;

    // 6시간 이내 최소 지연 슬롯
    private DepartureSlot nextOptimal;

    // 전체 구간 최소 소요시간 슬롯
    private DepartureSlot absoluteBest;

    private boolean anyTimeIsFine;
}
