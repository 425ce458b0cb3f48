package com.example.traffic_optimizer.service.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DepartureSearchResponse {

    private String originCity;
    private String destinationCity;
    private String mode;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm")
    private LocalDateTime requestedAt;

    private int horizonSlots;
    private int slotMinutes;

    private List<DepartureSlot> slots;
    private DepartureRecommendation recommendation;
}
