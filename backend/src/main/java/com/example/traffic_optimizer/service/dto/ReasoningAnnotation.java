package com.example.traffic_optimizer.service.dto;

import com.example.traffic_optimizer.entity.enumclass.ReasoningSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReasoningAnnotation {

    private ReasoningSource source;
    private int confidenceScore;

    private String summary;
    private List<String> recommendations;
    private String optimalDepartureWindow;
    private List<String> alternativeRoutes;
    private String historicalContext;
}
