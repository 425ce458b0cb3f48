package com.example.traffic_optimizer.dto.openai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

import java.util.List;

/**
 *  언어 모델이 돌려주는 JSON 본문
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReasoningReply {
    private String summary;
    private List<String> recommendations;
    private String optimalDepartureWindow;
    private List<String> alternativeRoutes;
    private String historicalContext;
}
