package com.example.traffic_optimizer.dto.openai;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OpenAiChatRequest {
    private String model;
    private List<OpenAiMessage> messages;
    private Double temperature;

    @JsonProperty("max_tokens")
    private Integer maxTokens;

    // json_object 이면 응답 본문이 JSON 객체로 고정됨
    @JsonProperty("response_format")
    private ResponseFormat responseFormat;

    @Getter
    @AllArgsConstructor
    public static class ResponseFormat {
        private String type;

        public static ResponseFormat jsonObject() {
            return new ResponseFormat("json_object");
        }
    }
}
