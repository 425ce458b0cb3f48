package com.example.traffic_optimizer.dto.openai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class OpenAiMessage {
    private String role;
    private String content;

    public static OpenAiMessage system(String content) {
        return OpenAiMessage.builder().role("system").content(content).build();
    }

    public static OpenAiMessage user(String content) {
        return OpenAiMessage.builder().role("user").content(content).build();
    }
}
