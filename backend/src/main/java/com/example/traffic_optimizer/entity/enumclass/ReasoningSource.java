package com.example.traffic_optimizer.entity.enumclass;

public enum ReasoningSource {
    LANGUAGE_MODEL,
    RULE_BASED
}
