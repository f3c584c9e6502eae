package com.yerin.submitflow.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("checks") Map<String, String> checks
) {
    public boolean isUnhealthy() {
        return "unhealthy".equals(status);
    }
}
