package com.yerin.submitflow.automation.plan;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PlanConstraints(@JsonProperty("rate_limit_ms") long rateLimitMs) {
}
