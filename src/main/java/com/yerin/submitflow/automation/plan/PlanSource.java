package com.yerin.submitflow.automation.plan;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum PlanSource {
    @JsonProperty("learned") LEARNED,
    @JsonProperty("heuristic") HEURISTIC
}
