package com.yerin.submitflow.automation.plan;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FillAction(
        @JsonProperty("action") Type action,
        @JsonProperty("field") String field,
        @JsonProperty("selector") String selector,
        @JsonProperty("value") String value
) {
    public enum Type {
        @JsonProperty("fill") FILL,
        @JsonProperty("select") SELECT,
        @JsonProperty("check") CHECK
    }
}
