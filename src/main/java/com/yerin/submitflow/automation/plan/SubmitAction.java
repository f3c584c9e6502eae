package com.yerin.submitflow.automation.plan;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SubmitAction(@JsonProperty("selector") String selector) {
}
