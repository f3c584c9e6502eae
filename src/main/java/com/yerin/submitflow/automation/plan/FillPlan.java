package com.yerin.submitflow.automation.plan;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Typed submission plan produced by the field-mapping oracle for one directory.
 */
public record FillPlan(
        @JsonProperty("navigate_url") String navigateUrl,
        @JsonProperty("fill_actions") List<FillAction> fillActions,
        @JsonProperty("submit_action") SubmitAction submitAction,
        @JsonProperty("obstacles") List<Obstacle> obstacles,
        @JsonProperty("constraints") PlanConstraints constraints,
        @JsonProperty("success_markers") List<String> successMarkers,
        @JsonProperty("error_markers") List<String> errorMarkers,
        @JsonProperty("source") PlanSource source
) {
    public FillPlan {
        fillActions = fillActions == null ? List.of() : List.copyOf(fillActions);
        obstacles = obstacles == null ? List.of() : List.copyOf(obstacles);
        successMarkers = successMarkers == null ? List.of() : List.copyOf(successMarkers);
        errorMarkers = errorMarkers == null ? List.of() : List.copyOf(errorMarkers);
    }

    public boolean has(Obstacle obstacle) {
        return obstacles.contains(obstacle);
    }
}
