package com.yerin.submitflow.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Directory data carried inside a task message, so a task never re-reads the directory table.
 */
public record DirectoryDescriptor(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("url") String url,
        @JsonProperty("submission_url") String submissionUrl,
        @JsonProperty("form_schema") Map<String, String> formSchema,
        @JsonProperty("submit_selector") String submitSelector,
        @JsonProperty("success_markers") List<String> successMarkers,
        @JsonProperty("error_markers") List<String> errorMarkers,
        @JsonProperty("rate_limit_ms") long rateLimitMs,
        @JsonProperty("captcha") boolean captcha,
        @JsonProperty("requires_login") boolean requiresLogin
) {
    public boolean hasLearnedMapping() {
        return formSchema != null && !formSchema.isEmpty();
    }
}
