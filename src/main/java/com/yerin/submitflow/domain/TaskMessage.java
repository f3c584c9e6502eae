package com.yerin.submitflow.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record TaskMessage(
        @JsonProperty("job_id") String jobId,
        @JsonProperty("flow_run_id") String flowRunId,
        @JsonProperty("directory") DirectoryDescriptor directory,
        @JsonProperty("business_profile") Map<String, String> businessProfile,
        @JsonProperty("package_type") PackageTier packageType
) {
}
