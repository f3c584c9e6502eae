package com.yerin.submitflow.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.yerin.submitflow.domain.Job;
import com.yerin.submitflow.domain.JobStatus;
import com.yerin.submitflow.domain.PackageTier;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        @JsonProperty("id") String id,
        @JsonProperty("customer_id") String customerId,
        @JsonProperty("status") JobStatus status,
        @JsonProperty("package_size") int packageSize,
        @JsonProperty("package_type") PackageTier packageType,
        @JsonProperty("progress") int progress,
        @JsonProperty("directories_total") int directoriesTotal,
        @JsonProperty("directories_done") int directoriesDone,
        @JsonProperty("flow_run_id") String flowRunId,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("completed_at") Instant completedAt,
        @JsonProperty("updated_at") Instant updatedAt
) {
    public static JobResponse from(Job j) {
        return new JobResponse(
                j.getId(),
                j.getCustomerId(),
                j.getStatus(),
                j.getPackageSize(),
                j.getPackageType(),
                j.getProgress(),
                j.getDirectoriesTotal(),
                j.getDirectoriesDone(),
                j.getFlowRunId(),
                j.getErrorMessage(),
                j.getCreatedAt(),
                j.getStartedAt(),
                j.getCompletedAt(),
                j.getUpdatedAt()
        );
    }
}
