package com.yerin.submitflow.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.yerin.submitflow.domain.WorkerHeartbeat;
import com.yerin.submitflow.domain.WorkerStatus;

import java.time.Instant;

public record WorkerResponse(
        @JsonProperty("worker_id") String workerId,
        @JsonProperty("status") WorkerStatus status,
        @JsonProperty("last_seen") Instant lastSeen,
        @JsonProperty("jobs_processed") long jobsProcessed,
        @JsonProperty("metadata") String metadata
) {
    public static WorkerResponse from(WorkerHeartbeat w) {
        return new WorkerResponse(w.getWorkerId(), w.getStatus(), w.getLastSeen(), w.getJobsProcessed(), w.getMetadata());
    }
}
