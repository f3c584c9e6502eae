package com.yerin.submitflow.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.yerin.submitflow.domain.JobResult;
import com.yerin.submitflow.domain.JobResultStatus;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResultResponse(
        @JsonProperty("directory_name") String directoryName,
        @JsonProperty("status") JobResultStatus status,
        @JsonProperty("idempotency_key") String idempotencyKey,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("listing_url") String listingUrl,
        @JsonProperty("screenshot_path") String screenshotPath,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("response_log") String responseLog,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt
) {
    public static JobResultResponse from(JobResult r) {
        return new JobResultResponse(
                r.getDirectoryName(),
                r.getStatus(),
                r.getIdempotencyKey(),
                r.getAttempts(),
                r.getListingUrl(),
                r.getScreenshotPath(),
                r.getErrorMessage(),
                r.getResponseLog(),
                r.getCreatedAt(),
                r.getUpdatedAt()
        );
    }
}
