package com.yerin.submitflow.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Validated body of a message on the jobs queue.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobMessage(
        @JsonProperty("job_id") String jobId,
        @JsonProperty("customer_id") String customerId,
        @JsonProperty("package_size") int packageSize,
        @JsonProperty("priority") String priority,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("source") String source
) {
    @JsonIgnore
    public PackageTier packageType() {
        return PackageTier.fromPriority(priority);
    }
}
