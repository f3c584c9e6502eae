package com.yerin.submitflow.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.yerin.submitflow.domain.QueueHistoryEvent;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HistoryResponse(
        @JsonProperty("id") Long id,
        @JsonProperty("event") String event,
        @JsonProperty("directory_name") String directoryName,
        @JsonProperty("details") String details,
        @JsonProperty("worker_id") String workerId,
        @JsonProperty("created_at") Instant createdAt
) {
    public static HistoryResponse from(QueueHistoryEvent e) {
        return new HistoryResponse(
                e.getId(),
                e.getEvent().wireName(),
                e.getDirectoryName(),
                e.getDetails(),
                e.getWorkerId(),
                e.getCreatedAt()
        );
    }
}
