package com.yerin.submitflow.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.yerin.submitflow.domain.QueueMessage;

import java.time.Instant;

public record DeadLetterResponse(
        @JsonProperty("message_id") String messageId,
        @JsonProperty("receive_count") long receiveCount,
        @JsonProperty("enqueued_at") Instant enqueuedAt,
        @JsonProperty("body") String body
) {
    public static DeadLetterResponse from(QueueMessage m) {
        return new DeadLetterResponse(m.id(), m.receiveCount(), m.enqueuedAt(), m.body());
    }
}
