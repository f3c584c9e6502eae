package com.yerin.submitflow.service;

import com.yerin.submitflow.domain.JobResultStatus;
import lombok.Builder;

import java.util.Map;

@Builder
public record ResultWrite(
        String jobId,
        String directory,
        JobResultStatus status,
        String idempotencyKey,
        Map<String, ?> payload,
        Map<String, ?> responseLog,
        String screenshotPath,
        String listingUrl,
        int attempts,
        String errorMessage
) {
}
