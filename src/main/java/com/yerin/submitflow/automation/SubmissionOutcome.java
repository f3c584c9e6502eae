package com.yerin.submitflow.automation;

import com.yerin.submitflow.domain.JobResultStatus;

import java.util.Map;

public record SubmissionOutcome(
        JobResultStatus status,
        Map<String, Object> responseLog,
        String screenshotPath,
        String listingUrl,
        String errorMessage
) {
}
