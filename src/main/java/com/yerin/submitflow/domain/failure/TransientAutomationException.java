package com.yerin.submitflow.domain.failure;

import lombok.Getter;

import java.util.Map;

/**
 * Browser-side failure worth another attempt: navigation timeout, 5xx, element not yet attached.
 * Carries the response log captured so far so the RETRY row keeps the evidence.
 */
@Getter
public class TransientAutomationException extends PipelineException implements FailureEvidence {

    private final Map<String, Object> responseLog;
    private final String screenshotPath;

    public TransientAutomationException(String message) {
        this(message, null, Map.of(), null);
    }

    public TransientAutomationException(String message, Throwable cause) {
        this(message, cause, Map.of(), null);
    }

    public TransientAutomationException(String message, Throwable cause,
                                        Map<String, Object> responseLog, String screenshotPath) {
        super(FailureClass.TRANSIENT_AUTOMATION, message, cause);
        this.responseLog = responseLog == null ? Map.of() : responseLog;
        this.screenshotPath = screenshotPath;
    }
}
