package com.yerin.submitflow.domain.failure;

import lombok.Getter;

/**
 * Root of the pipeline failure taxonomy. Only {@link FailureClass#TRANSIENT_INFRA} and
 * {@link FailureClass#TRANSIENT_AUTOMATION} are retried by the task retry executor.
 */
@Getter
public class PipelineException extends RuntimeException {

    private final FailureClass failureClass;

    public PipelineException(FailureClass failureClass, String message) {
        super(message);
        this.failureClass = failureClass;
    }

    public PipelineException(FailureClass failureClass, String message, Throwable cause) {
        super(message, cause);
        this.failureClass = failureClass;
    }

    public boolean isRetryable() {
        return failureClass.isRetryable();
    }
}
