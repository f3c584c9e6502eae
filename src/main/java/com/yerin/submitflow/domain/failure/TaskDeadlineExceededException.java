package com.yerin.submitflow.domain.failure;

import java.time.Instant;

public class TaskDeadlineExceededException extends PipelineException {
    public TaskDeadlineExceededException(Instant deadline, Throwable lastFailure) {
        super(FailureClass.TIMEOUT, "task deadline exceeded at " + deadline, lastFailure);
    }
}
