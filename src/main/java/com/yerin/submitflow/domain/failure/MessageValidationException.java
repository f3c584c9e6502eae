package com.yerin.submitflow.domain.failure;

public class MessageValidationException extends PipelineException {
    public MessageValidationException(String message) {
        super(FailureClass.VALIDATION, message);
    }

    public MessageValidationException(String message, Throwable cause) {
        super(FailureClass.VALIDATION, message, cause);
    }
}
