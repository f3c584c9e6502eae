package com.yerin.submitflow.domain.failure;

public enum FailureClass {
    VALIDATION(false),
    TRANSIENT_INFRA(true),
    TRANSIENT_AUTOMATION(true),
    STRUCTURAL(false),
    TIMEOUT(false);

    private final boolean retryable;

    FailureClass(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
