package com.yerin.submitflow.domain.failure;

import lombok.Getter;

import java.util.Map;

// DB, 큐, Oracle HTTP 같은 인프라 일시 장애. 브라우저 안에서 났으면 증거를 같이 싣는다
@Getter
public class TransientInfraException extends PipelineException implements FailureEvidence {

    private final Map<String, Object> responseLog;
    private final String screenshotPath;

    public TransientInfraException(String message) {
        this(message, null, Map.of(), null);
    }

    public TransientInfraException(String message, Throwable cause) {
        this(message, cause, Map.of(), null);
    }

    public TransientInfraException(String message, Throwable cause,
                                   Map<String, Object> responseLog, String screenshotPath) {
        super(FailureClass.TRANSIENT_INFRA, message, cause);
        this.responseLog = responseLog == null ? Map.of() : responseLog;
        this.screenshotPath = screenshotPath;
    }
}
