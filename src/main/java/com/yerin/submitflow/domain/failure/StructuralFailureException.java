package com.yerin.submitflow.domain.failure;

import lombok.Getter;

import java.util.Map;

@Getter
public class StructuralFailureException extends PipelineException implements FailureEvidence {

    private final Map<String, Object> responseLog;
    private final String screenshotPath;

    public StructuralFailureException(String message) {
        this(message, null, Map.of(), null);
    }

    public StructuralFailureException(String message, Throwable cause) {
        this(message, cause, Map.of(), null);
    }

    public StructuralFailureException(String message, Throwable cause,
                                      Map<String, Object> responseLog, String screenshotPath) {
        super(FailureClass.STRUCTURAL, message, cause);
        this.responseLog = responseLog == null ? Map.of() : responseLog;
        this.screenshotPath = screenshotPath;
    }
}
