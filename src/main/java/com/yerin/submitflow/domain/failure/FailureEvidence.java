package com.yerin.submitflow.domain.failure;

import java.util.Map;

/**
 * Failure that captured browser evidence before it was raised.
 */
public interface FailureEvidence {

    Map<String, Object> getResponseLog();

    String getScreenshotPath();
}
