package com.yerin.submitflow.service;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Decides COMPLETED vs FAILED once every directory of a job has settled.
 * Successes are SUBMITTED and SKIPPED results; NEEDS_HUMAN counts as a non-success.
 */
@Component
public class CompletionPolicy {

    private final double minSuccessRatio;
    private final int minSuccesses;

    @Autowired
    public CompletionPolicy(@Value("${submitflow.completion.min-success-ratio:0.0}") double minSuccessRatio,
                            @Value("${submitflow.completion.min-successes:1}") int minSuccesses) {
        if (minSuccessRatio < 0 || minSuccessRatio > 1) {
            throw new IllegalArgumentException("min-success-ratio must be within [0, 1]");
        }
        this.minSuccessRatio = minSuccessRatio;
        this.minSuccesses = Math.max(0, minSuccesses);
    }

    public boolean isMet(long successes, int total) {
        if (total <= 0) return false;
        return successes >= required(total);
    }

    // 디렉터리 수보다 큰 요구치는 전체 수로 잘라냄
    public long required(int total) {
        long byRatio = (long) Math.ceil(minSuccessRatio * total);
        return Math.min(total, Math.max(minSuccesses, byRatio));
    }
}
