package com.yerin.submitflow.domain;

import java.util.Locale;

public enum HistoryEventType {
    QUEUE_CLAIMED,
    FLOW_TRIGGERED,
    FLOW_STARTED,
    SUBMISSION_RETRY,
    SUBMISSION_COMPLETE,
    FLOW_COMPLETED,
    FLOW_FAILED,
    JOB_REQUEUED,
    JOB_DEAD_LETTERED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
