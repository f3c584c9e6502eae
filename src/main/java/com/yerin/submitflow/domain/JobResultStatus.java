package com.yerin.submitflow.domain;

import java.util.EnumSet;
import java.util.Set;

public enum JobResultStatus {
    SUBMITTING,
    RETRY,
    SUBMITTED,
    FAILED,
    SKIPPED,
    NEEDS_HUMAN;

    public static final Set<JobResultStatus> TERMINAL = EnumSet.of(SUBMITTED, FAILED, SKIPPED, NEEDS_HUMAN);
    public static final Set<JobResultStatus> SUCCESS = EnumSet.of(SUBMITTED, SKIPPED);

    public boolean isTerminal() { return TERMINAL.contains(this); }

    public boolean isSuccess() { return SUCCESS.contains(this); }
}
