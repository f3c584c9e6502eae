package com.yerin.submitflow.service;

import java.util.concurrent.CompletableFuture;

/**
 * Returned synchronously by a trigger. A started flow waits on the gate until the subscriber
 * has recorded the trigger; {@link #abort()} cancels a flow that has not started yet.
 */
public final class FlowHandle {

    public enum Mode { STARTED, ATTACHED, NOOP }

    private final String jobId;
    private final String flowRunId;
    private final Mode mode;
    private final CompletableFuture<Void> gate;

    private FlowHandle(String jobId, String flowRunId, Mode mode, CompletableFuture<Void> gate) {
        this.jobId = jobId;
        this.flowRunId = flowRunId;
        this.mode = mode;
        this.gate = gate;
    }

    public static FlowHandle started(String jobId, String flowRunId, CompletableFuture<Void> gate) {
        return new FlowHandle(jobId, flowRunId, Mode.STARTED, gate);
    }

    public static FlowHandle attached(String jobId, String flowRunId) {
        return new FlowHandle(jobId, flowRunId, Mode.ATTACHED, null);
    }

    public static FlowHandle noop(String jobId, String flowRunId) {
        return new FlowHandle(jobId, flowRunId, Mode.NOOP, null);
    }

    public String jobId() { return jobId; }

    public String flowRunId() { return flowRunId; }

    public Mode mode() { return mode; }

    public void release() {
        if (gate != null) gate.complete(null);
    }

    public void abort() {
        if (gate != null) gate.cancel(false);
    }
}
