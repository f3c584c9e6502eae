package com.yerin.submitflow.domain;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

@Component
public class PipelineMetrics {

    private final MeterRegistry registry;

    private final Counter jobsEnqueued;
    private final Counter jobsCompleted;
    private final Counter jobsFailed;
    private final Counter invalidMessages;
    private final Counter triggerFailures;
    private final Counter submissionRetries;
    private final Counter workersDead;
    private final Counter deadLettered;
    private final Counter jobsRequeued;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.jobsEnqueued     = Counter.builder("submitflow_jobs_enqueued_total")
                .description("jobs enqueued").register(registry);
        this.jobsCompleted    = Counter.builder("submitflow_jobs_completed_total")
                .description("jobs finalized as COMPLETED").register(registry);
        this.jobsFailed       = Counter.builder("submitflow_jobs_failed_total")
                .description("jobs finalized as FAILED").register(registry);
        this.invalidMessages  = Counter.builder("submitflow_messages_invalid_total")
                .description("queue messages dropped by validation").register(registry);
        this.triggerFailures  = Counter.builder("submitflow_trigger_failures_total")
                .description("flow trigger failures").register(registry);
        this.submissionRetries = Counter.builder("submitflow_submission_retries_total")
                .description("submission attempts scheduled for retry").register(registry);
        this.workersDead      = Counter.builder("submitflow_workers_dead_total")
                .description("workers flagged dead by the stale monitor").register(registry);
        this.deadLettered     = Counter.builder("submitflow_messages_dead_lettered_total")
                .description("messages moved to a DLQ").register(registry);
        this.jobsRequeued     = Counter.builder("submitflow_jobs_requeued_total")
                .description("stale jobs re-enqueued").register(registry);
    }

    public void incEnqueued()         { jobsEnqueued.increment(); }
    public void incCompleted()        { jobsCompleted.increment(); }
    public void incFailed()           { jobsFailed.increment(); }
    public void incInvalid()          { invalidMessages.increment(); }
    public void incTriggerFailure()   { triggerFailures.increment(); }
    public void incRetried()          { submissionRetries.increment(); }
    public void incWorkerDead()       { workersDead.increment(); }
    public void incDeadLettered()     { deadLettered.increment(); }
    public void incRequeued()         { jobsRequeued.increment(); }

    public void recordResult(JobResultStatus status) {
        Counter.builder("submitflow_submission_results_total")
                .description("terminal submission results by status")
                .tag("status", status.name())
                .register(registry)
                .increment();
    }

    // 디렉터리 태그가 붙은 타이머
    public Timer submissionTimer(String directory) {
        return Timer.builder("submitflow_submission_duration_seconds")
                .description("submission task duration by directory")
                .tag("directory", directory)
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry);
    }
}
