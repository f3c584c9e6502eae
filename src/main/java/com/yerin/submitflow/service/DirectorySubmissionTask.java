package com.yerin.submitflow.service;

import com.yerin.submitflow.automation.SubmissionOutcome;
import com.yerin.submitflow.automation.SubmissionWorker;
import com.yerin.submitflow.automation.plan.FillPlan;
import com.yerin.submitflow.domain.*;
import com.yerin.submitflow.domain.failure.FailureEvidence;
import com.yerin.submitflow.domain.failure.PipelineException;
import com.yerin.submitflow.infra.DirectoryThrottle;
import com.yerin.submitflow.infra.FieldMappingClient;
import com.yerin.submitflow.infra.RetryExecutor;
import com.yerin.submitflow.infra.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One directory of one job, end to end: idempotency check, oracle plan, browser submission
 * under the directory throttle and the retry policy, terminal result, settle.
 * Whatever happens inside, the task leaves a terminal row behind unless the process dies.
 * Tasks of an already finalized job are dropped without touching their rows.
 */
@Slf4j
@Service
public class DirectorySubmissionTask {

    public record Result(JobResultStatus status, String idempotencyKey, int attempts, boolean settled) {
    }

    private final IdempotencyKeys idempotencyKeys;
    private final ResultStore resultStore;
    private final FieldMappingClient oracle;
    private final SubmissionWorker worker;
    private final DirectoryThrottle throttle;
    private final RetryExecutor retryExecutor;
    private final AuditTrail auditTrail;
    private final JobProgressService progressService;
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final RetryPolicy retryPolicy;
    private final Duration taskTimeout;

    public DirectorySubmissionTask(IdempotencyKeys idempotencyKeys,
                                   ResultStore resultStore,
                                   FieldMappingClient oracle,
                                   SubmissionWorker worker,
                                   DirectoryThrottle throttle,
                                   RetryExecutor retryExecutor,
                                   AuditTrail auditTrail,
                                   JobProgressService progressService,
                                   PipelineMetrics metrics,
                                   Clock clock,
                                   RetryPolicy retryPolicy,
                                   @Value("${submitflow.task.timeout-seconds:480}") long taskTimeoutSeconds,
                                   @Value("${submitflow.queue.visibility-timeout-seconds:600}") long visibilitySeconds) {
        // 작업 한도가 가시성 타임아웃보다 길면 실행 중에 같은 메시지가 다시 배달된다
        if (taskTimeoutSeconds >= visibilitySeconds) {
            throw new IllegalStateException("submitflow.task.timeout-seconds (" + taskTimeoutSeconds
                    + ") must be shorter than submitflow.queue.visibility-timeout-seconds (" + visibilitySeconds + ")");
        }
        this.idempotencyKeys = idempotencyKeys;
        this.resultStore = resultStore;
        this.oracle = oracle;
        this.worker = worker;
        this.throttle = throttle;
        this.retryExecutor = retryExecutor;
        this.auditTrail = auditTrail;
        this.progressService = progressService;
        this.metrics = metrics;
        this.clock = clock;
        this.retryPolicy = retryPolicy;
        this.taskTimeout = Duration.ofSeconds(taskTimeoutSeconds);
    }

    public Result execute(TaskMessage task) throws InterruptedException {
        DirectoryDescriptor dir = task.directory();
        String jobId = task.jobId();
        Instant deadline = clock.instant().plus(taskTimeout);

        MDC.put("jobId", jobId);
        MDC.put("directory", dir.id());
        long started = System.nanoTime();
        try {
            String key = idempotencyKeys.keyFor(jobId, dir.id(), task.businessProfile());

            JobResult existing = resultStore.findByKey(key).orElse(null);
            if (existing != null && existing.getStatus().isSuccess()) {
                log.info("[Task] already succeeded, skip key={}, status={}", key, existing.getStatus());
                progressService.onTaskSettled(jobId, dir.name(), JobResultStatus.SKIPPED, key);
                return new Result(JobResultStatus.SKIPPED, key, existing.getAttempts(), true);
            }

            if (progressService.isFinalized(jobId)) {
                log.info("[Task] job already finalized, drop key={}", key);
                return new Result(existing == null ? JobResultStatus.SKIPPED : existing.getStatus(), key,
                        existing == null ? 0 : existing.getAttempts(), false);
            }

            int priorAttempts = existing == null ? 0 : existing.getAttempts();
            resultStore.upsert(base(task, key, JobResultStatus.SUBMITTING, priorAttempts).build());

            AtomicInteger attempts = new AtomicInteger(priorAttempts);
            ResultWrite terminal;
            try {
                SubmissionOutcome outcome = retryExecutor.execute(retryPolicy, deadline,
                        attemptNo -> attempt(task, attempts),
                        (retryNo, delay, cause) -> onRetry(task, key, attempts.get(), retryNo, delay, cause));
                terminal = base(task, key, outcome.status(), attempts.get())
                        .responseLog(outcome.responseLog())
                        .screenshotPath(outcome.screenshotPath())
                        .listingUrl(outcome.listingUrl())
                        .errorMessage(outcome.errorMessage())
                        .build();
            } catch (PipelineException e) {
                log.warn("[Task] failed class={}, attempts={}, err={}", e.getFailureClass(), attempts.get(), e.getMessage());
                terminal = failed(task, key, attempts.get(), e);
            } catch (RuntimeException e) {
                log.error("[Task] unexpected error attempts={}", attempts.get(), e);
                terminal = base(task, key, JobResultStatus.FAILED, attempts.get())
                        .errorMessage(e.toString())
                        .build();
            }

            ResultStore.UpsertOutcome written = resultStore.upsert(terminal);
            JobResultStatus settledAs = written == ResultStore.UpsertOutcome.DUPLICATE_SUCCESS
                    ? JobResultStatus.SKIPPED : terminal.status();
            metrics.recordResult(settledAs);
            progressService.onTaskSettled(jobId, dir.name(), settledAs, key);
            return new Result(settledAs, key, attempts.get(), true);
        } finally {
            metrics.submissionTimer(dir.id()).record(Duration.ofNanos(System.nanoTime() - started));
            MDC.remove("jobId");
            MDC.remove("directory");
        }
    }

    private SubmissionOutcome attempt(TaskMessage task, AtomicInteger attempts) throws InterruptedException {
        DirectoryDescriptor dir = task.directory();
        attempts.incrementAndGet();
        long rateLimit = task.packageType().adjustRateLimit(dir.rateLimitMs());
        try (DirectoryThrottle.Permit ignored = throttle.acquire(dir.id(), rateLimit)) {
            FillPlan plan = oracle.plan(dir, task.businessProfile());
            return worker.submit(task.jobId(), dir.id(), plan);
        }
    }

    private void onRetry(TaskMessage task, String key, int attempts, int retryNo, Duration delay, PipelineException cause) {
        ResultWrite.ResultWriteBuilder row = base(task, key, JobResultStatus.RETRY, attempts).errorMessage(cause.getMessage());
        if (cause instanceof FailureEvidence ev) {
            row.responseLog(ev.getResponseLog()).screenshotPath(ev.getScreenshotPath());
        }
        resultStore.upsert(row.build());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("retry", retryNo);
        details.put("delay_ms", delay.toMillis());
        details.put("failure_class", cause.getFailureClass().name());
        details.put("error", cause.getMessage());
        auditTrail.append(task.jobId(), task.directory().name(), HistoryEventType.SUBMISSION_RETRY, details);
        metrics.incRetried();
        log.info("[Task] retry={} in {}ms class={}", retryNo, delay.toMillis(), cause.getFailureClass());
    }

    private ResultWrite failed(TaskMessage task, String key, int attempts, PipelineException e) {
        ResultWrite.ResultWriteBuilder row = base(task, key, JobResultStatus.FAILED, attempts).errorMessage(e.getMessage());
        if (e instanceof FailureEvidence ev && !ev.getResponseLog().isEmpty()) {
            row.responseLog(ev.getResponseLog()).screenshotPath(ev.getScreenshotPath());
        } else {
            Map<String, Object> evidence = new LinkedHashMap<>();
            evidence.put("failure_class", e.getFailureClass().name());
            evidence.put("error", e.getMessage());
            row.responseLog(evidence);
        }
        return row.build();
    }

    private ResultWrite.ResultWriteBuilder base(TaskMessage task, String key, JobResultStatus status, int attempts) {
        return ResultWrite.builder()
                .jobId(task.jobId())
                .directory(task.directory().name())
                .status(status)
                .idempotencyKey(key)
                .payload(task.businessProfile())
                .attempts(attempts);
    }
}
