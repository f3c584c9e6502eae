package com.yerin.submitflow.service;

import com.yerin.submitflow.domain.*;
import com.yerin.submitflow.infra.ChangeNotifier;
import com.yerin.submitflow.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Settles directory results into job progress and finalizes the job once every planned
 * directory has a terminal result. Finalization is a guarded update, so with several
 * concurrent settlers exactly one of them writes the terminal status and its event.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobProgressService {

    private final JobRepository jobRepository;
    private final ResultStore resultStore;
    private final AuditTrail auditTrail;
    private final CompletionPolicy completionPolicy;
    private final PipelineMetrics metrics;
    private final ChangeNotifier notifier;
    private final TransactionTemplate tx;
    private final Clock clock;

    public void onTaskSettled(String jobId, String directory, JobResultStatus status, String idempotencyKey) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", status.name());
        details.put("idempotency_key", idempotencyKey);
        auditTrail.append(jobId, directory, HistoryEventType.SUBMISSION_COMPLETE, details);
        settle(jobId);
    }

    public void settle(String jobId) {
        Job job = jobRepository.findById(jobId).orElse(null);
        if (job == null || job.getStatus() != JobStatus.IN_PROGRESS) return;

        int total = job.getDirectoriesTotal();
        long settled = resultStore.countSettled(jobId);
        int done = (int) Math.min(settled, total);
        int progress = total == 0 ? 100 : (int) (done * 100L / total);

        Integer updated = tx.execute(s -> jobRepository.updateProgress(jobId, progress, done, clock.instant()));
        if (updated != null && updated > 0) {
            log.info("[Progress] jobId={}, done={}/{}, progress={}", jobId, done, total, progress);
            notifier.publish("jobs", jobId, "status", JobStatus.IN_PROGRESS.name());
        }
        if (settled >= total) {
            finalizeJob(jobId, total);
        }
    }

    public boolean isFinalized(String jobId) {
        return jobRepository.findById(jobId)
                .map(job -> job.getStatus().isTerminal())
                .orElse(false);
    }

    public boolean finalizeJob(String jobId, int total) {
        Map<JobResultStatus, Long> counts = resultStore.countsByStatus(jobId);
        long successes = counts.getOrDefault(JobResultStatus.SUBMITTED, 0L)
                + counts.getOrDefault(JobResultStatus.SKIPPED, 0L);
        boolean met = completionPolicy.isMet(successes, total);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total", total);
        summary.put("successes", successes);
        summary.put("required", completionPolicy.required(total));
        for (JobResultStatus s : JobResultStatus.TERMINAL) {
            summary.put(s.name().toLowerCase(Locale.ROOT), counts.getOrDefault(s, 0L));
        }

        JobStatus target = met ? JobStatus.COMPLETED : JobStatus.FAILED;
        String error = met ? null
                : "completion policy not met: successes=" + successes + ", required=" + completionPolicy.required(total);
        return finish(jobId, target, error, summary);
    }

    public boolean failJob(String jobId, String reason) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("reason", reason);
        return finish(jobId, JobStatus.FAILED, reason, summary);
    }

    private boolean finish(String jobId, JobStatus target, String error, Map<String, Object> summary) {
        HistoryEventType event = target == JobStatus.COMPLETED ? HistoryEventType.FLOW_COMPLETED : HistoryEventType.FLOW_FAILED;
        Boolean won = tx.execute(s -> {
            int rows = jobRepository.finishIf(jobId, JobStatus.IN_PROGRESS, target, error, clock.instant());
            if (rows == 0) return false;
            auditTrail.append(jobId, null, event, summary);
            return true;
        });
        if (!Boolean.TRUE.equals(won)) {
            log.debug("[Progress] finalize lost race jobId={}", jobId);
            return false;
        }
        if (target == JobStatus.COMPLETED) metrics.incCompleted(); else metrics.incFailed();
        notifier.publish("jobs", jobId, "status", target.name());
        log.info("[Progress] finalized jobId={}, status={}, summary={}", jobId, target, summary);
        return true;
    }
}
