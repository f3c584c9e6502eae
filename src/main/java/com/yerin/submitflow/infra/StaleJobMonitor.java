package com.yerin.submitflow.infra;

import com.yerin.submitflow.domain.Job;
import com.yerin.submitflow.domain.JobStatus;
import com.yerin.submitflow.domain.WorkerStatus;
import com.yerin.submitflow.repository.JobRepository;
import com.yerin.submitflow.repository.WorkerHeartbeatRepository;
import com.yerin.submitflow.service.RecoveryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Periodic sweep for jobs that stopped moving. An IN_PROGRESS job is stale only when it has not
 * been updated for the threshold and its worker's heartbeat is missing, DEAD or just as old.
 * Stale jobs get their unsettled directories re-enqueued, or are failed as orphaned once past
 * the job deadline. PENDING jobs get their job message re-enqueued.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaleJobMonitor {

    private final JobRepository jobRepository;
    private final WorkerHeartbeatRepository workerRepository;
    private final RecoveryService recoveryService;
    private final Clock clock;

    @Value("${submitflow.monitor.stale-job.stale-after-minutes:10}")
    private long staleAfterMinutes = 10;

    @Value("${submitflow.monitor.stale-job.deadline-minutes:60}")
    private long deadlineMinutes = 60;

    public record ScanReport(int requeuedJobs, int requeuedTasks, int orphanedJobs) {
    }

    @Scheduled(fixedDelayString = "${submitflow.monitor.stale-job.interval-ms:120000}",
            initialDelayString = "${submitflow.monitor.stale-job.interval-ms:120000}")
    public void scheduledScan() {
        try {
            ScanReport r = scan();
            if (r.requeuedJobs() + r.requeuedTasks() + r.orphanedJobs() > 0) {
                log.info("[StaleJob] report={}", r);
            }
        } catch (RuntimeException e) {
            log.warn("[StaleJob] scan failed: {}", e.toString());
        }
    }

    public ScanReport scan() {
        Instant now = clock.instant();
        Instant staleBefore = now.minus(Duration.ofMinutes(staleAfterMinutes));
        Duration deadline = Duration.ofMinutes(deadlineMinutes);

        int requeuedTasks = 0;
        int orphaned = 0;
        for (Job job : jobRepository.findTop100ByStatusAndUpdatedAtLessThanEqualOrderByUpdatedAtAsc(JobStatus.IN_PROGRESS, staleBefore)) {
            try {
                if (workerAlive(job, staleBefore)) {
                    log.debug("[StaleJob] worker still alive, skip jobId={}, workerId={}", job.getId(), job.getWorkerId());
                    continue;
                }
                Instant started = job.getStartedAt() != null ? job.getStartedAt() : job.getCreatedAt();
                if (started != null && started.plus(deadline).isBefore(now)) {
                    recoveryService.failMissing(job, "orphaned: job deadline exceeded");
                    orphaned++;
                } else {
                    requeuedTasks += recoveryService.requeueMissingTasks(job, "stale_in_progress");
                }
            } catch (RuntimeException e) {
                log.warn("[StaleJob] recovery failed jobId={}, err={}", job.getId(), e.toString());
            }
        }

        int requeuedJobs = 0;
        List<Job> pending = new ArrayList<>(
                jobRepository.findTop100ByStatusAndTriggeredAtLessThanEqualOrderByTriggeredAtAsc(JobStatus.PENDING, staleBefore));
        pending.addAll(jobRepository
                .findTop100ByStatusAndTriggeredAtIsNullAndCreatedAtLessThanEqualOrderByCreatedAtAsc(JobStatus.PENDING, staleBefore));
        for (Job job : pending) {
            try {
                recoveryService.requeueJobMessage(job, "stale_pending");
                requeuedJobs++;
            } catch (RuntimeException e) {
                log.warn("[StaleJob] requeue failed jobId={}, err={}", job.getId(), e.toString());
            }
        }
        return new ScanReport(requeuedJobs, requeuedTasks, orphaned);
    }

    private boolean workerAlive(Job job, Instant staleBefore) {
        if (job.getWorkerId() == null) return false;
        return workerRepository.findById(job.getWorkerId())
                .filter(w -> w.getStatus() != WorkerStatus.DEAD)
                .filter(w -> w.getLastSeen() != null && w.getLastSeen().isAfter(staleBefore))
                .isPresent();
    }
}
