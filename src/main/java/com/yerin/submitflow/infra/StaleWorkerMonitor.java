package com.yerin.submitflow.infra;

import com.yerin.submitflow.domain.*;
import com.yerin.submitflow.repository.JobRepository;
import com.yerin.submitflow.repository.WorkerHeartbeatRepository;
import com.yerin.submitflow.service.RecoveryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Flags workers whose heartbeat is older than {@code stale-multiplier} ticks as DEAD and
 * re-enqueues job messages for PENDING jobs whose flow was triggered on one of them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaleWorkerMonitor {

    private final WorkerHeartbeatRepository heartbeatRepository;
    private final JobRepository jobRepository;
    private final RecoveryService recoveryService;
    private final PipelineMetrics metrics;
    private final TransactionTemplate tx;
    private final Clock clock;

    @Value("${submitflow.heartbeat.interval-ms:20000}")
    private long heartbeatIntervalMs = 20000;

    @Value("${submitflow.monitor.stale-worker.multiplier:2}")
    private int staleMultiplier = 2;

    @Scheduled(fixedDelayString = "${submitflow.monitor.stale-worker.interval-ms:30000}",
            initialDelayString = "${submitflow.monitor.stale-worker.interval-ms:30000}")
    public void scheduledScan() {
        try {
            scan();
        } catch (RuntimeException e) {
            log.warn("[StaleWorker] scan failed: {}", e.toString());
        }
    }

    /** @return ids of the workers flagged DEAD by this scan */
    public List<String> scan() {
        Instant now = clock.instant();
        Instant cutoff = now.minusMillis(heartbeatIntervalMs * staleMultiplier);

        List<WorkerHeartbeat> stale = heartbeatRepository
                .findTop100ByStatusNotAndLastSeenLessThanOrderByLastSeenAsc(WorkerStatus.DEAD, cutoff);
        List<String> dead = new ArrayList<>();
        for (WorkerHeartbeat w : stale) {
            Integer flagged = tx.execute(s -> heartbeatRepository.markDeadIfStale(w.getWorkerId(), cutoff, now));
            if (flagged != null && flagged > 0) {
                dead.add(w.getWorkerId());
                metrics.incWorkerDead();
                log.warn("[StaleWorker] worker DEAD workerId={}, lastSeen={}", w.getWorkerId(), w.getLastSeen());
            }
        }
        if (dead.isEmpty()) return dead;

        int requeued = 0;
        for (Job job : jobRepository.findTop100ByStatusAndWorkerIdIn(JobStatus.PENDING, dead)) {
            try {
                recoveryService.requeueJobMessage(job, "worker_dead:" + job.getWorkerId());
                requeued++;
            } catch (RuntimeException e) {
                log.warn("[StaleWorker] requeue failed jobId={}, err={}", job.getId(), e.toString());
            }
        }
        log.info("[StaleWorker] dead={}, requeued={}", dead.size(), requeued);
        return dead;
    }
}
