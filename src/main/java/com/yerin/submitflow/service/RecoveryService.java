package com.yerin.submitflow.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.submitflow.domain.*;
import com.yerin.submitflow.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.*;

/**
 * Re-enqueue and orphan handling shared by the monitors and dead-letter handlers.
 * Everything here is safe to repeat: task redo is covered by the result idempotency key
 * and a re-enqueued job message is a no-op for a job that already left PENDING.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecoveryService {

    private static final TypeReference<List<DirectoryDescriptor>> PLAN = new TypeReference<>() {};
    private static final TypeReference<Map<String, String>> SNAPSHOT = new TypeReference<>() {};

    private final JobRepository jobRepository;
    private final DurableQueuePort queue;
    private final JobMessageParser jobParser;
    private final TaskMessageParser taskParser;
    private final ResultStore resultStore;
    private final IdempotencyKeys idempotencyKeys;
    private final JobProgressService progressService;
    private final AuditTrail auditTrail;
    private final PipelineMetrics metrics;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate tx;
    private final Clock clock;

    public void requeueJobMessage(Job job, String reason) {
        JobMessage message = new JobMessage(job.getId(), job.getCustomerId(), job.getPackageSize(), job.getPriority(),
                job.getCreatedAt() == null ? null : job.getCreatedAt().toString(), job.getSource());
        String messageId = queue.enqueue(DurableQueuePort.JOBS, jobParser.write(message));
        tx.execute(s -> jobRepository.touchPending(job.getId(), clock.instant()));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", reason);
        details.put("kind", "job");
        details.put("message_id", messageId);
        auditTrail.append(job.getId(), null, HistoryEventType.JOB_REQUEUED, details);
        metrics.incRequeued();
        log.info("[Recovery] requeued job message jobId={}, reason={}", job.getId(), reason);
    }

    public int requeueMissingTasks(Job job, String reason) {
        List<DirectoryDescriptor> missing = missingDirectories(job);
        if (missing.isEmpty()) {
            // 모두 정산됐는데 종료되지 않은 경우
            progressService.settle(job.getId());
            return 0;
        }
        Map<String, String> snapshot = readSnapshot(job);
        PackageTier tier = tier(job);
        for (DirectoryDescriptor d : missing) {
            queue.enqueue(DurableQueuePort.TASKS,
                    taskParser.write(new TaskMessage(job.getId(), job.getFlowRunId(), d, snapshot, tier)));
        }
        tx.execute(s -> jobRepository.touchIf(job.getId(), JobStatus.IN_PROGRESS, clock.instant()));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", reason);
        details.put("kind", "tasks");
        details.put("directories", missing.stream().map(DirectoryDescriptor::name).toList());
        auditTrail.append(job.getId(), null, HistoryEventType.JOB_REQUEUED, details);
        metrics.incRequeued();
        log.info("[Recovery] requeued tasks jobId={}, count={}, reason={}", job.getId(), missing.size(), reason);
        return missing.size();
    }

    /**
     * Writes FAILED rows for planned directories without a terminal result and settles them,
     * which finalizes the job.
     */
    public int failMissing(Job job, String reason) {
        List<DirectoryDescriptor> plan = readPlan(job);
        if (plan.isEmpty()) {
            progressService.failJob(job.getId(), reason);
            return 0;
        }
        List<DirectoryDescriptor> missing = missingDirectories(job);
        Map<String, String> snapshot = readSnapshot(job);
        for (DirectoryDescriptor d : missing) {
            failDirectory(job.getId(), d, snapshot, reason);
        }
        if (missing.isEmpty()) progressService.settle(job.getId());
        log.warn("[Recovery] orphaned directories failed jobId={}, count={}, reason={}", job.getId(), missing.size(), reason);
        return missing.size();
    }

    public void failDirectory(String jobId, DirectoryDescriptor directory, Map<String, String> snapshot, String reason) {
        String key = idempotencyKeys.keyFor(jobId, directory.id(), snapshot);
        ResultStore.UpsertOutcome outcome = resultStore.upsert(ResultWrite.builder()
                .jobId(jobId)
                .directory(directory.name())
                .status(JobResultStatus.FAILED)
                .idempotencyKey(key)
                .payload(snapshot)
                .responseLog(Map.of("error", reason))
                .errorMessage(reason)
                .build());
        JobResultStatus settledAs = outcome == ResultStore.UpsertOutcome.DUPLICATE_SUCCESS
                ? JobResultStatus.SKIPPED : JobResultStatus.FAILED;
        progressService.onTaskSettled(jobId, directory.name(), settledAs, key);
    }

    List<DirectoryDescriptor> missingDirectories(Job job) {
        Set<String> settled = new HashSet<>(resultStore.settledDirectories(job.getId()));
        return readPlan(job).stream().filter(d -> !settled.contains(d.name())).toList();
    }

    private List<DirectoryDescriptor> readPlan(Job job) {
        return read(job.getDirectoryPlan(), PLAN, List.of());
    }

    private Map<String, String> readSnapshot(Job job) {
        return read(job.getProfileSnapshot(), SNAPSHOT, Map.of());
    }

    private static PackageTier tier(Job job) {
        return job.getPackageType() != null ? job.getPackageType() : PackageTier.fromPriority(job.getPriority());
    }

    private <T> T read(String json, TypeReference<T> type, T fallback) {
        if (json == null || json.isBlank()) return fallback;
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("stored job state unreadable", e);
        }
    }
}
