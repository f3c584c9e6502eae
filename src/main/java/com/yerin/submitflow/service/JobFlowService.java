package com.yerin.submitflow.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.submitflow.domain.*;
import com.yerin.submitflow.domain.failure.TransientInfraException;
import com.yerin.submitflow.infra.ChangeNotifier;
import com.yerin.submitflow.infra.WorkerId;
import com.yerin.submitflow.repository.BusinessProfileRepository;
import com.yerin.submitflow.repository.JobRepository;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.*;

/**
 * Starts job flows and fans them out into one task message per directory.
 * {@link #trigger} never blocks on the job itself: the flow is parked on the flow executor
 * behind a gate that the caller releases once the trigger has been recorded.
 */
@Slf4j
@Service
public class JobFlowService {

    private final JobRepository jobRepository;
    private final BusinessProfileRepository profileRepository;
    private final DirectoryCatalog directoryCatalog;
    private final DurableQueuePort queue;
    private final TaskMessageParser taskParser;
    private final AuditTrail auditTrail;
    private final JobProgressService progressService;
    private final ChangeNotifier notifier;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate tx;
    private final Executor flowExecutor;
    private final Clock clock;

    @Value("${submitflow.flow.accept-timeout-seconds:30}")
    private long acceptTimeoutSeconds = 30;

    // jobId -> flowRunId, 이 프로세스에서 실행 중인 플로우
    private final ConcurrentMap<String, String> activeFlows = new ConcurrentHashMap<>();

    public JobFlowService(JobRepository jobRepository,
                          BusinessProfileRepository profileRepository,
                          DirectoryCatalog directoryCatalog,
                          DurableQueuePort queue,
                          TaskMessageParser taskParser,
                          AuditTrail auditTrail,
                          JobProgressService progressService,
                          ChangeNotifier notifier,
                          ObjectMapper objectMapper,
                          TransactionTemplate tx,
                          @Qualifier("flowExecutor") Executor flowExecutor,
                          Clock clock) {
        this.jobRepository = jobRepository;
        this.profileRepository = profileRepository;
        this.directoryCatalog = directoryCatalog;
        this.queue = queue;
        this.taskParser = taskParser;
        this.auditTrail = auditTrail;
        this.progressService = progressService;
        this.notifier = notifier;
        this.objectMapper = objectMapper;
        this.tx = tx;
        this.flowExecutor = flowExecutor;
        this.clock = clock;
    }

    public FlowHandle trigger(JobMessage message) {
        Job job = ensureJob(message);
        String jobId = job.getId();

        if (job.getStatus().isTerminal()) {
            log.info("[Flow] job already terminal jobId={}, status={}", jobId, job.getStatus());
            return FlowHandle.noop(jobId, job.getFlowRunId());
        }

        String flowRunId = UUID.randomUUID().toString();
        String running = activeFlows.putIfAbsent(jobId, flowRunId);
        if (running != null) {
            log.info("[Flow] attach to running flow jobId={}, flowRunId={}", jobId, running);
            return FlowHandle.attached(jobId, running);
        }

        CompletableFuture<Void> gate = new CompletableFuture<>();
        try {
            flowExecutor.execute(() -> runGated(message, flowRunId, gate));
        } catch (RejectedExecutionException e) {
            activeFlows.remove(jobId, flowRunId);
            throw new TransientInfraException("flow executor saturated jobId=" + jobId, e);
        }

        try {
            tx.execute(s -> jobRepository.markTriggered(jobId, flowRunId, WorkerId.current(), clock.instant()));
        } catch (DataAccessException e) {
            gate.cancel(false);
            throw new TransientInfraException("trigger bookkeeping failed jobId=" + jobId, e);
        }
        log.info("[Flow] triggered jobId={}, flowRunId={}", jobId, flowRunId);
        return FlowHandle.started(jobId, flowRunId, gate);
    }

    public boolean isRunning(String jobId) {
        return activeFlows.containsKey(jobId);
    }

    private Job ensureJob(JobMessage m) {
        try {
            Optional<Job> existing = jobRepository.findById(m.jobId());
            if (existing.isPresent()) return existing.get();
            return tx.execute(s -> jobRepository.saveAndFlush(Job.builder()
                    .id(m.jobId())
                    .customerId(m.customerId())
                    .status(JobStatus.PENDING)
                    .packageSize(m.packageSize())
                    .packageType(m.packageType())
                    .priority(m.priority())
                    .source(m.source())
                    .build()));
        } catch (DataIntegrityViolationException e) {
            // 동시에 다른 워커가 먼저 생성
            return jobRepository.findById(m.jobId())
                    .orElseThrow(() -> new TransientInfraException("job row vanished jobId=" + m.jobId(), e));
        } catch (DataAccessException e) {
            throw new TransientInfraException("job lookup failed jobId=" + m.jobId(), e);
        }
    }

    private void runGated(JobMessage message, String flowRunId, CompletableFuture<Void> gate) {
        String jobId = message.jobId();
        try {
            gate.get(acceptTimeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            activeFlows.remove(jobId, flowRunId);
            return;
        } catch (CancellationException | ExecutionException | TimeoutException e) {
            log.info("[Flow] trigger not accepted jobId={}, flowRunId={}, cause={}", jobId, flowRunId, e.getClass().getSimpleName());
            activeFlows.remove(jobId, flowRunId);
            return;
        }

        MDC.put("jobId", jobId);
        try {
            runFlow(message, flowRunId);
        } catch (RuntimeException e) {
            // 메시지는 이미 ack 됨, 복구는 stale job 모니터가 담당
            log.error("[Flow] flow failed jobId={}, flowRunId={}", jobId, flowRunId, e);
        } finally {
            activeFlows.remove(jobId, flowRunId);
            MDC.remove("jobId");
        }
    }

    void runFlow(JobMessage message, String flowRunId) {
        String jobId = message.jobId();
        Map<String, Object> started = new LinkedHashMap<>();
        started.put("flow_run_id", flowRunId);
        started.put("package_size", message.packageSize());
        started.put("package_type", message.packageType().name());

        Optional<BusinessProfile> profile = profileRepository.findById(message.customerId());
        List<DirectoryDescriptor> directories = profile.isPresent()
                ? directoryCatalog.activeDirectories(message.packageSize())
                : List.of();
        Map<String, String> snapshot = profile.map(BusinessProfile::snapshot).orElse(Map.of());

        // flow_started 는 PENDING -> IN_PROGRESS 전이에 성공한 쪽만 남긴다
        Integer marked = tx.execute(s -> {
            int rows = jobRepository.markInProgress(jobId, clock.instant(), directories.size(),
                    WorkerId.current(), toJson(snapshot), toJson(directories));
            if (rows > 0) auditTrail.append(jobId, null, HistoryEventType.FLOW_STARTED, started);
            return rows;
        });
        if (marked == null || marked == 0) {
            log.info("[Flow] job not PENDING, skip fan-out jobId={}, flowRunId={}", jobId, flowRunId);
            return;
        }
        notifier.publish("jobs", jobId, "status", JobStatus.IN_PROGRESS.name());

        if (profile.isEmpty()) {
            progressService.failJob(jobId, "business profile not found customerId=" + message.customerId());
            return;
        }
        if (directories.isEmpty()) {
            progressService.failJob(jobId, "no active directories");
            return;
        }

        for (DirectoryDescriptor d : directories) {
            TaskMessage task = new TaskMessage(jobId, flowRunId, d, snapshot, message.packageType());
            queue.enqueue(DurableQueuePort.TASKS, taskParser.write(task));
        }
        log.info("[Flow] fan-out jobId={}, flowRunId={}, tasks={}", jobId, flowRunId, directories.size());
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("flow state not serializable", e);
        }
    }
}
