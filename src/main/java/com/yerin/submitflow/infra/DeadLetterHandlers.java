package com.yerin.submitflow.infra;

import com.yerin.submitflow.domain.*;
import com.yerin.submitflow.domain.failure.MessageValidationException;
import com.yerin.submitflow.service.AuditTrail;
import com.yerin.submitflow.service.JobMessageParser;
import com.yerin.submitflow.service.RecoveryService;
import com.yerin.submitflow.service.TaskMessageParser;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keeps jobs converging when messages exhaust their redelivery budget. A dead task becomes a
 * FAILED result and is settled; a dead job message is recorded for operators to redrive.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeadLetterHandlers {

    static final String TASK_BUDGET_EXCEEDED = "exceeded redelivery budget";

    private final DurableQueuePort queue;
    private final TaskMessageParser taskParser;
    private final JobMessageParser jobParser;
    private final RecoveryService recoveryService;
    private final AuditTrail auditTrail;
    private final PipelineMetrics metrics;

    @PostConstruct
    void register() {
        queue.onDeadLetter(DurableQueuePort.TASKS, this::onDeadTask);
        queue.onDeadLetter(DurableQueuePort.JOBS, this::onDeadJob);
    }

    void onDeadTask(QueueMessage m) {
        metrics.incDeadLettered();
        TaskMessage task;
        try {
            task = taskParser.parse(m.body());
        } catch (MessageValidationException e) {
            log.warn("[DLQ] unreadable task id={}, reason={}", m.id(), e.getMessage());
            return;
        }
        log.warn("[DLQ] task dead-lettered jobId={}, directory={}, receives={}",
                task.jobId(), task.directory().id(), m.receiveCount());
        recoveryService.failDirectory(task.jobId(), task.directory(), task.businessProfile(), TASK_BUDGET_EXCEEDED);
    }

    void onDeadJob(QueueMessage m) {
        metrics.incDeadLettered();
        JobMessage job;
        try {
            job = jobParser.parse(m.body());
        } catch (MessageValidationException e) {
            log.warn("[DLQ] unreadable job message id={}, reason={}", m.id(), e.getMessage());
            return;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("message_id", m.id());
        details.put("receive_count", m.receiveCount());
        auditTrail.append(job.jobId(), null, HistoryEventType.JOB_DEAD_LETTERED, details);
        log.warn("[DLQ] job message dead-lettered jobId={}, receives={}", job.jobId(), m.receiveCount());
    }
}
