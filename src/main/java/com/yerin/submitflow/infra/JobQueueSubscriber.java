package com.yerin.submitflow.infra;

import com.yerin.submitflow.domain.*;
import com.yerin.submitflow.domain.failure.MessageValidationException;
import com.yerin.submitflow.service.AuditTrail;
import com.yerin.submitflow.service.FlowHandle;
import com.yerin.submitflow.service.JobFlowService;
import com.yerin.submitflow.service.JobMessageParser;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Long-polls the jobs queue and turns each valid message into a flow trigger.
 * A message is acked only after its trigger has been recorded; invalid messages are
 * acked and dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobQueueSubscriber {

    private final DurableQueuePort queue;
    private final JobMessageParser parser;
    private final JobFlowService flowService;
    private final AuditTrail auditTrail;
    private final TriggerCircuitBreaker breaker;
    private final PipelineMetrics metrics;

    @Value("${submitflow.subscriber.enabled:true}")
    private boolean enabled = true;

    @Value("${submitflow.subscriber.max-messages:5}")
    private int maxMessages = 5;

    @Value("${submitflow.subscriber.wait-seconds:20}")
    private long waitSeconds = 20;

    private final String consumer = WorkerId.consumerName();
    private ExecutorService loop;

    @PostConstruct
    void start() {
        if (!enabled) {
            log.info("[Subscriber] disabled");
            return;
        }
        loop = Executors.newSingleThreadExecutor(r -> new Thread(r, "job-subscriber"));
        loop.submit(() -> {
            while (!Thread.currentThread().isInterrupted()) {
                try {
                    if (!breaker.allowRequest()) {
                        Thread.sleep(Math.max(100, Math.min(1000, breaker.remainingCooldown().toMillis())));
                        continue;
                    }
                    pollOnce();
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                } catch (Exception e) {
                    log.warn("[Subscriber] poll loop error: {}", e.toString());
                    try { Thread.sleep(1000); } catch (InterruptedException ignored) {
                        Thread.currentThread().interrupt();
                    }
                }
            }
        });
        log.info("[Subscriber] started consumer={}", consumer);
    }

    @PreDestroy
    void stop() {
        if (loop != null) loop.shutdownNow();
    }

    /** @return number of messages acked after a recorded trigger */
    public int pollOnce() throws InterruptedException {
        if (!breaker.allowRequest()) return 0;
        List<QueueMessage> messages = queue.receive(DurableQueuePort.JOBS, consumer, maxMessages, Duration.ofSeconds(waitSeconds));
        int triggered = 0;
        for (QueueMessage m : messages) {
            if (handle(m)) triggered++;
        }
        return triggered;
    }

    boolean handle(QueueMessage m) {
        JobMessage job;
        try {
            job = parser.parse(m.body());
        } catch (MessageValidationException e) {
            log.warn("[Subscriber] drop invalid message id={}, reason={}", m.id(), e.getMessage());
            metrics.incInvalid();
            queue.ack(DurableQueuePort.JOBS, m);
            return false;
        }

        FlowHandle handle = null;
        try {
            Map<String, Object> claimed = new LinkedHashMap<>();
            claimed.put("message_id", m.id());
            claimed.put("receive_count", m.receiveCount());
            auditTrail.append(job.jobId(), null, HistoryEventType.QUEUE_CLAIMED, claimed);

            handle = flowService.trigger(job);

            Map<String, Object> triggered = new LinkedHashMap<>();
            triggered.put("flow_run_id", handle.flowRunId());
            triggered.put("mode", handle.mode().name());
            auditTrail.append(job.jobId(), null, HistoryEventType.FLOW_TRIGGERED, triggered);
        } catch (RuntimeException e) {
            if (handle != null) handle.abort();
            breaker.recordFailure();
            metrics.incTriggerFailure();
            log.warn("[Subscriber] trigger failed jobId={}, id={}, receives={}, err={}",
                    job.jobId(), m.id(), m.receiveCount(), e.toString());
            return false;
        }

        handle.release();
        queue.ack(DurableQueuePort.JOBS, m);
        breaker.recordSuccess();
        log.info("[Subscriber] ACK jobId={}, id={}, flowRunId={}, mode={}", job.jobId(), m.id(), handle.flowRunId(), handle.mode());
        return true;
    }
}
