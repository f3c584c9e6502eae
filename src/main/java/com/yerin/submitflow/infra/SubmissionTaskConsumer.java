package com.yerin.submitflow.infra;

import com.yerin.submitflow.domain.DurableQueuePort;
import com.yerin.submitflow.domain.PipelineMetrics;
import com.yerin.submitflow.domain.QueueMessage;
import com.yerin.submitflow.domain.TaskMessage;
import com.yerin.submitflow.domain.failure.MessageValidationException;
import com.yerin.submitflow.service.DirectorySubmissionTask;
import com.yerin.submitflow.service.TaskMessageParser;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Consumer threads of the tasks queue. The thread count is this worker's global browser
 * concurrency; each thread runs one directory task end to end.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SubmissionTaskConsumer {

    private final DurableQueuePort queue;
    private final TaskMessageParser parser;
    private final DirectorySubmissionTask submissionTask;
    private final WorkerState workerState;
    private final HeartbeatEmitter heartbeat;
    private final PipelineMetrics metrics;

    @Value("${submitflow.worker.enabled:true}")
    private boolean enabled = true;

    @Value("${submitflow.worker.concurrency:2}")
    private int concurrency = 2;

    @Value("${submitflow.worker.block-millis:2000}")
    private long blockMillis = 2000;

    private ExecutorService workers;

    @PostConstruct
    void startWorkers() {
        if (!enabled) {
            log.info("[TaskConsumer] disabled");
            return;
        }
        AtomicInteger seq = new AtomicInteger();
        workers = Executors.newFixedThreadPool(concurrency, r -> new Thread(r, "task-consumer-" + seq.incrementAndGet()));
        for (int i = 0; i < concurrency; i++) {
            final String consumer = WorkerId.consumerName();
            workers.submit(() -> {
                while (!Thread.currentThread().isInterrupted()) {
                    try {
                        pollOnce(consumer);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                    } catch (Exception e) {
                        log.warn("[TaskConsumer] poll loop error: {}", e.toString());
                        try { Thread.sleep(500); } catch (InterruptedException ignored) {
                            Thread.currentThread().interrupt();
                        }
                    }
                }
            });
        }
        log.info("[TaskConsumer] started {} consumers", concurrency);
    }

    @PreDestroy
    void stopWorkers() {
        if (workers != null) {
            workers.shutdownNow();
        }
    }

    public int pollOnce(String consumer) throws InterruptedException {
        List<QueueMessage> messages = queue.receive(DurableQueuePort.TASKS, consumer, 1, Duration.ofMillis(blockMillis));
        int done = 0;
        for (QueueMessage m : messages) {
            if (handle(m)) done++;
        }
        return done;
    }

    boolean handle(QueueMessage m) throws InterruptedException {
        TaskMessage task;
        try {
            task = parser.parse(m.body());
        } catch (MessageValidationException e) {
            log.warn("[TaskConsumer] drop invalid task id={}, reason={}", m.id(), e.getMessage());
            metrics.incInvalid();
            queue.ack(DurableQueuePort.TASKS, m);
            return false;
        }

        workerState.begin();
        heartbeat.beat();
        try {
            DirectorySubmissionTask.Result result = submissionTask.execute(task);
            queue.ack(DurableQueuePort.TASKS, m);
            log.info("[TaskConsumer] ACK jobId={}, directory={}, status={}, attempts={}",
                    task.jobId(), task.directory().id(), result.status(), result.attempts());
            return true;
        } catch (RuntimeException e) {
            // 결과 기록 실패: ack 하지 않고 가시성 타임아웃 뒤 재전달
            log.error("[TaskConsumer] task not recorded, leave for redelivery jobId={}, directory={}, receives={}, err={}",
                    task.jobId(), task.directory().id(), m.receiveCount(), e.toString());
            return false;
        } finally {
            workerState.end();
        }
    }
}
