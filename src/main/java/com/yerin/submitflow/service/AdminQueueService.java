package com.yerin.submitflow.service;

import com.yerin.submitflow.domain.DurableQueuePort;
import com.yerin.submitflow.domain.QueueMessage;
import com.yerin.submitflow.global.exception.AppException;
import com.yerin.submitflow.global.exception.code.JobErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class AdminQueueService {

    static final List<String> QUEUES = List.of(DurableQueuePort.JOBS, DurableQueuePort.TASKS);

    private final DurableQueuePort queue;

    public Map<String, Object> queueStats() {
        Map<String, Object> streams = new LinkedHashMap<>();
        for (String q : QUEUES) {
            streams.put(q, Map.of("depth", queue.depth(q), "dlq", queue.deadLetterDepth(q)));
        }
        return Map.of(
                "streams", streams,
                "ts", Instant.now().toString()
        );
    }

    public List<QueueMessage> deadLetters(String queueName, int limit) {
        requireKnown(queueName);
        return queue.deadLetters(queueName, Math.max(1, Math.min(limit, 500)));
    }

    public void replay(String queueName, String messageId) {
        requireKnown(queueName);
        if (!queue.redrive(queueName, messageId)) {
            throw new AppException(JobErrorCode.DLQ_MESSAGE_NOT_FOUND);
        }
        log.info("[Admin] redrive queue={}, messageId={}", queueName, messageId);
    }

    private static void requireKnown(String queueName) {
        if (!QUEUES.contains(queueName)) throw new AppException(JobErrorCode.UNKNOWN_QUEUE);
    }
}
