package com.yerin.submitflow.domain;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * At-least-once queue with a visibility timeout and a dead-letter queue per queue name.
 * A received message stays invisible until it is acked or the timeout elapses. A message
 * that reached the max receive count is moved to {@code <queue>:dlq} instead of being redelivered.
 */
public interface DurableQueuePort {

    String JOBS = "jobs";
    String TASKS = "tasks";

    String enqueue(String queue, String body);

    List<QueueMessage> receive(String queue, String consumer, int max, Duration wait) throws InterruptedException;

    void ack(String queue, QueueMessage message);

    long depth(String queue);

    long deadLetterDepth(String queue);

    List<QueueMessage> deadLetters(String queue, int limit);

    // DLQ 메시지를 원래 큐로 되돌린다. 없으면 false
    boolean redrive(String queue, String messageId);

    void onDeadLetter(String queue, Consumer<QueueMessage> listener);

    void ping();

    static String deadLetterName(String queue) {
        return queue + ":dlq";
    }
}
