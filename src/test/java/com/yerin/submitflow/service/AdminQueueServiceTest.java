package com.yerin.submitflow.service;

import com.yerin.submitflow.domain.DurableQueuePort;
import com.yerin.submitflow.global.exception.AppException;
import com.yerin.submitflow.global.exception.code.JobErrorCode;
import com.yerin.submitflow.infra.InMemoryQueueAdapter;
import com.yerin.submitflow.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("AdminQueueService 단위 테스트")
class AdminQueueServiceTest {

    MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    InMemoryQueueAdapter queue = new InMemoryQueueAdapter(clock, 10, 1);
    AdminQueueService sut = new AdminQueueService(queue);

    String deadLetter(String body) throws InterruptedException {
        String id = queue.enqueue(DurableQueuePort.TASKS, body);
        queue.receive(DurableQueuePort.TASKS, "c", 1, Duration.ZERO);
        clock.advance(Duration.ofSeconds(11));
        queue.receive(DurableQueuePort.TASKS, "c", 1, Duration.ZERO);
        return id;
    }

    @Test
    @DisplayName("큐별 depth 와 dlq 집계")
    @SuppressWarnings("unchecked")
    void stats_per_queue() throws Exception {
        queue.enqueue(DurableQueuePort.JOBS, "{}");
        deadLetter("{\"x\":1}");

        Map<String, Object> stats = sut.queueStats();
        Map<String, Map<String, Long>> streams = (Map<String, Map<String, Long>>) stats.get("streams");

        assertThat(streams.get("jobs")).containsEntry("depth", 1L).containsEntry("dlq", 0L);
        assertThat(streams.get("tasks")).containsEntry("depth", 0L).containsEntry("dlq", 1L);
        assertThat(stats).containsKey("ts");
    }

    @Test
    @DisplayName("DLQ 메시지 재처리 후 원래 큐로 돌아감")
    void replay_moves_back() throws Exception {
        String id = deadLetter("{\"x\":1}");
        assertThat(sut.deadLetters("tasks", 50)).hasSize(1);

        sut.replay("tasks", id);

        assertThat(queue.deadLetterDepth(DurableQueuePort.TASKS)).isZero();
        assertThat(queue.depth(DurableQueuePort.TASKS)).isEqualTo(1);
    }

    @Test
    @DisplayName("없는 메시지 재처리는 DLQ_MESSAGE_NOT_FOUND")
    void replay_missing() {
        assertThatThrownBy(() -> sut.replay("tasks", "nope"))
                .isInstanceOf(AppException.class)
                .extracting(e -> ((AppException) e).getErrorCode())
                .isEqualTo(JobErrorCode.DLQ_MESSAGE_NOT_FOUND);
    }

    @Test
    @DisplayName("알 수 없는 큐 이름은 거부")
    void unknown_queue() {
        assertThatThrownBy(() -> sut.deadLetters("emails", 10))
                .isInstanceOf(AppException.class)
                .extracting(e -> ((AppException) e).getErrorCode())
                .isEqualTo(JobErrorCode.UNKNOWN_QUEUE);
    }
}
