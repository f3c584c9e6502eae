package com.yerin.submitflow.infra;

import com.yerin.submitflow.domain.DurableQueuePort;
import com.yerin.submitflow.domain.QueueMessage;
import com.yerin.submitflow.support.IntegrationTestBase;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "submitflow.subscriber.enabled=false",
        "submitflow.worker.enabled=false",
        "submitflow.queue.prefix=it:queue",
        "submitflow.queue.visibility-timeout-seconds=1",
        "submitflow.task.timeout-seconds=0",
        "submitflow.queue.max-receive-count=2"
})
@ActiveProfiles("test")
@DisplayName("Redis Streams 큐 어댑터: 가시성 타임아웃, 재전달, DLQ")
class RedisStreamsQueueAdapterTest extends IntegrationTestBase {

    @Autowired
    DurableQueuePort queue;

    @Test
    @DisplayName("ack 한 메시지는 스트림에서 사라짐")
    void ack_removes() throws Exception {
        String q = "ack-" + System.nanoTime();
        String id = queue.enqueue(q, "{\"n\":1}");

        List<QueueMessage> got = queue.receive(q, "c-1", 10, Duration.ofMillis(100));
        assertThat(got).extracting(QueueMessage::id).containsExactly(id);
        assertThat(got.get(0).receiveCount()).isEqualTo(1);

        queue.ack(q, got.get(0));
        assertThat(queue.depth(q)).isZero();
    }

    @Test
    @DisplayName("ack 없이 가시성 타임아웃이 지나면 다른 소비자에게 재전달")
    void redelivers_after_visibility() throws Exception {
        String q = "redeliver-" + System.nanoTime();
        String id = queue.enqueue(q, "{\"n\":2}");
        queue.receive(q, "c-1", 1, Duration.ofMillis(100));

        assertThat(queue.receive(q, "c-2", 1, Duration.ZERO)).isEmpty();

        Awaitility.await()
                .atMost(Duration.ofSeconds(5))
                .pollInterval(Duration.ofMillis(200))
                .untilAsserted(() -> {
                    List<QueueMessage> again = queue.receive(q, "c-2", 1, Duration.ZERO);
                    assertThat(again).extracting(QueueMessage::id).containsExactly(id);
                    assertThat(again.get(0).receiveCount()).isEqualTo(2);
                });
    }

    @Test
    @DisplayName("최대 수신 횟수를 넘기면 DLQ 로 옮기고 리스너 호출, 재처리로 되돌림")
    void dead_letters_and_redrives() throws Exception {
        String q = "dlq-" + System.nanoTime();
        List<QueueMessage> notified = new CopyOnWriteArrayList<>();
        queue.onDeadLetter(q, notified::add);
        queue.enqueue(q, "{\"n\":3}");
        queue.receive(q, "c-1", 1, Duration.ofMillis(100));

        Awaitility.await()
                .atMost(Duration.ofSeconds(8))
                .pollInterval(Duration.ofMillis(300))
                .untilAsserted(() -> {
                    queue.receive(q, "c-1", 1, Duration.ZERO);
                    assertThat(queue.deadLetterDepth(q)).isEqualTo(1);
                });
        assertThat(notified).hasSize(1);
        assertThat(queue.depth(q)).isZero();

        QueueMessage dead = queue.deadLetters(q, 10).get(0);
        assertThat(dead.body()).isEqualTo("{\"n\":3}");
        assertThat(queue.redrive(q, dead.id())).isTrue();
        assertThat(queue.deadLetterDepth(q)).isZero();
        assertThat(queue.depth(q)).isEqualTo(1);
        assertThat(queue.redrive(q, dead.id())).isFalse();
    }

    @Test
    @DisplayName("ping 은 연결이 살아 있으면 예외 없음")
    void ping() {
        queue.ping();
        assertThat(DurableQueuePort.deadLetterName("jobs")).isEqualTo("jobs:dlq");
    }
}
