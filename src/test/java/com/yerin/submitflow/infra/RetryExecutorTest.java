package com.yerin.submitflow.infra;

import com.yerin.submitflow.domain.failure.StructuralFailureException;
import com.yerin.submitflow.domain.failure.TaskDeadlineExceededException;
import com.yerin.submitflow.domain.failure.TransientAutomationException;
import com.yerin.submitflow.domain.failure.TransientInfraException;
import com.yerin.submitflow.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RetryExecutor 단위 테스트")
class RetryExecutorTest {

    static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    MutableClock clock = new MutableClock(T0);
    List<Duration> slept = new ArrayList<>();
    // 잠드는 대신 시계를 앞으로
    Sleeper sleeper = d -> { slept.add(d); clock.advance(d); };

    ExecutorService attemptPool = Executors.newCachedThreadPool();

    RetryExecutor sut = new RetryExecutor(clock, sleeper, attemptPool);

    RetryPolicy noJitter = new RetryPolicy(3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(60), 0.0);

    @AfterEach
    void tearDown() {
        attemptPool.shutdownNow();
    }

    @Test
    @DisplayName("일시 장애 두 번 뒤 성공하면 재시도 2회 후 결과 반환")
    void transient_then_success() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        List<Integer> retries = new ArrayList<>();

        String out = sut.execute(noJitter, T0.plusSeconds(480), n -> {
            if (calls.incrementAndGet() < 3) throw new TransientAutomationException("timeout");
            return "ok-" + n;
        }, (retryNo, delay, cause) -> retries.add(retryNo));

        assertThat(out).isEqualTo("ok-3");
        assertThat(retries).containsExactly(1, 2);
        assertThat(slept).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("구조적 실패는 재시도 없이 즉시 전파")
    void structural_not_retried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> sut.execute(noJitter, T0.plusSeconds(480), n -> {
            calls.incrementAndGet();
            throw new StructuralFailureException("form changed");
        }, (r, d, c) -> {}))
                .isInstanceOf(StructuralFailureException.class);

        assertThat(calls).hasValue(1);
        assertThat(slept).isEmpty();
    }

    @Test
    @DisplayName("재시도를 다 쓰면 마지막 실패를 던짐 (첫 시도 + 3회)")
    void exhausts_retries() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> sut.execute(noJitter, T0.plusSeconds(480), n -> {
            calls.incrementAndGet();
            throw new TransientInfraException("oracle 503");
        }, (r, d, c) -> {}))
                .isInstanceOf(TransientInfraException.class)
                .hasMessage("oracle 503");

        assertThat(calls).hasValue(4);
        assertThat(slept).hasSize(3);
    }

    @Test
    @DisplayName("다음 백오프가 마감을 넘기면 마감 초과로 종료")
    void backoff_crossing_deadline() {
        RetryPolicy slow = new RetryPolicy(3, Duration.ofSeconds(10), 2.0, Duration.ofSeconds(60), 0.0);

        assertThatThrownBy(() -> sut.execute(slow, T0.plusSeconds(15), n -> {
            throw new TransientAutomationException("timeout");
        }, (r, d, c) -> {}))
                .isInstanceOf(TaskDeadlineExceededException.class)
                .hasCauseInstanceOf(TransientAutomationException.class);

        assertThat(slept).containsExactly(Duration.ofSeconds(10));
    }

    @Test
    @DisplayName("이미 마감이 지났으면 시도하지 않음")
    void deadline_already_passed() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> sut.execute(noJitter, T0, n -> calls.incrementAndGet(), (r, d, c) -> {}))
                .isInstanceOf(TaskDeadlineExceededException.class);
        assertThat(calls).hasValue(0);
    }

    @Test
    @DisplayName("시도 도중 마감을 넘기면 성공 결과라도 버리고 마감 초과로 종료")
    void attempt_finishing_after_deadline_is_discarded() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> sut.execute(noJitter, T0.plusSeconds(480), n -> {
            calls.incrementAndGet();
            clock.advance(Duration.ofSeconds(700));
            return "SUBMITTED";
        }, (r, d, c) -> {}))
                .isInstanceOf(TaskDeadlineExceededException.class);

        assertThat(calls).hasValue(1);
        assertThat(slept).isEmpty();
    }

    @Test
    @DisplayName("마감까지 끝나지 않는 시도는 인터럽트로 취소")
    void running_attempt_is_cancelled_at_deadline() throws Exception {
        CountDownLatch neverReleased = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);

        assertThatThrownBy(() -> sut.execute(noJitter, T0.plusMillis(200), n -> {
            try {
                neverReleased.await();
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return "SUBMITTED";
        }, (r, d, c) -> {}))
                .isInstanceOf(TaskDeadlineExceededException.class);

        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    }
}
