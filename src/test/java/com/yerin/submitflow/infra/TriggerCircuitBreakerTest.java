package com.yerin.submitflow.infra;

import com.yerin.submitflow.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

@DisplayName("트리거 서킷 브레이커 테스트")
class TriggerCircuitBreakerTest {

    MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    TriggerCircuitBreaker sut = new TriggerCircuitBreaker(5, 60_000, clock);

    @Test
    @DisplayName("연속 실패 5회에 열리고 쿨다운 동안 요청 차단")
    void opens_after_threshold() {
        for (int i = 0; i < 4; i++) sut.recordFailure();
        assertThat(sut.allowRequest()).isTrue();

        sut.recordFailure();
        assertThat(sut.state()).isEqualTo(TriggerCircuitBreaker.State.OPEN);
        assertThat(sut.allowRequest()).isFalse();
        assertThat(sut.remainingCooldown()).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    @DisplayName("성공이 끼면 연속 실패 카운트 초기화")
    void success_resets_count() {
        for (int i = 0; i < 4; i++) sut.recordFailure();
        sut.recordSuccess();
        for (int i = 0; i < 4; i++) sut.recordFailure();

        assertThat(sut.state()).isEqualTo(TriggerCircuitBreaker.State.CLOSED);
    }

    @Test
    @DisplayName("쿨다운 후 half-open, 성공하면 닫힘")
    void half_open_then_close() {
        for (int i = 0; i < 5; i++) sut.recordFailure();
        clock.advance(Duration.ofSeconds(60));

        assertThat(sut.allowRequest()).isTrue();
        assertThat(sut.state()).isEqualTo(TriggerCircuitBreaker.State.HALF_OPEN);

        sut.recordSuccess();
        assertThat(sut.state()).isEqualTo(TriggerCircuitBreaker.State.CLOSED);
    }

    @Test
    @DisplayName("half-open 에서 실패하면 바로 다시 열림")
    void half_open_failure_reopens() {
        for (int i = 0; i < 5; i++) sut.recordFailure();
        clock.advance(Duration.ofSeconds(61));
        sut.allowRequest();

        sut.recordFailure();
        assertThat(sut.state()).isEqualTo(TriggerCircuitBreaker.State.OPEN);
        assertThat(sut.allowRequest()).isFalse();
    }
}
