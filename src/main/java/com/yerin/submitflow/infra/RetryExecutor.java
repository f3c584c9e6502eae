package com.yerin.submitflow.infra;

import com.yerin.submitflow.domain.failure.PipelineException;
import com.yerin.submitflow.domain.failure.TaskDeadlineExceededException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs an attempt until it succeeds, fails with a non-retryable failure, runs out of retries,
 * or the task deadline passes. Each attempt only gets the time left before the deadline;
 * an attempt still running at the deadline is cancelled and its result is never used.
 */
@Slf4j
@Component
public class RetryExecutor {

    private final Clock clock;
    private final Sleeper sleeper;
    private final ExecutorService attemptExecutor;

    public RetryExecutor(Clock clock, Sleeper sleeper,
                         @Qualifier("attemptExecutor") ExecutorService attemptExecutor) {
        this.clock = clock;
        this.sleeper = sleeper;
        this.attemptExecutor = attemptExecutor;
    }

    @FunctionalInterface
    public interface Attempt<T> {
        T run(int attemptNo) throws InterruptedException;
    }

    @FunctionalInterface
    public interface RetryListener {
        void onRetry(int retryNo, Duration delay, PipelineException cause);
    }

    public <T> T execute(RetryPolicy policy, Instant deadline, Attempt<T> attempt, RetryListener listener)
            throws InterruptedException {
        int retries = 0;
        PipelineException last = null;
        while (true) {
            if (!clock.instant().isBefore(deadline)) {
                throw new TaskDeadlineExceededException(deadline, last);
            }
            try {
                return runWithin(attempt, retries + 1, deadline, last);
            } catch (PipelineException e) {
                last = e;
                if (!e.isRetryable()) throw e;
                if (retries >= policy.maxRetries()) {
                    log.info("[Retry] exhausted retries={}, cause={}", retries, e.getMessage());
                    throw e;
                }
                Duration delay = policy.delayFor(retries);
                if (clock.instant().plus(delay).isAfter(deadline)) {
                    throw new TaskDeadlineExceededException(deadline, e);
                }
                retries++;
                listener.onRetry(retries, delay, e);
                sleeper.sleep(delay);
            }
        }
    }

    private <T> T runWithin(Attempt<T> attempt, int attemptNo, Instant deadline, PipelineException last)
            throws InterruptedException {
        long remainingMs = Math.max(1, Duration.between(clock.instant(), deadline).toMillis());
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<T> future = attemptExecutor.submit(() -> {
            if (mdc != null) MDC.setContextMap(mdc);
            try {
                return attempt.run(attemptNo);
            } finally {
                MDC.clear();
            }
        });
        T out;
        try {
            out = future.get(remainingMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Retry] attempt={} cancelled at deadline={}", attemptNo, deadline);
            throw new TaskDeadlineExceededException(deadline, last);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
        // 시도가 끝났어도 마감을 넘겼다면 결과를 버린다
        if (clock.instant().isAfter(deadline)) {
            log.warn("[Retry] attempt={} finished after deadline={}, result discarded", attemptNo, deadline);
            throw new TaskDeadlineExceededException(deadline, last);
        }
        return out;
    }

    private static RuntimeException unwrap(Throwable cause) throws InterruptedException {
        if (cause instanceof RuntimeException r) return r;
        if (cause instanceof InterruptedException ie) throw ie;
        if (cause instanceof Error err) throw err;
        return new IllegalStateException("attempt failed", cause);
    }
}
