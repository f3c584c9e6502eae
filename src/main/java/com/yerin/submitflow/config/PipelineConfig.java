package com.yerin.submitflow.config;

import com.yerin.submitflow.infra.RetryPolicy;
import com.yerin.submitflow.infra.Sleeper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.system();
    }

    @Bean
    public RetryPolicy retryPolicy(@Value("${submitflow.retry.max-retries:3}") int maxRetries,
                                   @Value("${submitflow.retry.base-delay-ms:1000}") long baseDelayMs,
                                   @Value("${submitflow.retry.factor:2.0}") double factor,
                                   @Value("${submitflow.retry.max-delay-ms:60000}") long maxDelayMs,
                                   @Value("${submitflow.retry.jitter:0.25}") double jitter) {
        return new RetryPolicy(maxRetries, Duration.ofMillis(baseDelayMs), factor, Duration.ofMillis(maxDelayMs), jitter);
    }

    // 큐가 가득 차면 RejectedExecutionException 으로 트리거 실패 처리
    @Bean(name = "flowExecutor", destroyMethod = "shutdownNow")
    public ExecutorService flowExecutor(@Value("${submitflow.flow.pool-size:4}") int poolSize,
                                        @Value("${submitflow.flow.queue-capacity:100}") int queueCapacity) {
        AtomicInteger seq = new AtomicInteger();
        return new ThreadPoolExecutor(poolSize, poolSize, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(queueCapacity),
                r -> new Thread(r, "job-flow-" + seq.incrementAndGet()),
                new ThreadPoolExecutor.AbortPolicy());
    }

    // 시도마다 마감까지 남은 시간만 기다리고, 넘기면 취소(interrupt)
    @Bean(name = "attemptExecutor", destroyMethod = "shutdownNow")
    public ExecutorService attemptExecutor() {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "submission-attempt-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
