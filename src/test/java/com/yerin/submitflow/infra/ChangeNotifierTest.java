package com.yerin.submitflow.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.EnableTransactionManagement;
import org.springframework.transaction.support.AbstractPlatformTransactionManager;
import org.springframework.transaction.support.DefaultTransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@SpringJUnitConfig(ChangeNotifierTest.Config.class)
@DisplayName("ChangeNotifier 단위 테스트")
class ChangeNotifierTest {

    @Configuration
    @EnableTransactionManagement
    static class Config {

        @Bean
        PlatformTransactionManager transactionManager() {
            return new SynchronizationOnlyTransactionManager();
        }

        @Bean
        StringRedisTemplate redis() {
            return mock(StringRedisTemplate.class);
        }

        @Bean
        ChangeNotifier changeNotifier(ApplicationEventPublisher events, StringRedisTemplate redis) {
            return new ChangeNotifier(events, redis, new ObjectMapper());
        }
    }

    // 리소스 없이 동기화 콜백만 돌려주는 트랜잭션 매니저
    static class SynchronizationOnlyTransactionManager extends AbstractPlatformTransactionManager {
        @Override
        protected Object doGetTransaction() {
            return new Object();
        }

        @Override
        protected void doBegin(Object transaction, TransactionDefinition definition) {
        }

        @Override
        protected void doCommit(DefaultTransactionStatus status) {
        }

        @Override
        protected void doRollback(DefaultTransactionStatus status) {
        }
    }

    @Autowired
    ChangeNotifier notifier;

    @Autowired
    StringRedisTemplate redis;

    @Autowired
    PlatformTransactionManager txManager;

    @BeforeEach
    void setUp() {
        reset(redis);
    }

    @Test
    @DisplayName("트랜잭션 안의 변경은 커밋 후에만 전송")
    void sends_after_commit() {
        new TransactionTemplate(txManager).executeWithoutResult(s -> {
            notifier.publish("jobs", "job-1", "status", "COMPLETED");
            verifyNoInteractions(redis);
        });

        verify(redis).convertAndSend(eq("submitflow:changes"),
                eq("{\"view\":\"jobs\",\"job_id\":\"job-1\",\"status\":\"COMPLETED\"}"));
    }

    @Test
    @DisplayName("롤백된 트랜잭션의 변경은 전송하지 않음")
    void rollback_drops_change() {
        new TransactionTemplate(txManager).executeWithoutResult(s -> {
            notifier.publish("jobs", "job-1", "status", "COMPLETED");
            s.setRollbackOnly();
        });

        verifyNoInteractions(redis);
    }

    @Test
    @DisplayName("트랜잭션 밖에서는 바로 전송")
    void sends_immediately_without_transaction() {
        notifier.publish("job_results", "job-2", "status", "SUBMITTED");

        verify(redis).convertAndSend(eq("submitflow:changes"), contains("\"job_id\":\"job-2\""));
    }

    @Test
    @DisplayName("Redis 전송 실패는 호출자에게 전파되지 않음")
    void publish_failure_does_not_propagate() {
        when(redis.convertAndSend(anyString(), anyString())).thenThrow(new IllegalStateException("redis down"));

        notifier.publish("jobs", "job-3", "status", "FAILED");

        verify(redis).convertAndSend(anyString(), anyString());
    }
}
