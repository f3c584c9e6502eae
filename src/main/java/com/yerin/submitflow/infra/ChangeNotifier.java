package com.yerin.submitflow.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Best-effort change feed for dashboards. A failed publish is logged and never fails the caller.
 * Changes raised inside a transaction go out only after it commits; a rollback drops them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChangeNotifier {

    public record Change(String view, String jobId, String key, String value) {
    }

    private final ApplicationEventPublisher events;
    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;

    @Value("${submitflow.notify.enabled:true}")
    private boolean enabled;

    @Value("${submitflow.notify.channel:submitflow:changes}")
    private String channel;

    public void publish(String view, String jobId, String key, String value) {
        if (!enabled) return;
        events.publishEvent(new Change(view, jobId, key, value));
    }

    // 트랜잭션 밖에서 발행된 변경은 바로 전송
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void send(Change change) {
        Map<String, Object> msg = new LinkedHashMap<>();
        msg.put("view", change.view());
        msg.put("job_id", change.jobId());
        msg.put(change.key(), change.value());
        try {
            redis.convertAndSend(channel, objectMapper.writeValueAsString(msg));
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("[Notify] publish failed view={}, jobId={}, err={}", change.view(), change.jobId(), e.toString());
        }
    }
}
