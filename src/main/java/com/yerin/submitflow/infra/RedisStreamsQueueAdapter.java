package com.yerin.submitflow.infra;

import com.yerin.submitflow.domain.DurableQueuePort;
import com.yerin.submitflow.domain.QueueMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.Limit;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.stream.*;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * One stream per queue and one consumer group shared by every worker. Messages idle in the
 * pending list longer than the visibility timeout are claimed by the next receiver; once a
 * message has been delivered max-receive-count times it is moved to the {@code :dlq} stream.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@Profile("!local-inmem")
public class RedisStreamsQueueAdapter implements DurableQueuePort {

    private final StringRedisTemplate redis;
    private final Clock clock;

    @Value("${submitflow.queue.prefix:submitflow:queue}")
    private String streamPrefix;

    @Value("${submitflow.queue.group:submitflow:cg}")
    private String groupName;

    @Value("${submitflow.queue.visibility-timeout-seconds:600}")
    private long visibilitySeconds;

    @Value("${submitflow.queue.max-receive-count:3}")
    private int maxReceiveCount;

    private final Set<String> grouped = ConcurrentHashMap.newKeySet();
    private final Map<String, List<Consumer<QueueMessage>>> listeners = new ConcurrentHashMap<>();

    private String streamKey(String queue) {
        return streamPrefix + ":" + queue;
    }

    private String deadLetterKey(String queue) {
        return streamPrefix + ":" + DurableQueuePort.deadLetterName(queue);
    }

    @Override
    public String enqueue(String queue, String body) {
        String key = streamKey(queue);
        ensureGroup(key);

        Map<String, String> fields = new HashMap<>();
        fields.put("body", body);
        fields.put("enqueuedAt", clock.instant().toString());

        RecordId rid = redis.opsForStream().add(StreamRecords.mapBacked(fields).withStreamKey(key));
        log.info("[RedisStream] XADD key={}, id={}", key, rid);
        return rid.getValue();
    }

    @Override
    public List<QueueMessage> receive(String queue, String consumer, int max, Duration wait) {
        String key = streamKey(queue);
        ensureGroup(key);

        List<QueueMessage> out = new ArrayList<>(reclaimExpired(queue, key, consumer, max));
        if (out.size() >= max) return out;

        StreamReadOptions options = StreamReadOptions.empty().count(max - out.size());
        // BLOCK 0 은 무한 대기라서 0 이하면 블록하지 않음
        if (out.isEmpty() && !wait.isZero() && !wait.isNegative()) {
            options = options.block(wait);
        }
        List<MapRecord<String, Object, Object>> records = redis.opsForStream().read(
                org.springframework.data.redis.connection.stream.Consumer.from(groupName, consumer),
                options,
                StreamOffset.create(key, ReadOffset.lastConsumed())
        );
        if (records == null) return out;

        for (MapRecord<String, Object, Object> rec : records) {
            if (rec.getValue().containsKey("bootstrap") || rec.getValue().get("body") == null) {
                ackRecord(key, rec.getId());
                log.debug("[RedisStream] skip bootstrap/invalid rec id={}", rec.getId());
                continue;
            }
            out.add(toMessage(rec, 1));
        }
        return out;
    }

    private List<QueueMessage> reclaimExpired(String queue, String key, String consumer, int max) {
        Duration visibility = Duration.ofSeconds(visibilitySeconds);
        PendingMessages pending = redis.opsForStream().pending(key, groupName, Range.unbounded(), 100);
        if (pending == null || pending.isEmpty()) return List.of();

        List<QueueMessage> out = new ArrayList<>();
        for (PendingMessage pm : pending) {
            if (pm.getElapsedTimeSinceLastDelivery().compareTo(visibility) < 0) continue;

            if (pm.getTotalDeliveryCount() >= maxReceiveCount) {
                moveToDeadLetter(queue, key, consumer, visibility, pm);
                continue;
            }
            if (out.size() >= max) continue;

            // minIdleTime 조건으로 한 소비자만 가져감
            List<MapRecord<String, Object, Object>> claimed =
                    redis.opsForStream().claim(key, groupName, consumer, visibility, pm.getId());
            for (MapRecord<String, Object, Object> rec : claimed) {
                out.add(toMessage(rec, pm.getTotalDeliveryCount() + 1));
                log.info("[RedisStream] XCLAIM key={}, id={}, receives={}", key, rec.getId(), pm.getTotalDeliveryCount() + 1);
            }
        }
        return out;
    }

    private void moveToDeadLetter(String queue, String key, String consumer, Duration visibility, PendingMessage pm) {
        List<MapRecord<String, Object, Object>> claimed =
                redis.opsForStream().claim(key, groupName, consumer, visibility, pm.getId());
        for (MapRecord<String, Object, Object> rec : claimed) {
            Map<String, String> fields = new HashMap<>();
            rec.getValue().forEach((k, v) -> fields.put(String.valueOf(k), String.valueOf(v)));
            fields.put("originalId", rec.getId().getValue());
            fields.put("receiveCount", String.valueOf(pm.getTotalDeliveryCount()));
            fields.put("deadLetteredAt", clock.instant().toString());

            RecordId dlqId = redis.opsForStream().add(StreamRecords.mapBacked(fields).withStreamKey(deadLetterKey(queue)));
            ackRecord(key, rec.getId());
            log.warn("[RedisStream] DLQ key={}, id={}, dlqId={}, receives={}", key, rec.getId(), dlqId, pm.getTotalDeliveryCount());

            notifyDeadLetter(queue, toMessage(rec, pm.getTotalDeliveryCount()));
        }
    }

    @Override
    public void ack(String queue, QueueMessage message) {
        ackRecord(streamKey(queue), RecordId.of(message.id()));
    }

    private void ackRecord(String key, RecordId id) {
        redis.opsForStream().acknowledge(key, groupName, id);
        redis.opsForStream().delete(key, id);
    }

    @Override
    public long depth(String queue) {
        Long size = redis.opsForStream().size(streamKey(queue));
        return size == null ? 0 : size;
    }

    @Override
    public long deadLetterDepth(String queue) {
        Long size = redis.opsForStream().size(deadLetterKey(queue));
        return size == null ? 0 : size;
    }

    @Override
    public List<QueueMessage> deadLetters(String queue, int limit) {
        List<MapRecord<String, Object, Object>> records =
                redis.opsForStream().range(deadLetterKey(queue), Range.unbounded(), Limit.limit().count(limit));
        if (records == null) return List.of();
        List<QueueMessage> out = new ArrayList<>();
        for (MapRecord<String, Object, Object> rec : records) {
            Object count = rec.getValue().get("receiveCount");
            out.add(toMessage(rec, count == null ? 0 : Long.parseLong(String.valueOf(count))));
        }
        return out;
    }

    @Override
    public boolean redrive(String queue, String messageId) {
        String dlqKey = deadLetterKey(queue);
        List<MapRecord<String, Object, Object>> records =
                redis.opsForStream().range(dlqKey, Range.closed(messageId, messageId));
        if (records == null || records.isEmpty()) return false;

        String body = String.valueOf(records.get(0).getValue().get("body"));
        String newId = enqueue(queue, body);
        redis.opsForStream().delete(dlqKey, RecordId.of(messageId));
        log.info("[RedisStream] redrive queue={}, dlqId={}, newId={}", queue, messageId, newId);
        return true;
    }

    @Override
    public void onDeadLetter(String queue, Consumer<QueueMessage> listener) {
        listeners.computeIfAbsent(queue, q -> new CopyOnWriteArrayList<>()).add(listener);
    }

    @Override
    public void ping() {
        redis.execute((RedisCallback<String>) RedisConnection::ping);
    }

    private void notifyDeadLetter(String queue, QueueMessage message) {
        for (Consumer<QueueMessage> l : listeners.getOrDefault(queue, List.of())) {
            try {
                l.accept(message);
            } catch (RuntimeException e) {
                log.warn("[RedisStream] dead-letter listener failed queue={}, id={}, err={}", queue, message.id(), e.toString());
            }
        }
    }

    private QueueMessage toMessage(MapRecord<String, Object, Object> rec, long receiveCount) {
        Object enqueuedAt = rec.getValue().get("enqueuedAt");
        Instant at = enqueuedAt == null ? null : Instant.parse(String.valueOf(enqueuedAt));
        return new QueueMessage(rec.getId().getValue(), String.valueOf(rec.getValue().get("body")), receiveCount, at);
    }

    private void ensureGroup(String streamKey) {
        if (grouped.contains(streamKey)) return;
        try {
            redis.opsForStream().createGroup(streamKey, ReadOffset.from("0-0"), groupName);
            log.info("[RedisStream] createGroup key={}, group={}", streamKey, groupName);
        } catch (Exception e) {
            String msg = e.getMessage() != null ? e.getMessage() : "";
            if (!(msg.contains("BUSYGROUP") || msg.contains("already exists"))) {
                bootstrapGroup(streamKey, msg);
            }
        }
        grouped.add(streamKey);
    }

    // MKSTREAM 없이 그룹을 만들 수 없는 서버용: 부트스트랩 레코드로 스트림 생성
    private void bootstrapGroup(String streamKey, String firstError) {
        try {
            RecordId rid = redis.opsForStream().add(
                    StreamRecords.mapBacked(Map.of("bootstrap", "1")).withStreamKey(streamKey));
            redis.opsForStream().createGroup(streamKey, ReadOffset.from("0-0"), groupName);
            redis.opsForStream().delete(streamKey, rid);
            log.info("[RedisStream] group prepared key={}, group={}, rec={}", streamKey, groupName, rid);
        } catch (Exception e) {
            String msg = e.getMessage() == null ? "" : e.getMessage();
            if (!(msg.contains("BUSYGROUP") || msg.contains("already exists"))) {
                log.warn("[RedisStream] createGroup failed key={}, group={}, cause={}, first={}",
                        streamKey, groupName, msg, firstError);
                throw e;
            }
        }
    }
}
