package com.yerin.submitflow.infra;

import com.yerin.submitflow.domain.DurableQueuePort;
import com.yerin.submitflow.domain.QueueMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Single-process queue with the same visibility timeout and DLQ rules as the Redis adapter.
 * Used by the {@code local-inmem} profile and unit tests.
 */
@Slf4j
@Component
@Profile("local-inmem")
public class InMemoryQueueAdapter implements DurableQueuePort {

    private final Clock clock;
    private final Duration visibility;
    private final int maxReceiveCount;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();
    private final Map<String, LinkedHashMap<String, Entry>> live = new HashMap<>();
    private final Map<String, LinkedHashMap<String, Entry>> dead = new HashMap<>();
    private final Map<String, List<Consumer<QueueMessage>>> listeners = new HashMap<>();
    private final AtomicLong seq = new AtomicLong();

    @Autowired
    public InMemoryQueueAdapter(Clock clock,
                                @Value("${submitflow.queue.visibility-timeout-seconds:600}") long visibilitySeconds,
                                @Value("${submitflow.queue.max-receive-count:3}") int maxReceiveCount) {
        this.clock = clock;
        this.visibility = Duration.ofSeconds(visibilitySeconds);
        this.maxReceiveCount = maxReceiveCount;
    }

    @Override
    public String enqueue(String queue, String body) {
        String id = "m-" + seq.incrementAndGet();
        lock.lock();
        try {
            live.computeIfAbsent(queue, q -> new LinkedHashMap<>()).put(id, new Entry(id, body, clock.instant()));
            available.signalAll();
        } finally {
            lock.unlock();
        }
        log.info("[InMemoryQueue] enqueue queue={}, id={}", queue, id);
        return id;
    }

    @Override
    public List<QueueMessage> receive(String queue, String consumer, int max, Duration wait) throws InterruptedException {
        List<QueueMessage> deadLettered = new ArrayList<>();
        List<QueueMessage> out;
        long waitNanos = wait.toNanos();
        lock.lockInterruptibly();
        try {
            while (true) {
                out = collect(queue, max, deadLettered);
                if (!out.isEmpty() || waitNanos <= 0) break;
                waitNanos = available.awaitNanos(waitNanos);
            }
        } finally {
            lock.unlock();
        }
        notifyDeadLetters(queue, deadLettered);
        return out;
    }

    private List<QueueMessage> collect(String queue, int max, List<QueueMessage> deadLettered) {
        List<QueueMessage> out = new ArrayList<>();
        Map<String, Entry> entries = live.get(queue);
        if (entries == null) return out;

        Instant now = clock.instant();
        Iterator<Entry> it = entries.values().iterator();
        while (it.hasNext() && out.size() < max) {
            Entry e = it.next();
            if (e.invisibleUntil != null && now.isBefore(e.invisibleUntil)) continue;
            if (e.receiveCount >= maxReceiveCount) {
                it.remove();
                dead.computeIfAbsent(queue, q -> new LinkedHashMap<>()).put(e.id, e);
                deadLettered.add(e.toMessage());
                log.warn("[InMemoryQueue] dead-letter queue={}, id={}, receives={}", queue, e.id, e.receiveCount);
                continue;
            }
            e.receiveCount++;
            e.invisibleUntil = now.plus(visibility);
            out.add(e.toMessage());
        }
        return out;
    }

    @Override
    public void ack(String queue, QueueMessage message) {
        lock.lock();
        try {
            Map<String, Entry> entries = live.get(queue);
            if (entries != null) entries.remove(message.id());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long depth(String queue) {
        lock.lock();
        try {
            Map<String, Entry> entries = live.get(queue);
            return entries == null ? 0 : entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long deadLetterDepth(String queue) {
        lock.lock();
        try {
            Map<String, Entry> entries = dead.get(queue);
            return entries == null ? 0 : entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<QueueMessage> deadLetters(String queue, int limit) {
        lock.lock();
        try {
            Map<String, Entry> entries = dead.get(queue);
            if (entries == null) return List.of();
            return entries.values().stream().limit(limit).map(Entry::toMessage).toList();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean redrive(String queue, String messageId) {
        Entry e;
        lock.lock();
        try {
            Map<String, Entry> entries = dead.get(queue);
            e = entries == null ? null : entries.remove(messageId);
        } finally {
            lock.unlock();
        }
        if (e == null) return false;
        String newId = enqueue(queue, e.body);
        log.info("[InMemoryQueue] redrive queue={}, from={}, to={}", queue, messageId, newId);
        return true;
    }

    @Override
    public void onDeadLetter(String queue, Consumer<QueueMessage> listener) {
        lock.lock();
        try {
            listeners.computeIfAbsent(queue, q -> new CopyOnWriteArrayList<>()).add(listener);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void ping() {
        // 항상 사용 가능
    }

    private void notifyDeadLetters(String queue, List<QueueMessage> messages) {
        if (messages.isEmpty()) return;
        List<Consumer<QueueMessage>> ls;
        lock.lock();
        try {
            ls = listeners.getOrDefault(queue, List.of());
        } finally {
            lock.unlock();
        }
        for (QueueMessage m : messages) {
            for (Consumer<QueueMessage> l : ls) {
                try {
                    l.accept(m);
                } catch (RuntimeException ex) {
                    log.warn("[InMemoryQueue] dead-letter listener failed queue={}, id={}, err={}", queue, m.id(), ex.toString());
                }
            }
        }
    }

    private static final class Entry {
        private final String id;
        private final String body;
        private final Instant enqueuedAt;
        private long receiveCount;
        private Instant invisibleUntil;

        private Entry(String id, String body, Instant enqueuedAt) {
            this.id = id;
            this.body = body;
            this.enqueuedAt = enqueuedAt;
        }

        private QueueMessage toMessage() {
            return new QueueMessage(id, body, receiveCount, enqueuedAt);
        }
    }
}
