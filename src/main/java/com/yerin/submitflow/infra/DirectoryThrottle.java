package com.yerin.submitflow.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;

/**
 * Per-directory concurrency cap for this worker process plus a minimum spacing between
 * consecutive submissions to the same directory.
 */
@Slf4j
@Component
public class DirectoryThrottle {

    private final int permitsPerDirectory;
    private final Clock clock;
    private final Sleeper sleeper;

    private final Map<String, Slot> slots = new ConcurrentHashMap<>();

    @Autowired
    public DirectoryThrottle(@Value("${submitflow.throttle.permits-per-directory:1}") int permitsPerDirectory,
                             Clock clock, Sleeper sleeper) {
        this.permitsPerDirectory = permitsPerDirectory;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public Permit acquire(String directory, long rateLimitMs) throws InterruptedException {
        Slot slot = slots.computeIfAbsent(directory, d -> new Slot(new Semaphore(permitsPerDirectory, true)));
        slot.semaphore.acquire();
        try {
            Instant last = slot.lastRelease;
            if (last != null && rateLimitMs > 0) {
                Duration wait = Duration.between(clock.instant(), last.plusMillis(rateLimitMs));
                if (!wait.isNegative() && !wait.isZero()) {
                    log.debug("[Throttle] directory={} wait={}ms", directory, wait.toMillis());
                    sleeper.sleep(wait);
                }
            }
        } catch (InterruptedException e) {
            slot.semaphore.release();
            throw e;
        }
        return new Permit(slot);
    }

    int available(String directory) {
        Slot slot = slots.get(directory);
        return slot == null ? permitsPerDirectory : slot.semaphore.availablePermits();
    }

    private static final class Slot {
        private final Semaphore semaphore;
        private volatile Instant lastRelease;

        private Slot(Semaphore semaphore) { this.semaphore = semaphore; }
    }

    public final class Permit implements AutoCloseable {
        private final Slot slot;
        private boolean closed;

        private Permit(Slot slot) { this.slot = slot; }

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            slot.lastRelease = clock.instant();
            slot.semaphore.release();
        }
    }
}
