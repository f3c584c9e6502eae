package com.yerin.submitflow.infra;

import com.yerin.submitflow.domain.WorkerStatus;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

@Component
public class WorkerState {

    private final String workerId;
    private final Instant startedAt = Instant.now();
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicLong processed = new AtomicLong();

    public WorkerState() {
        this(WorkerId.current());
    }

    public WorkerState(String workerId) {
        this.workerId = workerId;
    }

    public void begin() { active.incrementAndGet(); }

    public void end() {
        active.decrementAndGet();
        processed.incrementAndGet();
    }

    public String workerId() { return workerId; }

    public Instant startedAt() { return startedAt; }

    public int activeTasks() { return active.get(); }

    public long processed() { return processed.get(); }

    public WorkerStatus status() {
        return active.get() > 0 ? WorkerStatus.RUNNING : WorkerStatus.IDLE;
    }
}
