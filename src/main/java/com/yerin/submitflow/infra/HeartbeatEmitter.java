package com.yerin.submitflow.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.submitflow.repository.WorkerHeartbeatRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class HeartbeatEmitter {

    private final WorkerHeartbeatRepository heartbeatRepository;
    private final WorkerState workerState;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate tx;
    private final Clock clock;

    @Value("${submitflow.heartbeat.enabled:true}")
    private boolean enabled = true;

    @Scheduled(fixedDelayString = "${submitflow.heartbeat.interval-ms:20000}")
    public void tick() {
        if (enabled) beat();
    }

    public void beat() {
        try {
            tx.execute(s -> heartbeatRepository.upsert(
                    workerState.workerId(),
                    workerState.status().name(),
                    workerState.processed(),
                    metadata(),
                    clock.instant()));
            log.debug("[Heartbeat] workerId={}, status={}", workerState.workerId(), workerState.status());
        } catch (DataAccessException e) {
            log.warn("[Heartbeat] upsert failed workerId={}, err={}", workerState.workerId(), e.toString());
        }
    }

    private String metadata() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("active_tasks", workerState.activeTasks());
        m.put("started_at", workerState.startedAt().toString());
        m.put("pid", ProcessHandle.current().pid());
        try {
            return objectMapper.writeValueAsString(m);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("heartbeat metadata not serializable", e);
        }
    }
}
