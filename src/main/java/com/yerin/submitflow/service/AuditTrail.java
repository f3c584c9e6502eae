package com.yerin.submitflow.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.submitflow.domain.HistoryEventType;
import com.yerin.submitflow.domain.QueueHistoryEvent;
import com.yerin.submitflow.infra.ChangeNotifier;
import com.yerin.submitflow.infra.WorkerId;
import com.yerin.submitflow.repository.QueueHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Append-only event log per job. Nothing here updates or deletes a row.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditTrail {

    private final QueueHistoryRepository historyRepository;
    private final ObjectMapper objectMapper;
    private final ChangeNotifier notifier;
    private final Clock clock;

    public QueueHistoryEvent append(String jobId, String directory, HistoryEventType event, Map<String, ?> details) {
        QueueHistoryEvent saved = historyRepository.save(QueueHistoryEvent.builder()
                .jobId(jobId)
                .directoryName(directory)
                .event(event)
                .details(toJson(details))
                .workerId(WorkerId.current())
                .createdAt(clock.instant())
                .build());
        log.info("[Audit] jobId={}, event={}, directory={}", jobId, event, directory);
        notifier.publish("queue_history", jobId, "event", event.wireName());
        return saved;
    }

    public List<QueueHistoryEvent> history(String jobId) {
        return historyRepository.findByJobIdOrderByCreatedAtAscIdAsc(jobId);
    }

    private String toJson(Map<String, ?> details) {
        if (details == null || details.isEmpty()) return null;
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("audit details not serializable", e);
        }
    }
}
