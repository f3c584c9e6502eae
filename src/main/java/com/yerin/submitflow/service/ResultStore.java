package com.yerin.submitflow.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.submitflow.domain.JobResult;
import com.yerin.submitflow.domain.JobResultStatus;
import com.yerin.submitflow.domain.failure.TransientInfraException;
import com.yerin.submitflow.infra.ChangeNotifier;
import com.yerin.submitflow.repository.JobResultRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Data access for per-directory results. Writes go through a keyed upsert where the first
 * success wins; callers never issue plain inserts or updates against job_results.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResultStore {

    public enum UpsertOutcome { WRITTEN, DUPLICATE_SUCCESS }

    private final JobResultRepository resultRepository;
    private final ObjectMapper objectMapper;
    private final ChangeNotifier notifier;
    private final Clock clock;

    @Transactional
    public UpsertOutcome upsert(ResultWrite w) {
        int rows;
        try {
            rows = resultRepository.upsert(
                    w.jobId(), w.directory(), w.status().name(), w.idempotencyKey(),
                    toJson(w.payload()), toJson(w.responseLog()),
                    w.screenshotPath(), w.listingUrl(), w.attempts(), w.errorMessage(),
                    clock.instant());
        } catch (DataAccessException e) {
            throw new TransientInfraException("result upsert failed key=" + w.idempotencyKey(), e);
        }
        if (rows == 0) {
            log.info("[ResultStore] keep existing success jobId={}, directory={}, attempted={}",
                    w.jobId(), w.directory(), w.status());
            return UpsertOutcome.DUPLICATE_SUCCESS;
        }
        log.debug("[ResultStore] upsert jobId={}, directory={}, status={}", w.jobId(), w.directory(), w.status());
        notifier.publish("job_results", w.jobId(), "status", w.status().name());
        return UpsertOutcome.WRITTEN;
    }

    @Transactional(readOnly = true)
    public Optional<JobResult> findByKey(String idempotencyKey) {
        return resultRepository.findByIdempotencyKey(idempotencyKey);
    }

    @Transactional(readOnly = true)
    public List<JobResult> results(String jobId) {
        return resultRepository.findByJobIdOrderByCreatedAtAsc(jobId);
    }

    @Transactional(readOnly = true)
    public long countSettled(String jobId) {
        return resultRepository.countSettledDirectories(jobId);
    }

    @Transactional(readOnly = true)
    public List<String> settledDirectories(String jobId) {
        return resultRepository.findSettledDirectories(jobId);
    }

    @Transactional(readOnly = true)
    public Map<JobResultStatus, Long> countsByStatus(String jobId) {
        Map<JobResultStatus, Long> out = new EnumMap<>(JobResultStatus.class);
        for (Object[] row : resultRepository.countByStatus(jobId)) {
            out.put((JobResultStatus) row[0], ((Number) row[1]).longValue());
        }
        return out;
    }

    private String toJson(Map<String, ?> value) {
        if (value == null) return null;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("result field not serializable", e);
        }
    }
}
