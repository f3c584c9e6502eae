package com.yerin.submitflow.service;

import com.yerin.submitflow.domain.*;
import com.yerin.submitflow.dto.request.EnqueueJobRequest;
import com.yerin.submitflow.global.exception.AppException;
import com.yerin.submitflow.global.exception.code.JobErrorCode;
import com.yerin.submitflow.repository.JobIdempotencyRepository;
import com.yerin.submitflow.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class EnqueueJobService {
    private final DurableQueuePort queue;
    private final JobRepository jobRepository;
    private final JobIdempotencyRepository idemRepo;
    private final JobMessageParser jobParser;
    private final PipelineMetrics metrics;
    private final TransactionTemplate tx;
    private final Clock clock;

    public String enqueue(EnqueueJobRequest request, String idempotencyKey) {
        boolean keyed = idempotencyKey != null && !idempotencyKey.isBlank();
        if (keyed) {
            var hit = idemRepo.findByIdempotencyKey(idempotencyKey);
            if (hit.isPresent()) return hit.get().getJobId();
        }

        String priority = request.priority() == null || request.priority().isBlank()
                ? JobMessageParser.DEFAULT_PRIORITY : request.priority().trim();
        PackageTier tier;
        try {
            tier = PackageTier.fromPriority(priority);
        } catch (IllegalArgumentException e) {
            throw new AppException(JobErrorCode.UNKNOWN_PRIORITY);
        }

        Instant now = clock.instant();
        Job job = Job.builder()
                .id(UUID.randomUUID().toString())
                .customerId(request.customerId())
                .status(JobStatus.PENDING)
                .packageSize(request.packageSize())
                .packageType(tier)
                .priority(priority)
                .source(request.source())
                .createdAt(now)
                .updatedAt(now)
                .build();

        // 잡 행이 커밋된 뒤에 메시지를 넣는다
        Optional<String> existing = tx.execute(s -> {
            jobRepository.save(job);
            if (!keyed) return Optional.<String>empty();
            try {
                idemRepo.saveAndFlush(JobIdempotency.builder()
                        .idempotencyKey(idempotencyKey)
                        .jobId(job.getId())
                        .createdAt(now)
                        .build());
                return Optional.<String>empty();
            } catch (DataIntegrityViolationException e) {
                s.setRollbackOnly();
                return Optional.of(idempotencyKey);
            }
        });
        if (existing != null && existing.isPresent()) {
            return idemRepo.findByIdempotencyKey(idempotencyKey)
                    .map(JobIdempotency::getJobId)
                    .orElseThrow(() -> new IllegalStateException("idempotency key lost key=" + idempotencyKey));
        }

        JobMessage message = new JobMessage(job.getId(), job.getCustomerId(), job.getPackageSize(),
                priority, now.toString(), job.getSource());
        String messageId = queue.enqueue(DurableQueuePort.JOBS, jobParser.write(message));

        metrics.incEnqueued();
        log.info("[Enqueue] jobId={}, customerId={}, packageSize={}, messageId={}",
                job.getId(), job.getCustomerId(), job.getPackageSize(), messageId);
        return job.getId();
    }
}
