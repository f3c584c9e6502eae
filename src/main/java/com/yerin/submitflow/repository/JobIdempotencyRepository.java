package com.yerin.submitflow.repository;

import com.yerin.submitflow.domain.JobIdempotency;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface JobIdempotencyRepository extends JpaRepository<JobIdempotency, Long> {
    Optional<JobIdempotency> findByIdempotencyKey(String idempotencyKey);
}
