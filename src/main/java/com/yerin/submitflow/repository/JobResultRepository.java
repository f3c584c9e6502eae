package com.yerin.submitflow.repository;

import com.yerin.submitflow.domain.JobResult;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface JobResultRepository extends JpaRepository<JobResult, Long> {

    Optional<JobResult> findByIdempotencyKey(String idempotencyKey);

    List<JobResult> findByJobIdOrderByCreatedAtAsc(String jobId);

    /**
     * Insert, or update the row with the same key unless it already holds a success status.
     * Returns 0 when the existing row was a success and nothing changed.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
       insert into job_results (job_id, directory_name, status, idempotency_key, payload,
                                response_log, screenshot_path, listing_url, attempts,
                                error_message, created_at, updated_at)
       values (:jobId, :directory, :status, :key, cast(:payload as text),
               cast(:responseLog as text), cast(:screenshotPath as text), cast(:listingUrl as text), :attempts,
               cast(:errorMessage as text), :now, :now)
       on conflict (idempotency_key) do update
          set status = excluded.status,
              payload = excluded.payload,
              response_log = coalesce(excluded.response_log, job_results.response_log),
              screenshot_path = coalesce(excluded.screenshot_path, job_results.screenshot_path),
              listing_url = coalesce(excluded.listing_url, job_results.listing_url),
              attempts = greatest(excluded.attempts, job_results.attempts),
              error_message = excluded.error_message,
              updated_at = excluded.updated_at
        where job_results.status not in ('SUBMITTED', 'SKIPPED')
       """, nativeQuery = true)
    int upsert(@Param("jobId") String jobId,
               @Param("directory") String directory,
               @Param("status") String status,
               @Param("key") String idempotencyKey,
               @Param("payload") String payload,
               @Param("responseLog") String responseLog,
               @Param("screenshotPath") String screenshotPath,
               @Param("listingUrl") String listingUrl,
               @Param("attempts") int attempts,
               @Param("errorMessage") String errorMessage,
               @Param("now") Instant now);

    @Query("""
       select count(distinct r.directoryName)
         from JobResult r
        where r.jobId = :jobId
          and r.status in (com.yerin.submitflow.domain.JobResultStatus.SUBMITTED,
                           com.yerin.submitflow.domain.JobResultStatus.FAILED,
                           com.yerin.submitflow.domain.JobResultStatus.SKIPPED,
                           com.yerin.submitflow.domain.JobResultStatus.NEEDS_HUMAN)
       """)
    long countSettledDirectories(@Param("jobId") String jobId);

    @Query("""
       select distinct r.directoryName
         from JobResult r
        where r.jobId = :jobId
          and r.status in (com.yerin.submitflow.domain.JobResultStatus.SUBMITTED,
                           com.yerin.submitflow.domain.JobResultStatus.FAILED,
                           com.yerin.submitflow.domain.JobResultStatus.SKIPPED,
                           com.yerin.submitflow.domain.JobResultStatus.NEEDS_HUMAN)
       """)
    List<String> findSettledDirectories(@Param("jobId") String jobId);

    // [status, count]
    @Query("""
       select r.status, count(distinct r.directoryName)
         from JobResult r
        where r.jobId = :jobId
        group by r.status
       """)
    List<Object[]> countByStatus(@Param("jobId") String jobId);
}
