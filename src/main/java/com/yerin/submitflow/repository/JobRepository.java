package com.yerin.submitflow.repository;

import com.yerin.submitflow.domain.Job;
import com.yerin.submitflow.domain.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface JobRepository extends JpaRepository<Job, String> {

    long countByStatus(JobStatus status);

    List<Job> findTop100ByStatusAndUpdatedAtLessThanEqualOrderByUpdatedAtAsc(JobStatus status, Instant updatedAt);

    List<Job> findTop100ByStatusAndTriggeredAtLessThanEqualOrderByTriggeredAtAsc(JobStatus status, Instant triggeredAt);

    List<Job> findTop100ByStatusAndTriggeredAtIsNullAndCreatedAtLessThanEqualOrderByCreatedAtAsc(JobStatus status, Instant createdAt);

    List<Job> findTop100ByStatusAndWorkerIdIn(JobStatus status, List<String> workerIds);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update Job j
          set j.flowRunId = :flowRunId,
              j.workerId = :workerId,
              j.triggeredAt = :now,
              j.updatedAt = :now
        where j.id = :id
          and j.status = com.yerin.submitflow.domain.JobStatus.PENDING
       """)
    int markTriggered(@Param("id") String id,
                      @Param("flowRunId") String flowRunId,
                      @Param("workerId") String workerId,
                      @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update Job j
          set j.status = com.yerin.submitflow.domain.JobStatus.IN_PROGRESS,
              j.startedAt = :now,
              j.updatedAt = :now,
              j.directoriesTotal = :total,
              j.directoriesDone = 0,
              j.progress = 0,
              j.workerId = :workerId,
              j.profileSnapshot = :profileSnapshot,
              j.directoryPlan = :directoryPlan
        where j.id = :id
          and j.status = com.yerin.submitflow.domain.JobStatus.PENDING
       """)
    int markInProgress(@Param("id") String id,
                       @Param("now") Instant now,
                       @Param("total") int total,
                       @Param("workerId") String workerId,
                       @Param("profileSnapshot") String profileSnapshot,
                       @Param("directoryPlan") String directoryPlan);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update Job j
          set j.progress = :progress,
              j.directoriesDone = :done,
              j.updatedAt = :now
        where j.id = :id
          and j.status = com.yerin.submitflow.domain.JobStatus.IN_PROGRESS
       """)
    int updateProgress(@Param("id") String id,
                       @Param("progress") int progress,
                       @Param("done") int done,
                       @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update Job j
          set j.status = :status,
              j.progress = 100,
              j.completedAt = :now,
              j.updatedAt = :now,
              j.errorMessage = :errorMessage
        where j.id = :id
          and j.status = :expectedCurrent
       """)
    int finishIf(@Param("id") String id,
                 @Param("expectedCurrent") JobStatus expectedCurrent,
                 @Param("status") JobStatus status,
                 @Param("errorMessage") String errorMessage,
                 @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update Job j
          set j.updatedAt = :now
        where j.id = :id
          and j.status = :expectedCurrent
       """)
    int touchIf(@Param("id") String id,
                @Param("expectedCurrent") JobStatus expectedCurrent,
                @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update Job j
          set j.triggeredAt = :now,
              j.updatedAt = :now
        where j.id = :id
          and j.status = com.yerin.submitflow.domain.JobStatus.PENDING
       """)
    int touchPending(@Param("id") String id, @Param("now") Instant now);
}
