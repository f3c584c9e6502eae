package com.yerin.submitflow.repository;

import com.yerin.submitflow.domain.WorkerHeartbeat;
import com.yerin.submitflow.domain.WorkerStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface WorkerHeartbeatRepository extends JpaRepository<WorkerHeartbeat, String> {

    List<WorkerHeartbeat> findAllByOrderByLastSeenDesc();

    List<WorkerHeartbeat> findTop100ByStatusNotAndLastSeenLessThanOrderByLastSeenAsc(WorkerStatus status, Instant lastSeen);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
       insert into worker_heartbeats (worker_id, last_seen, status, jobs_processed, metadata, created_at, updated_at)
       values (:workerId, :now, :status, :processed, :metadata, :now, :now)
       on conflict (worker_id) do update
          set last_seen = excluded.last_seen,
              status = excluded.status,
              jobs_processed = excluded.jobs_processed,
              metadata = excluded.metadata,
              updated_at = excluded.updated_at
       """, nativeQuery = true)
    int upsert(@Param("workerId") String workerId,
               @Param("status") String status,
               @Param("processed") long processed,
               @Param("metadata") String metadata,
               @Param("now") Instant now);

    // 그 사이 하트비트가 갱신됐으면 DEAD 로 바꾸지 않음
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update WorkerHeartbeat w
          set w.status = com.yerin.submitflow.domain.WorkerStatus.DEAD,
              w.updatedAt = :now
        where w.workerId = :workerId
          and w.lastSeen < :cutoff
          and w.status <> com.yerin.submitflow.domain.WorkerStatus.DEAD
       """)
    int markDeadIfStale(@Param("workerId") String workerId,
                        @Param("cutoff") Instant cutoff,
                        @Param("now") Instant now);
}
