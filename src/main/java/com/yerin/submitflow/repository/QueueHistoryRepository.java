package com.yerin.submitflow.repository;

import com.yerin.submitflow.domain.QueueHistoryEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface QueueHistoryRepository extends JpaRepository<QueueHistoryEvent, Long> {
    List<QueueHistoryEvent> findByJobIdOrderByCreatedAtAscIdAsc(String jobId);
}
