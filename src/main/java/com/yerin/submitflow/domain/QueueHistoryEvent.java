package com.yerin.submitflow.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Append-only audit record. Rows are inserted once and never updated.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "queue_history", indexes = {
        @Index(name = "idx_queue_history_job_id", columnList = "job_id, created_at"),
        @Index(name = "idx_queue_history_event", columnList = "event, created_at")
})
public class QueueHistoryEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false, length = 64)
    private String jobId;

    @Column(name = "directory_name")
    private String directoryName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private HistoryEventType event;

    @Column(columnDefinition = "text")
    private String details;

    @Column(name = "worker_id", length = 200)
    private String workerId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist void pre() { if (createdAt == null) createdAt = Instant.now(); }
}
