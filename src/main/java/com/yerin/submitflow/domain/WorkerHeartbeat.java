package com.yerin.submitflow.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "worker_heartbeats", indexes =
        @Index(name = "idx_worker_heartbeats_last_seen", columnList = "last_seen"))
public class WorkerHeartbeat {

    @Id
    @Column(name = "worker_id", length = 200)
    private String workerId;

    @Column(name = "last_seen", nullable = false)
    private Instant lastSeen;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private WorkerStatus status;

    @Column(name = "jobs_processed", nullable = false)
    private long jobsProcessed;

    @Column(columnDefinition = "text")
    private String metadata;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
