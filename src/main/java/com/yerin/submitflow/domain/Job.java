package com.yerin.submitflow.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "jobs")
@DynamicUpdate
public class Job {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "customer_id", nullable = false, length = 64)
    private String customerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private JobStatus status;

    @Column(name = "package_size", nullable = false)
    private int packageSize;

    @Enumerated(EnumType.STRING)
    @Column(name = "package_type", length = 30)
    private PackageTier packageType;

    @Column(length = 30)
    private String priority;

    @Column(length = 100)
    private String source;

    @Column(nullable = false)
    private int progress;

    @Column(name = "directories_total", nullable = false)
    private int directoriesTotal;

    @Column(name = "directories_done", nullable = false)
    private int directoriesDone;

    @Column(name = "flow_run_id", length = 64)
    private String flowRunId;

    // 현재 플로우를 실행 중인 워커
    @Column(name = "worker_id", length = 200)
    private String workerId;

    @Column(name = "profile_snapshot", columnDefinition = "text")
    private String profileSnapshot;

    @Column(name = "directory_plan", columnDefinition = "text")
    private String directoryPlan;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "triggered_at")
    private Instant triggeredAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
        if (status == null) status = JobStatus.PENDING;
    }

    @PreUpdate
    void preUpdate() { updatedAt = Instant.now(); }
}
