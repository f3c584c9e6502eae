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
@Table(name = "job_results",
        uniqueConstraints = @UniqueConstraint(name = "uk_job_results_idem", columnNames = "idempotency_key"),
        indexes = @Index(name = "idx_job_results_job_id", columnList = "job_id, created_at"))
public class JobResult {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false, length = 64)
    private String jobId;

    @Column(name = "directory_name", nullable = false)
    private String directoryName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private JobResultStatus status;

    @Column(name = "idempotency_key", nullable = false, length = 64)
    private String idempotencyKey;

    @Column(columnDefinition = "text")
    private String payload;

    @Column(name = "response_log", columnDefinition = "text")
    private String responseLog;

    @Column(name = "screenshot_path", length = 500)
    private String screenshotPath;

    @Column(name = "listing_url", length = 1000)
    private String listingUrl;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
