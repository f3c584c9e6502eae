package com.yerin.submitflow.domain;

import jakarta.persistence.*;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "directories", indexes = @Index(name = "idx_directories_rank", columnList = "active, rank_order"))
public class Directory {

    @Id
    @Column(length = 100)
    private String id;

    // 결과 행은 이름으로 디렉터리를 구분
    @Column(nullable = false, unique = true)
    private String name;

    @Column(nullable = false, length = 1000)
    private String url;

    @Column(name = "submission_url", length = 1000)
    private String submissionUrl;

    // 필드 -> 셀렉터 JSON, null 이면 학습된 매핑 없음
    @Column(name = "form_schema", columnDefinition = "text")
    private String formSchema;

    @Column(name = "submit_selector")
    private String submitSelector;

    @Column(name = "success_markers", columnDefinition = "text")
    private String successMarkers;

    @Column(name = "error_markers", columnDefinition = "text")
    private String errorMarkers;

    @Column(name = "rate_limit_ms", nullable = false)
    private long rateLimitMs;

    @Column(nullable = false)
    private boolean captcha;

    @Column(name = "requires_login", nullable = false)
    private boolean requiresLogin;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "rank_order", nullable = false)
    private int rank;
}
