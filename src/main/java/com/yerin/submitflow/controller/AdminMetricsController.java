package com.yerin.submitflow.controller;

import com.yerin.submitflow.domain.JobStatus;
import com.yerin.submitflow.dto.response.WorkerResponse;
import com.yerin.submitflow.repository.JobRepository;
import com.yerin.submitflow.repository.WorkerHeartbeatRepository;
import com.yerin.submitflow.service.AdminQueueService;
import io.swagger.v3.oas.annotations.Parameter;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
public class AdminMetricsController {

    private final AdminQueueService adminQueueService;
    private final JobRepository jobRepository;
    private final WorkerHeartbeatRepository workerRepository;

    @GetMapping("/metrics/queue")
    public Map<String, Object> queue(@RequestHeader(value = "X-Admin-Token", required = true)
                                     @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                     String adminToken) {
        return adminQueueService.queueStats();
    }

    @GetMapping("/metrics/jobs")
    public Map<String, Long> jobCounts(@RequestHeader(value = "X-Admin-Token", required = true)
                                       @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                       String adminToken) {
        Map<String, Long> out = new LinkedHashMap<>();
        for (JobStatus s : JobStatus.values()) {
            out.put(s.name(), jobRepository.countByStatus(s));
        }
        return out;
    }

    @GetMapping("/workers")
    public List<WorkerResponse> workers(@RequestHeader(value = "X-Admin-Token", required = true)
                                        @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                        String adminToken) {
        return workerRepository.findAllByOrderByLastSeenDesc().stream()
                .map(WorkerResponse::from)
                .toList();
    }
}
