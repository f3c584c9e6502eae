package com.yerin.submitflow.controller;

import com.yerin.submitflow.domain.Job;
import com.yerin.submitflow.dto.request.EnqueueJobRequest;
import com.yerin.submitflow.dto.response.HistoryResponse;
import com.yerin.submitflow.dto.response.JobResponse;
import com.yerin.submitflow.dto.response.JobResultResponse;
import com.yerin.submitflow.global.dto.DataResponse;
import com.yerin.submitflow.global.exception.AppException;
import com.yerin.submitflow.global.exception.code.JobErrorCode;
import com.yerin.submitflow.repository.JobRepository;
import com.yerin.submitflow.service.AuditTrail;
import com.yerin.submitflow.service.EnqueueJobService;
import com.yerin.submitflow.service.ResultStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/jobs")
@RequiredArgsConstructor
public class JobController {

    private final EnqueueJobService enqueueJobService;
    private final JobRepository jobRepository;
    private final ResultStore resultStore;
    private final AuditTrail auditTrail;

    @PostMapping
    public ResponseEntity<DataResponse<Map<String, String>>> enqueue(
            @Valid @RequestBody EnqueueJobRequest request,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey
    ) {
        String jobId = enqueueJobService.enqueue(request, idempotencyKey);
        Map<String, String> responseMap = Map.of("job_id", jobId);

        return ResponseEntity.ok(DataResponse.from(responseMap));
    }

    @GetMapping("/{id}")
    public ResponseEntity<DataResponse<JobResponse>> get(@PathVariable String id) {
        Job job = findJob(id);
        return ResponseEntity.ok(DataResponse.from(JobResponse.from(job)));
    }

    @GetMapping("/{id}/results")
    public ResponseEntity<DataResponse<List<JobResultResponse>>> results(@PathVariable String id) {
        findJob(id);
        List<JobResultResponse> rows = resultStore.results(id).stream()
                .map(JobResultResponse::from)
                .toList();
        return ResponseEntity.ok(DataResponse.from(rows));
    }

    @GetMapping("/{id}/history")
    public ResponseEntity<DataResponse<List<HistoryResponse>>> history(@PathVariable String id) {
        findJob(id);
        List<HistoryResponse> events = auditTrail.history(id).stream()
                .map(HistoryResponse::from)
                .toList();
        return ResponseEntity.ok(DataResponse.from(events));
    }

    private Job findJob(String id) {
        return jobRepository.findById(id)
                .orElseThrow(() -> new AppException(JobErrorCode.JOB_NOT_FOUND));
    }
}
