package com.yerin.submitflow.controller;

import com.yerin.submitflow.dto.response.DeadLetterResponse;
import com.yerin.submitflow.global.dto.DataResponse;
import com.yerin.submitflow.service.AdminQueueService;
import io.swagger.v3.oas.annotations.Parameter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@RequestMapping("/admin/dlq")
public class AdminQueueController {
    private final AdminQueueService adminQueueService;

    @GetMapping("/{queue}")
    public ResponseEntity<DataResponse<List<DeadLetterResponse>>> list(@PathVariable String queue,
                                                                      @RequestParam(defaultValue = "50") int limit,
                                                                      @RequestHeader(value = "X-Admin-Token", required = true)
                                                                      @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                                                      String adminToken) {
        List<DeadLetterResponse> rows = adminQueueService.deadLetters(queue, limit).stream()
                .map(DeadLetterResponse::from)
                .toList();
        return ResponseEntity.ok(DataResponse.from(rows));
    }

    @PostMapping("/{queue}/{messageId}/replay")
    public ResponseEntity<DataResponse<Map<String, String>>> replay(@PathVariable String queue,
                                                                    @PathVariable String messageId,
                                                                    @RequestHeader(value = "X-Admin-Token", required = true)
                                                                    @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                                                    String adminToken) {
        adminQueueService.replay(queue, messageId);
        return ResponseEntity.ok(DataResponse.from(Map.of("queue", queue, "message_id", messageId)));
    }
}
