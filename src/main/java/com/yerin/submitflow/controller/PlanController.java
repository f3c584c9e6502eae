package com.yerin.submitflow.controller;

import com.yerin.submitflow.automation.plan.FillPlan;
import com.yerin.submitflow.dto.request.PlanRequest;
import com.yerin.submitflow.service.FieldMappingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

// FieldMappingClient 가 본문을 그대로 FillPlan 으로 읽으므로 DataResponse 로 감싸지 않는다
@RestController
@RequiredArgsConstructor
public class PlanController {

    private final FieldMappingService fieldMappingService;

    @PostMapping("/plan")
    public ResponseEntity<FillPlan> plan(@Valid @RequestBody PlanRequest request) {
        return ResponseEntity.ok(fieldMappingService.plan(request.directory(), request.businessProfile()));
    }
}
