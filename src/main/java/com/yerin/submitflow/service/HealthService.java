package com.yerin.submitflow.service;

import com.yerin.submitflow.domain.DurableQueuePort;
import com.yerin.submitflow.dto.response.HealthResponse;
import com.yerin.submitflow.web.AdminTokenInterceptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Queue reachability decides between healthy and unhealthy; missing configuration or
 * admin auth only degrades.
 */
@Slf4j
@Service
public class HealthService {

    private final DurableQueuePort queue;
    private final AdminTokenInterceptor adminTokenInterceptor;
    private final String oracleBaseUrl;

    public HealthService(DurableQueuePort queue,
                         AdminTokenInterceptor adminTokenInterceptor,
                         @Value("${submitflow.oracle.base-url:}") String oracleBaseUrl) {
        this.queue = queue;
        this.adminTokenInterceptor = adminTokenInterceptor;
        this.oracleBaseUrl = oracleBaseUrl;
    }

    public HealthResponse check() {
        Map<String, String> checks = new LinkedHashMap<>();
        checks.put("queue", queueCheck());
        checks.put("config", oracleBaseUrl == null || oracleBaseUrl.isBlank() ? "missing" : "ok");
        checks.put("auth", adminTokenInterceptor.isConfigured() ? "ok" : "missing");

        String status;
        if (!"ok".equals(checks.get("queue"))) status = "unhealthy";
        else if (checks.containsValue("missing")) status = "degraded";
        else status = "healthy";
        return new HealthResponse(status, checks);
    }

    private String queueCheck() {
        try {
            queue.ping();
            return "ok";
        } catch (RuntimeException e) {
            log.warn("[Health] queue ping failed: {}", e.toString());
            return "error";
        }
    }
}
