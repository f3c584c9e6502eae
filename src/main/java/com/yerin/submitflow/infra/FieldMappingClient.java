package com.yerin.submitflow.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.submitflow.automation.plan.FillPlan;
import com.yerin.submitflow.domain.DirectoryDescriptor;
import com.yerin.submitflow.domain.failure.StructuralFailureException;
import com.yerin.submitflow.domain.failure.TransientInfraException;
import com.yerin.submitflow.dto.request.PlanRequest;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

/**
 * HTTP client of the field-mapping oracle. 5xx and I/O failures are transient;
 * 4xx answers mean the request itself is wrong and are not retried.
 */
@Slf4j
@Component
public class FieldMappingClient {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient http;
    private final ObjectMapper objectMapper;
    private final HttpUrl planUrl;

    @Autowired
    public FieldMappingClient(@Qualifier("oracleHttpClient") OkHttpClient http,
                              ObjectMapper objectMapper,
                              @Value("${submitflow.oracle.base-url:http://localhost:8080}") String baseUrl) {
        this.http = http;
        this.objectMapper = objectMapper;
        HttpUrl base = HttpUrl.parse(baseUrl);
        if (base == null) throw new IllegalArgumentException("invalid oracle base url: " + baseUrl);
        this.planUrl = base.newBuilder().addPathSegment("plan").build();
    }

    public FillPlan plan(DirectoryDescriptor directory, Map<String, String> profile) {
        String body;
        try {
            body = objectMapper.writeValueAsString(new PlanRequest(directory, profile));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("plan request not serializable", e);
        }

        Request request = new Request.Builder()
                .url(planUrl)
                .post(RequestBody.create(body, JSON))
                .build();

        try (Response response = http.newCall(request).execute()) {
            ResponseBody rb = response.body();
            String text = rb == null ? "" : rb.string();
            if (response.code() >= 500) {
                throw new TransientInfraException("oracle unavailable status=" + response.code());
            }
            if (!response.isSuccessful()) {
                throw new StructuralFailureException("oracle rejected plan request status=" + response.code() + " body=" + abbreviate(text));
            }
            FillPlan plan = objectMapper.readValue(text, FillPlan.class);
            log.debug("[OracleClient] plan directory={}, source={}", directory.id(), plan.source());
            return plan;
        } catch (JsonProcessingException e) {
            throw new TransientInfraException("oracle returned unreadable plan", e);
        } catch (IOException e) {
            throw new TransientInfraException("oracle call failed: " + e.getMessage(), e);
        }
    }

    private static String abbreviate(String s) {
        return s.length() <= 200 ? s : s.substring(0, 200) + "...";
    }
}
