package com.yerin.submitflow.automation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.submitflow.domain.failure.TransientInfraException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * External CAPTCHA solving service reached over HTTP. Disabled unless both the API url and
 * key are configured.
 */
@Slf4j
@Component
public class HttpCaptchaSolver implements CaptchaSolver {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient http;
    private final ObjectMapper objectMapper;
    private final String apiUrl;
    private final String apiKey;

    @Autowired
    public HttpCaptchaSolver(@Qualifier("captchaHttpClient") OkHttpClient http,
                             ObjectMapper objectMapper,
                             @Value("${submitflow.captcha.api-url:}") String apiUrl,
                             @Value("${submitflow.captcha.api-key:}") String apiKey) {
        this.http = http;
        this.objectMapper = objectMapper;
        this.apiUrl = apiUrl;
        this.apiKey = apiKey;
    }

    @Override
    public boolean isEnabled() {
        return apiUrl != null && !apiUrl.isBlank() && apiKey != null && !apiKey.isBlank();
    }

    @Override
    public Optional<String> solve(String siteKey, String pageUrl) {
        if (!isEnabled()) return Optional.empty();

        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("site_key", siteKey);
        payload.put("page_url", pageUrl);

        Request request;
        try {
            request = new Request.Builder()
                    .url(apiUrl)
                    .header("Authorization", "Bearer " + apiKey)
                    .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
                    .build();
        } catch (IOException e) {
            throw new IllegalStateException("captcha request not serializable", e);
        }

        try (Response response = http.newCall(request).execute()) {
            if (response.code() >= 500) {
                throw new TransientInfraException("captcha solver unavailable status=" + response.code());
            }
            if (!response.isSuccessful()) {
                log.info("[Captcha] solver declined status={}, page={}", response.code(), pageUrl);
                return Optional.empty();
            }
            ResponseBody body = response.body();
            JsonNode node = objectMapper.readTree(body == null ? "{}" : body.string());
            String token = node.path("token").asText("");
            return token.isBlank() ? Optional.empty() : Optional.of(token);
        } catch (IOException e) {
            throw new TransientInfraException("captcha solver call failed: " + e.getMessage(), e);
        }
    }
}
