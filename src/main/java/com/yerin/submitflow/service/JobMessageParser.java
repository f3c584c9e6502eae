package com.yerin.submitflow.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.submitflow.domain.JobMessage;
import com.yerin.submitflow.domain.PackageTier;
import com.yerin.submitflow.domain.failure.MessageValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Parses and validates jobs-queue bodies. Anything that cannot become a {@link JobMessage}
 * raises {@link MessageValidationException}; such messages are dropped, not retried.
 */
@Component
@RequiredArgsConstructor
public class JobMessageParser {

    static final String DEFAULT_PRIORITY = "starter";

    private final ObjectMapper objectMapper;

    public JobMessage parse(String body) {
        if (body == null || body.isBlank()) throw new MessageValidationException("empty message body");

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MessageValidationException("message body is not JSON", e);
        }
        if (root == null || !root.isObject()) throw new MessageValidationException("message body is not a JSON object");

        String jobId = requiredText(root, "job_id");
        String customerId = requiredText(root, "customer_id");
        int packageSize = packageSize(root.get("package_size"));
        String priority = priority(root.get("priority"));

        return new JobMessage(jobId, customerId, packageSize, priority,
                optionalText(root, "created_at"), optionalText(root, "source"));
    }

    public String write(JobMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("job message not serializable", e);
        }
    }

    private static String requiredText(JsonNode root, String field) {
        JsonNode n = root.get(field);
        if (n == null || n.isNull()) throw new MessageValidationException(field + " is required");
        if (!n.isTextual()) throw new MessageValidationException(field + " must be a string");
        String v = n.asText().trim();
        if (v.isEmpty()) throw new MessageValidationException(field + " must not be blank");
        return v;
    }

    private static String optionalText(JsonNode root, String field) {
        JsonNode n = root.get(field);
        return n == null || n.isNull() ? null : n.asText();
    }

    private static int packageSize(JsonNode n) {
        if (n == null || n.isNull()) throw new MessageValidationException("package_size is required");
        int size;
        if (n.isIntegralNumber() && n.canConvertToInt()) {
            size = n.intValue();
        } else if (n.isTextual() && n.asText().trim().matches("-?\\d{1,9}")) {
            size = Integer.parseInt(n.asText().trim());
        } else {
            throw new MessageValidationException("package_size must be an integer");
        }
        if (size <= 0) throw new MessageValidationException("package_size must be > 0");
        return size;
    }

    private static String priority(JsonNode n) {
        if (n == null || n.isNull()) return DEFAULT_PRIORITY;
        if (!n.isIntegralNumber() && !n.isTextual()) {
            throw new MessageValidationException("priority must be an integer or a string");
        }
        String raw = n.asText().trim();
        if (raw.isEmpty()) return DEFAULT_PRIORITY;
        try {
            PackageTier.fromPriority(raw);
        } catch (IllegalArgumentException e) {
            throw new MessageValidationException(e.getMessage(), e);
        }
        return raw;
    }
}
