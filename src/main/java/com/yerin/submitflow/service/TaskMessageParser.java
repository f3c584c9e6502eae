package com.yerin.submitflow.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.submitflow.domain.TaskMessage;
import com.yerin.submitflow.domain.failure.MessageValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TaskMessageParser {

    private final ObjectMapper objectMapper;

    public TaskMessage parse(String body) {
        TaskMessage task;
        try {
            task = objectMapper.readValue(body, TaskMessage.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MessageValidationException("task message is not valid JSON", e);
        }
        if (task == null || blank(task.jobId())) throw new MessageValidationException("job_id is required");
        if (task.directory() == null || blank(task.directory().id())) {
            throw new MessageValidationException("directory.id is required");
        }
        if (task.businessProfile() == null) throw new MessageValidationException("business_profile is required");
        if (task.packageType() == null) throw new MessageValidationException("package_type is required");
        return task;
    }

    public String write(TaskMessage task) {
        try {
            return objectMapper.writeValueAsString(task);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("task message not serializable", e);
        }
    }

    private static boolean blank(String s) {
        return s == null || s.isBlank();
    }
}
