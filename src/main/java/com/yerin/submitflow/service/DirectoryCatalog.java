package com.yerin.submitflow.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.submitflow.domain.Directory;
import com.yerin.submitflow.domain.DirectoryDescriptor;
import com.yerin.submitflow.repository.DirectoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class DirectoryCatalog {

    private static final TypeReference<Map<String, String>> SCHEMA = new TypeReference<>() {};
    private static final TypeReference<List<String>> MARKERS = new TypeReference<>() {};

    private final DirectoryRepository directoryRepository;
    private final ObjectMapper objectMapper;

    // 랭크 순으로 활성 디렉터리 최대 limit 개
    @Transactional(readOnly = true)
    public List<DirectoryDescriptor> activeDirectories(int limit) {
        if (limit <= 0) return List.of();
        return directoryRepository.findByActiveTrueOrderByRankAsc(PageRequest.of(0, limit)).stream()
                .map(this::describe)
                .toList();
    }

    DirectoryDescriptor describe(Directory d) {
        return new DirectoryDescriptor(
                d.getId(),
                d.getName(),
                d.getUrl(),
                d.getSubmissionUrl(),
                read(d.getFormSchema(), SCHEMA, Map.of(), d.getId()),
                d.getSubmitSelector(),
                read(d.getSuccessMarkers(), MARKERS, List.of(), d.getId()),
                read(d.getErrorMarkers(), MARKERS, List.of(), d.getId()),
                d.getRateLimitMs(),
                d.isCaptcha(),
                d.isRequiresLogin());
    }

    private <T> T read(String json, TypeReference<T> type, T fallback, String directoryId) {
        if (json == null || json.isBlank()) return fallback;
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            // 잘못된 매핑은 학습 데이터 없음으로 취급
            log.warn("[Directory] unreadable column directory={}, err={}", directoryId, e.getOriginalMessage());
            return fallback;
        }
    }
}
