package com.yerin.submitflow.service;

import com.yerin.submitflow.automation.plan.*;
import com.yerin.submitflow.domain.DirectoryDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Server side of the field-mapping oracle. A directory with a learned form schema gets a plan
 * built from it; any other directory gets the conventional-selector plan instead of an error.
 */
@Slf4j
@Service
public class FieldMappingService {

    static final long DEFAULT_RATE_LIMIT_MS = 1500;
    static final String DEFAULT_SUBMIT_SELECTOR = "button[type='submit']";
    static final List<String> DEFAULT_SUCCESS_MARKERS =
            List.of("thank you", "successfully submitted", "submission received");
    static final List<String> DEFAULT_ERROR_MARKERS =
            List.of("please correct", "is required", "invalid");

    // 프로필 필드 -> 관례적인 셀렉터
    private static final Map<String, String> HEURISTIC_SELECTORS = new LinkedHashMap<>();

    static {
        HEURISTIC_SELECTORS.put("business_name", "input[name='name']");
        HEURISTIC_SELECTORS.put("email", "input[name='email']");
        HEURISTIC_SELECTORS.put("phone", "input[name='phone']");
        HEURISTIC_SELECTORS.put("website", "input[name='website']");
        HEURISTIC_SELECTORS.put("description", "textarea[name='description']");
    }

    public FillPlan plan(DirectoryDescriptor directory, Map<String, String> profile) {
        boolean learned = directory.hasLearnedMapping();
        Map<String, String> mapping = learned ? directory.formSchema() : HEURISTIC_SELECTORS;

        List<FillAction> fills = new ArrayList<>();
        for (Map.Entry<String, String> e : mapping.entrySet()) {
            String value = profile.get(e.getKey());
            if (value == null || value.isBlank() || e.getValue() == null || e.getValue().isBlank()) continue;
            fills.add(new FillAction(actionFor(e.getValue()), e.getKey(), e.getValue(), value));
        }

        List<Obstacle> obstacles = new ArrayList<>();
        if (directory.captcha()) obstacles.add(Obstacle.CAPTCHA);
        if (directory.requiresLogin()) obstacles.add(Obstacle.LOGIN_REQUIRED);

        String submitSelector = blank(directory.submitSelector()) ? DEFAULT_SUBMIT_SELECTOR : directory.submitSelector();
        long rateLimit = directory.rateLimitMs() > 0 ? directory.rateLimitMs() : DEFAULT_RATE_LIMIT_MS;

        FillPlan plan = new FillPlan(
                navigateUrl(directory),
                fills,
                new SubmitAction(submitSelector),
                obstacles,
                new PlanConstraints(rateLimit),
                orDefault(directory.successMarkers(), DEFAULT_SUCCESS_MARKERS),
                orDefault(directory.errorMarkers(), DEFAULT_ERROR_MARKERS),
                learned ? PlanSource.LEARNED : PlanSource.HEURISTIC);
        log.info("[Oracle] plan directory={}, source={}, fills={}, obstacles={}",
                directory.id(), plan.source(), fills.size(), obstacles);
        return plan;
    }

    static String navigateUrl(DirectoryDescriptor d) {
        if (!blank(d.submissionUrl())) return d.submissionUrl();
        if (!blank(d.url())) {
            String base = d.url().endsWith("/") ? d.url().substring(0, d.url().length() - 1) : d.url();
            return base + "/submit";
        }
        return "https://" + d.id() + "/submit";
    }

    private static FillAction.Type actionFor(String selector) {
        String s = selector.trim().toLowerCase();
        if (s.startsWith("select")) return FillAction.Type.SELECT;
        if (s.contains("type='checkbox'") || s.contains("type=\"checkbox\"")) return FillAction.Type.CHECK;
        return FillAction.Type.FILL;
    }

    private static List<String> orDefault(List<String> markers, List<String> fallback) {
        return markers == null || markers.isEmpty() ? fallback : markers;
    }

    private static boolean blank(String s) {
        return s == null || s.isBlank();
    }
}
