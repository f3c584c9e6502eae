package com.yerin.submitflow.automation;

import com.yerin.submitflow.domain.JobResultStatus;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Classifies the page after submit: only success markers means SUBMITTED, only error markers
 * means FAILED, both or neither goes to a human.
 */
@Component
public class OutcomeClassifier {

    public record Classification(JobResultStatus status, List<String> successFound, List<String> errorFound) {
    }

    public Classification classify(String visibleText, List<String> successMarkers, List<String> errorMarkers) {
        String text = visibleText == null ? "" : visibleText.toLowerCase(Locale.ROOT);
        List<String> success = found(text, successMarkers);
        List<String> error = found(text, errorMarkers);

        JobResultStatus status;
        if (!success.isEmpty() && error.isEmpty()) status = JobResultStatus.SUBMITTED;
        else if (success.isEmpty() && !error.isEmpty()) status = JobResultStatus.FAILED;
        else status = JobResultStatus.NEEDS_HUMAN;
        return new Classification(status, success, error);
    }

    private static List<String> found(String text, List<String> markers) {
        if (markers == null) return List.of();
        return markers.stream()
                .filter(m -> m != null && !m.isBlank())
                .filter(m -> text.contains(m.toLowerCase(Locale.ROOT)))
                .toList();
    }
}
