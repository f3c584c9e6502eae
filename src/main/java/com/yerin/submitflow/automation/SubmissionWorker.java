package com.yerin.submitflow.automation;

import com.yerin.submitflow.automation.plan.FillAction;
import com.yerin.submitflow.automation.plan.FillPlan;
import com.yerin.submitflow.automation.plan.Obstacle;
import com.yerin.submitflow.domain.JobResultStatus;
import com.yerin.submitflow.domain.failure.FailureClass;
import com.yerin.submitflow.domain.failure.PipelineException;
import com.yerin.submitflow.domain.failure.StructuralFailureException;
import com.yerin.submitflow.domain.failure.TransientAutomationException;
import com.yerin.submitflow.domain.failure.TransientInfraException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Executes one fill plan in a fresh browser session and classifies the result.
 * A screenshot and a response log are captured for every attempt that opened a browser,
 * including failed ones, where they travel on the thrown exception.
 * An interrupted attempt stops at the next step and closes its session.
 */
@Slf4j
@Component
public class SubmissionWorker {

    private final BrowserDriver driver;
    private final CaptchaSolver captchaSolver;
    private final OutcomeClassifier classifier;
    private final Clock clock;
    private final Path screenshotDir;

    @Autowired
    public SubmissionWorker(BrowserDriver driver,
                            CaptchaSolver captchaSolver,
                            OutcomeClassifier classifier,
                            Clock clock,
                            @Value("${submitflow.automation.screenshot-dir:${java.io.tmpdir}}") String screenshotDir) {
        this.driver = driver;
        this.captchaSolver = captchaSolver;
        this.classifier = classifier;
        this.clock = clock;
        this.screenshotDir = Paths.get(screenshotDir);
    }

    public SubmissionOutcome submit(String jobId, String directoryId, FillPlan plan) {
        long start = clock.millis();
        Map<String, Object> responseLog = new LinkedHashMap<>();
        responseLog.put("plan_source", plan.source());
        responseLog.put("navigate_url", plan.navigateUrl());

        if (plan.has(Obstacle.LOGIN_REQUIRED)) {
            responseLog.put("obstacle", Obstacle.LOGIN_REQUIRED);
            throw new StructuralFailureException("directory requires login", null, responseLog, null);
        }

        Path shot = screenshotDir.resolve("screenshot_" + safe(jobId) + "_" + safe(directoryId) + ".png");
        int steps = 0;
        try (BrowserSession session = driver.open()) {
            try {
                checkCancelled();
                int status = session.navigate(plan.navigateUrl());
                steps++;
                responseLog.put("navigation_status", status);
                if (status >= 500) throw new TransientAutomationException("directory answered " + status);
                if (status >= 400) throw new StructuralFailureException("directory answered " + status);

                for (FillAction action : plan.fillActions()) {
                    checkCancelled();
                    apply(session, action);
                    steps++;
                }

                if (plan.has(Obstacle.CAPTCHA)) {
                    checkCancelled();
                    String captcha = handleCaptcha(session, plan.navigateUrl());
                    responseLog.put("captcha", captcha);
                    if ("unsolved".equals(captcha)) {
                        responseLog.put("steps_executed", steps);
                        return finish(session, shot, responseLog, start, JobResultStatus.NEEDS_HUMAN,
                                "captcha needs a human");
                    }
                }

                checkCancelled();
                session.click(plan.submitAction().selector());
                steps++;
                session.waitForNetworkIdle();

                OutcomeClassifier.Classification c =
                        classifier.classify(session.visibleText(), plan.successMarkers(), plan.errorMarkers());
                responseLog.put("steps_executed", steps);
                responseLog.put("success_markers_found", c.successFound());
                responseLog.put("error_markers_found", c.errorFound());

                String error = switch (c.status()) {
                    case FAILED -> "error markers on result page: " + c.errorFound();
                    case NEEDS_HUMAN -> "ambiguous result page";
                    default -> null;
                };
                return finish(session, shot, responseLog, start, c.status(), error);
            } catch (PipelineException e) {
                responseLog.put("steps_executed", steps);
                responseLog.put("error", e.getMessage());
                String path = capture(session, shot);
                responseLog.put("final_url", safeUrl(session));
                responseLog.put("duration_ms", clock.millis() - start);
                throw withEvidence(e, responseLog, path);
            }
        }
    }

    private void apply(BrowserSession session, FillAction action) {
        switch (action.action()) {
            case SELECT -> session.select(action.selector(), action.value());
            case CHECK -> session.check(action.selector());
            default -> session.fill(action.selector(), action.value());
        }
    }

    // solved | absent | unsolved
    private String handleCaptcha(BrowserSession session, String pageUrl) {
        Optional<String> siteKey = session.attribute("[data-sitekey]", "data-sitekey");
        if (siteKey.isEmpty()) return "absent";
        if (!captchaSolver.isEnabled()) return "unsolved";

        Optional<String> token = captchaSolver.solve(siteKey.get(), pageUrl);
        if (token.isEmpty()) return "unsolved";
        session.injectCaptchaToken(token.get());
        return "solved";
    }

    private SubmissionOutcome finish(BrowserSession session, Path shot, Map<String, Object> responseLog,
                                     long start, JobResultStatus status, String error) {
        String finalUrl = safeUrl(session);
        responseLog.put("final_url", finalUrl);
        String path = capture(session, shot);
        responseLog.put("duration_ms", clock.millis() - start);
        log.info("[Submission] status={}, url={}, durationMs={}", status, finalUrl, responseLog.get("duration_ms"));
        return new SubmissionOutcome(status, responseLog, path, status == JobResultStatus.SUBMITTED ? finalUrl : null, error);
    }

    private String capture(BrowserSession session, Path shot) {
        try {
            session.screenshot(shot);
            return shot.toString();
        } catch (PipelineException e) {
            log.warn("[Submission] screenshot failed path={}, err={}", shot, e.getMessage());
            return null;
        }
    }

    private String safeUrl(BrowserSession session) {
        try {
            return session.currentUrl();
        } catch (RuntimeException e) {
            log.debug("[Submission] current url unavailable: {}", e.toString());
            return null;
        }
    }

    private static PipelineException withEvidence(PipelineException e, Map<String, Object> responseLog, String path) {
        if (e instanceof TransientAutomationException) {
            return new TransientAutomationException(e.getMessage(), e.getCause(), responseLog, path);
        }
        if (e instanceof StructuralFailureException) {
            return new StructuralFailureException(e.getMessage(), e.getCause(), responseLog, path);
        }
        if (e instanceof TransientInfraException) {
            return new TransientInfraException(e.getMessage(), e.getCause(), responseLog, path);
        }
        return e;
    }

    // 마감 초과로 취소된 시도는 제출 버튼까지 가지 않는다
    private static void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new PipelineException(FailureClass.TIMEOUT, "attempt cancelled");
        }
    }

    static String safe(String s) {
        return s == null ? "unknown" : s.replaceAll("[^a-zA-Z0-9_-]", "_");
    }
}
