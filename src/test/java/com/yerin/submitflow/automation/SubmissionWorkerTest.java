package com.yerin.submitflow.automation;

import com.yerin.submitflow.automation.plan.*;
import com.yerin.submitflow.domain.JobResultStatus;
import com.yerin.submitflow.domain.failure.FailureClass;
import com.yerin.submitflow.domain.failure.PipelineException;
import com.yerin.submitflow.domain.failure.StructuralFailureException;
import com.yerin.submitflow.domain.failure.TransientAutomationException;
import com.yerin.submitflow.domain.failure.TransientInfraException;
import com.yerin.submitflow.support.FakeBrowserDriver;
import com.yerin.submitflow.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("SubmissionWorker 단위 테스트")
class SubmissionWorkerTest {

    FakeBrowserDriver driver = new FakeBrowserDriver();
    CaptchaSolver solver = mock(CaptchaSolver.class);
    MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));

    SubmissionWorker sut = new SubmissionWorker(driver, solver, new OutcomeClassifier(), clock, "/tmp/shots");

    FillPlan plan(Obstacle... obstacles) {
        return new FillPlan("https://yelp.example.com/submit",
                List.of(new FillAction(FillAction.Type.FILL, "email", "input[name='email']", "a@b.c"),
                        new FillAction(FillAction.Type.SELECT, "category", "select#cat", "cafe"),
                        new FillAction(FillAction.Type.CHECK, "agree", "#agree", "true")),
                new SubmitAction("button[type='submit']"),
                List.of(obstacles),
                new PlanConstraints(1500),
                List.of("thank you"), List.of("is required"),
                PlanSource.HEURISTIC);
    }

    @Test
    @DisplayName("성공 페이지: 순서대로 채우고 제출, 스크린샷과 로그를 남김")
    void submits_and_classifies() {
        SubmissionOutcome out = sut.submit("job-1", "yelp", plan());

        assertThat(out.status()).isEqualTo(JobResultStatus.SUBMITTED);
        assertThat(out.listingUrl()).isEqualTo("https://yelp.example.com/submit");
        assertThat(out.screenshotPath()).endsWith("screenshot_job-1_yelp.png");
        assertThat(out.responseLog()).containsKeys("final_url", "steps_executed", "duration_ms", "success_markers_found");
        assertThat(driver.calls).containsExactly(
                "navigate https://yelp.example.com/submit",
                "fill input[name='email']=a@b.c",
                "select select#cat=cafe",
                "check #agree",
                "click button[type='submit']",
                "idle",
                "screenshot screenshot_job-1_yelp.png");
        assertThat(driver.closed).hasValue(1);
    }

    @Test
    @DisplayName("에러 마커만 보이면 FAILED, listing url 없음")
    void error_markers_fail() {
        driver.pageText = () -> "Email is required";

        SubmissionOutcome out = sut.submit("job-1", "yelp", plan());

        assertThat(out.status()).isEqualTo(JobResultStatus.FAILED);
        assertThat(out.listingUrl()).isNull();
        assertThat(out.errorMessage()).contains("is required");
    }

    @Test
    @DisplayName("로그인 필요면 브라우저를 열지 않고 구조적 실패")
    void login_required_never_opens_browser() {
        assertThatThrownBy(() -> sut.submit("job-1", "gmb", plan(Obstacle.LOGIN_REQUIRED)))
                .isInstanceOf(StructuralFailureException.class);
        assertThat(driver.opened).hasValue(0);
    }

    @Test
    @DisplayName("HTTP 5xx 는 일시 장애, 증거(스크린샷 경로) 포함")
    void server_error_transient_with_evidence() {
        driver.navigationStatus = 503;

        assertThatThrownBy(() -> sut.submit("job-1", "yelp", plan()))
                .isInstanceOfSatisfying(TransientAutomationException.class, e -> {
                    assertThat(e.getScreenshotPath()).endsWith("screenshot_job-1_yelp.png");
                    assertThat(e.getResponseLog()).containsEntry("navigation_status", 503);
                });
        assertThat(driver.closed).hasValue(1);
    }

    @Test
    @DisplayName("HTTP 4xx 는 구조적 실패")
    void client_error_structural() {
        driver.navigationStatus = 404;

        assertThatThrownBy(() -> sut.submit("job-1", "yelp", plan()))
                .isInstanceOf(StructuralFailureException.class);
    }

    @Test
    @DisplayName("캡차가 있는데 솔버가 없으면 NEEDS_HUMAN, 제출하지 않음")
    void captcha_without_solver() {
        driver.siteKey = "site-key";
        when(solver.isEnabled()).thenReturn(false);

        SubmissionOutcome out = sut.submit("job-1", "yelp", plan(Obstacle.CAPTCHA));

        assertThat(out.status()).isEqualTo(JobResultStatus.NEEDS_HUMAN);
        assertThat(driver.calls).noneMatch(c -> c.startsWith("click"));
    }

    @Test
    @DisplayName("솔버가 토큰을 주면 주입하고 제출")
    void captcha_solved() {
        driver.siteKey = "site-key";
        when(solver.isEnabled()).thenReturn(true);
        when(solver.solve("site-key", "https://yelp.example.com/submit")).thenReturn(Optional.of("tok"));

        SubmissionOutcome out = sut.submit("job-1", "yelp", plan(Obstacle.CAPTCHA));

        assertThat(out.status()).isEqualTo(JobResultStatus.SUBMITTED);
        assertThat(driver.calls).contains("captcha tok");
        assertThat(out.responseLog()).containsEntry("captcha", "solved");
    }

    @Test
    @DisplayName("솔버 장애는 일시 장애로 전파")
    void captcha_solver_outage() {
        driver.siteKey = "site-key";
        when(solver.isEnabled()).thenReturn(true);
        when(solver.solve(any(), any())).thenThrow(new TransientInfraException("solver 503"));

        assertThatThrownBy(() -> sut.submit("job-1", "yelp", plan(Obstacle.CAPTCHA)))
                .isInstanceOfSatisfying(TransientInfraException.class, e -> {
                    assertThat(e.getScreenshotPath()).endsWith("screenshot_job-1_yelp.png");
                    assertThat(e.getResponseLog()).containsEntry("navigation_status", 200)
                            .containsEntry("error", "solver 503");
                });
        assertThat(driver.closed).hasValue(1);
    }

    @Test
    @DisplayName("인터럽트된 시도는 제출하지 않고 세션을 닫음")
    void interrupted_attempt_stops_before_submit() {
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> sut.submit("job-1", "yelp", plan()))
                    .isInstanceOfSatisfying(PipelineException.class,
                            e -> assertThat(e.getFailureClass()).isEqualTo(FailureClass.TIMEOUT));
        } finally {
            Thread.interrupted();
        }
        assertThat(driver.calls).noneMatch(c -> c.startsWith("navigate") || c.startsWith("click"));
        assertThat(driver.closed).hasValue(1);
    }

    @Test
    @DisplayName("캡차 장애물이어도 페이지에 위젯이 없으면 그냥 제출")
    void captcha_absent() {
        when(solver.isEnabled()).thenReturn(true);

        SubmissionOutcome out = sut.submit("job-1", "yelp", plan(Obstacle.CAPTCHA));

        assertThat(out.status()).isEqualTo(JobResultStatus.SUBMITTED);
        verify(solver, never()).solve(any(), any());
    }

    @Test
    @DisplayName("파일명에 쓸 수 없는 문자는 치환")
    void safe_names() {
        assertThat(SubmissionWorker.safe("a/b:c")).isEqualTo("a_b_c");
        assertThat(SubmissionWorker.safe(null)).isEqualTo("unknown");
    }
}
