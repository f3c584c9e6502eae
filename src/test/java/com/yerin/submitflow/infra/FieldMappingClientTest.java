package com.yerin.submitflow.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.submitflow.automation.plan.FillPlan;
import com.yerin.submitflow.automation.plan.Obstacle;
import com.yerin.submitflow.automation.plan.PlanSource;
import com.yerin.submitflow.domain.failure.FailureClass;
import com.yerin.submitflow.domain.failure.PipelineException;
import com.yerin.submitflow.domain.failure.StructuralFailureException;
import com.yerin.submitflow.domain.failure.TransientInfraException;
import com.yerin.submitflow.support.Fixtures;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("필드 매핑 오라클 HTTP 클라이언트 테스트")
class FieldMappingClientTest {

    MockWebServer server;
    FieldMappingClient sut;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        OkHttpClient http = new OkHttpClient.Builder()
                .readTimeout(2, TimeUnit.SECONDS)
                .build();
        sut = new FieldMappingClient(http, new ObjectMapper(), server.url("/").toString());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    @DisplayName("200 응답을 FillPlan 으로 읽고 요청 본문은 snake_case")
    void reads_plan() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("""
                {"navigate_url":"https://yelp.example.com/submit",
                 "fill_actions":[{"action":"fill","field":"email","selector":"input[name='email']","value":"a@b.c"}],
                 "submit_action":{"selector":"button[type='submit']"},
                 "obstacles":["CAPTCHA"],
                 "constraints":{"rate_limit_ms":1500},
                 "success_markers":["thank you"],"error_markers":["invalid"],
                 "source":"heuristic"}
                """));

        FillPlan plan = sut.plan(Fixtures.directory("yelp"), Fixtures.profile());

        assertThat(plan.source()).isEqualTo(PlanSource.HEURISTIC);
        assertThat(plan.has(Obstacle.CAPTCHA)).isTrue();
        assertThat(plan.fillActions()).hasSize(1);
        assertThat(plan.constraints().rateLimitMs()).isEqualTo(1500);

        RecordedRequest req = server.takeRequest();
        assertThat(req.getPath()).isEqualTo("/plan");
        assertThat(req.getMethod()).isEqualTo("POST");
        assertThat(req.getBody().readUtf8()).contains("\"business_profile\"").contains("\"directory\"");
    }

    @Test
    @DisplayName("5xx 는 재시도 가능한 인프라 장애")
    void server_error_is_transient() {
        server.enqueue(new MockResponse().setResponseCode(503));

        assertThatThrownBy(() -> sut.plan(Fixtures.directory("yelp"), Fixtures.profile()))
                .isInstanceOf(TransientInfraException.class)
                .satisfies(e -> assertThat(((PipelineException) e).isRetryable()).isTrue());
    }

    @Test
    @DisplayName("4xx 는 재시도하지 않는 구조적 실패")
    void client_error_is_structural() {
        server.enqueue(new MockResponse().setResponseCode(422).setBody("{\"error\":\"bad\"}"));

        assertThatThrownBy(() -> sut.plan(Fixtures.directory("yelp"), Fixtures.profile()))
                .isInstanceOf(StructuralFailureException.class)
                .satisfies(e -> assertThat(((PipelineException) e).getFailureClass()).isEqualTo(FailureClass.STRUCTURAL));
    }

    @Test
    @DisplayName("연결 실패는 인프라 장애")
    void io_failure_is_transient() throws IOException {
        server.shutdown();

        assertThatThrownBy(() -> sut.plan(Fixtures.directory("yelp"), Fixtures.profile()))
                .isInstanceOf(TransientInfraException.class);
    }
}
