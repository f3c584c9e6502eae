package com.yerin.submitflow.service;

import com.yerin.submitflow.automation.plan.FillAction;
import com.yerin.submitflow.automation.plan.FillPlan;
import com.yerin.submitflow.automation.plan.Obstacle;
import com.yerin.submitflow.automation.plan.PlanSource;
import com.yerin.submitflow.domain.DirectoryDescriptor;
import com.yerin.submitflow.support.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("필드 매핑 오라클 테스트")
class FieldMappingServiceTest {

    FieldMappingService sut = new FieldMappingService();

    @Test
    @DisplayName("학습된 스키마가 없으면 관례 셀렉터로 휴리스틱 플랜")
    void heuristic_plan() {
        FillPlan plan = sut.plan(Fixtures.directory("yelp"), Fixtures.profile());

        assertThat(plan.source()).isEqualTo(PlanSource.HEURISTIC);
        assertThat(plan.navigateUrl()).isEqualTo("https://yelp.example.com/submit");
        assertThat(plan.fillActions()).extracting(FillAction::selector)
                .contains("input[name='name']", "input[name='email']", "textarea[name='description']");
        assertThat(plan.submitAction().selector()).isEqualTo("button[type='submit']");
        assertThat(plan.constraints().rateLimitMs()).isEqualTo(1500);
        assertThat(plan.successMarkers()).contains("thank you");
        assertThat(plan.errorMarkers()).contains("is required");
        assertThat(plan.obstacles()).isEmpty();
    }

    @Test
    @DisplayName("학습된 스키마가 있으면 그 셀렉터를 쓰고 값이 없는 필드는 건너뜀")
    void learned_plan() {
        Map<String, String> schema = new LinkedHashMap<>();
        schema.put("business_name", "#biz");
        schema.put("category", "select#category");
        schema.put("agree", "input[type='checkbox']");
        DirectoryDescriptor d = new DirectoryDescriptor("bing", "Bing Places", "https://bing.example.com",
                "https://bing.example.com/add", schema, "#go", List.of("listing created"), List.of("error"),
                3000, true, false);
        Map<String, String> profile = new LinkedHashMap<>(Fixtures.profile());
        profile.put("agree", "true");

        FillPlan plan = sut.plan(d, profile);

        assertThat(plan.source()).isEqualTo(PlanSource.LEARNED);
        assertThat(plan.navigateUrl()).isEqualTo("https://bing.example.com/add");
        assertThat(plan.fillActions()).extracting(FillAction::field).containsExactly("business_name", "agree");
        assertThat(plan.fillActions().get(1).action()).isEqualTo(FillAction.Type.CHECK);
        assertThat(plan.submitAction().selector()).isEqualTo("#go");
        assertThat(plan.constraints().rateLimitMs()).isEqualTo(3000);
        assertThat(plan.successMarkers()).containsExactly("listing created");
        assertThat(plan.has(Obstacle.CAPTCHA)).isTrue();
        assertThat(plan.has(Obstacle.LOGIN_REQUIRED)).isFalse();
    }

    @Test
    @DisplayName("로그인 필요 디렉터리는 장애물로 표시")
    void login_obstacle() {
        FillPlan plan = sut.plan(Fixtures.directory("gmb", false, true), Fixtures.profile());
        assertThat(plan.obstacles()).containsExactly(Obstacle.LOGIN_REQUIRED);
    }

    @Test
    @DisplayName("URL 이 없으면 id 로 제출 URL 구성")
    void navigate_url_fallback() {
        DirectoryDescriptor d = new DirectoryDescriptor("dir.example.org", "n", null, null, null, null,
                null, null, 0, false, false);
        assertThat(FieldMappingService.navigateUrl(d)).isEqualTo("https://dir.example.org/submit");

        DirectoryDescriptor slash = new DirectoryDescriptor("x", "n", "https://x.test/", null, null, null,
                null, null, 0, false, false);
        assertThat(FieldMappingService.navigateUrl(slash)).isEqualTo("https://x.test/submit");
    }
}
