package com.yerin.submitflow.service;

import com.yerin.submitflow.domain.*;
import com.yerin.submitflow.infra.ChangeNotifier;
import com.yerin.submitflow.repository.JobRepository;
import com.yerin.submitflow.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("JobProgressService 단위 테스트")
class JobProgressServiceTest {

    JobRepository jobRepository = mock(JobRepository.class);
    ResultStore resultStore = mock(ResultStore.class);
    AuditTrail auditTrail = mock(AuditTrail.class);
    PipelineMetrics metrics = mock(PipelineMetrics.class);
    ChangeNotifier notifier = mock(ChangeNotifier.class);
    TransactionTemplate tx = new TransactionTemplate(mock(PlatformTransactionManager.class));
    MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));

    JobProgressService sut = new JobProgressService(jobRepository, resultStore, auditTrail,
            new CompletionPolicy(0.0, 1), metrics, notifier, tx, clock);

    Job inProgress(int total) {
        return Job.builder().id("job-1").customerId("c").status(JobStatus.IN_PROGRESS).directoriesTotal(total).build();
    }

    Map<JobResultStatus, Long> counts(Object... pairs) {
        Map<JobResultStatus, Long> m = new EnumMap<>(JobResultStatus.class);
        for (int i = 0; i < pairs.length; i += 2) m.put((JobResultStatus) pairs[i], ((Number) pairs[i + 1]).longValue());
        return m;
    }

    @Test
    @DisplayName("일부만 정산되면 진행률만 갱신하고 종료하지 않음")
    void partial_progress() {
        when(jobRepository.findById("job-1")).thenReturn(Optional.of(inProgress(4)));
        when(resultStore.countSettled("job-1")).thenReturn(1L);
        when(jobRepository.updateProgress(eq("job-1"), anyInt(), anyInt(), any())).thenReturn(1);

        sut.settle("job-1");

        verify(jobRepository).updateProgress(eq("job-1"), eq(25), eq(1), any());
        verify(jobRepository, never()).finishIf(any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("모두 정산되고 성공이 있으면 COMPLETED + flow_completed 이벤트")
    void completes_when_all_settled() {
        when(jobRepository.findById("job-1")).thenReturn(Optional.of(inProgress(3)));
        when(resultStore.countSettled("job-1")).thenReturn(3L);
        when(resultStore.countsByStatus("job-1")).thenReturn(counts(
                JobResultStatus.SUBMITTED, 1, JobResultStatus.FAILED, 1, JobResultStatus.NEEDS_HUMAN, 1));
        when(jobRepository.finishIf(eq("job-1"), eq(JobStatus.IN_PROGRESS), eq(JobStatus.COMPLETED), isNull(), any()))
                .thenReturn(1);

        sut.settle("job-1");

        verify(jobRepository).updateProgress(eq("job-1"), eq(100), eq(3), any());
        verify(auditTrail).append(eq("job-1"), isNull(), eq(HistoryEventType.FLOW_COMPLETED),
                argThat(m -> Long.valueOf(1).equals(m.get("successes")) && Long.valueOf(1).equals(m.get("needs_human"))));
        verify(metrics).incCompleted();
        verify(notifier).publish("jobs", "job-1", "status", "COMPLETED");
    }

    @Test
    @DisplayName("성공 0건이면 FAILED 로 종료")
    void fails_without_success() {
        when(resultStore.countsByStatus("job-1")).thenReturn(counts(JobResultStatus.FAILED, 2));
        when(jobRepository.finishIf(eq("job-1"), eq(JobStatus.IN_PROGRESS), eq(JobStatus.FAILED), anyString(), any()))
                .thenReturn(1);

        boolean won = sut.finalizeJob("job-1", 2);

        assertThat(won).isTrue();
        verify(auditTrail).append(eq("job-1"), isNull(), eq(HistoryEventType.FLOW_FAILED), anyMap());
        verify(metrics).incFailed();
    }

    @Test
    @DisplayName("SKIPPED 도 성공으로 셈")
    void skipped_counts_as_success() {
        when(resultStore.countsByStatus("job-1")).thenReturn(counts(JobResultStatus.SKIPPED, 1, JobResultStatus.FAILED, 1));
        when(jobRepository.finishIf(any(), any(), eq(JobStatus.COMPLETED), any(), any())).thenReturn(1);

        assertThat(sut.finalizeJob("job-1", 2)).isTrue();
        verify(metrics).incCompleted();
    }

    @Test
    @DisplayName("가드 업데이트에 진 정산자는 이벤트를 남기지 않음")
    void loser_writes_no_event() {
        when(resultStore.countsByStatus("job-1")).thenReturn(counts(JobResultStatus.SUBMITTED, 2));
        when(jobRepository.finishIf(any(), any(), any(), any(), any())).thenReturn(0);

        boolean won = sut.finalizeJob("job-1", 2);

        assertThat(won).isFalse();
        verifyNoInteractions(auditTrail, metrics);
        verify(notifier, never()).publish(any(), any(), any(), any());
    }

    @Test
    @DisplayName("종료된 잡은 정산해도 아무것도 바꾸지 않음")
    void terminal_job_untouched() {
        Job done = inProgress(2);
        done.setStatus(JobStatus.COMPLETED);
        when(jobRepository.findById("job-1")).thenReturn(Optional.of(done));

        sut.settle("job-1");

        verify(jobRepository, never()).updateProgress(any(), anyInt(), anyInt(), any());
        verify(jobRepository, never()).finishIf(any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("onTaskSettled 는 submission_complete 이벤트 후 정산")
    void on_task_settled_appends_event() {
        when(jobRepository.findById("job-1")).thenReturn(Optional.empty());

        sut.onTaskSettled("job-1", "yelp-name", JobResultStatus.SUBMITTED, "k1");

        verify(auditTrail).append(eq("job-1"), eq("yelp-name"), eq(HistoryEventType.SUBMISSION_COMPLETE),
                argThat(m -> "SUBMITTED".equals(m.get("status")) && "k1".equals(m.get("idempotency_key"))));
    }

    @Test
    @DisplayName("5개 중 3개 제출, 2개 구조적 실패면 COMPLETED, 진행률 100, 완료 5")
    void partial_success_completes() {
        when(jobRepository.findById("job-1")).thenReturn(Optional.of(inProgress(5)));
        when(resultStore.countSettled("job-1")).thenReturn(5L);
        when(resultStore.countsByStatus("job-1")).thenReturn(counts(
                JobResultStatus.SUBMITTED, 3, JobResultStatus.FAILED, 2));
        when(jobRepository.updateProgress(eq("job-1"), anyInt(), anyInt(), any())).thenReturn(1);
        when(jobRepository.finishIf(eq("job-1"), eq(JobStatus.IN_PROGRESS), eq(JobStatus.COMPLETED), isNull(), any()))
                .thenReturn(1);

        sut.settle("job-1");

        verify(jobRepository).updateProgress(eq("job-1"), eq(100), eq(5), any());
        verify(jobRepository).finishIf(eq("job-1"), eq(JobStatus.IN_PROGRESS), eq(JobStatus.COMPLETED), isNull(), any());
        verify(jobRepository, never()).finishIf(any(), any(), eq(JobStatus.FAILED), any(), any());
        verify(auditTrail).append(eq("job-1"), isNull(), eq(HistoryEventType.FLOW_COMPLETED),
                argThat(m -> Integer.valueOf(5).equals(m.get("total"))
                        && Long.valueOf(3).equals(m.get("successes"))
                        && Long.valueOf(2).equals(m.get("failed"))));
        verify(metrics).incCompleted();
    }

    @Test
    @DisplayName("COMPLETED 또는 FAILED 인 잡만 종료된 것으로 봄")
    void finalized_only_for_terminal_status() {
        when(jobRepository.findById("job-1")).thenReturn(Optional.of(inProgress(2)));
        when(jobRepository.findById("job-2")).thenReturn(Optional.of(
                Job.builder().id("job-2").status(JobStatus.FAILED).build()));

        assertThat(sut.isFinalized("job-1")).isFalse();
        assertThat(sut.isFinalized("job-2")).isTrue();
        assertThat(sut.isFinalized("missing")).isFalse();
    }
}
