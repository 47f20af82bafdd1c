package io.localaid.backend.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import io.localaid.backend.audit.AuditEventRecord;
import io.localaid.backend.audit.AuditService;
import io.localaid.backend.exception.InvalidStateException;
import io.localaid.backend.exception.ResourceNotFoundException;
import io.localaid.backend.job.handler.JobHandlerRegistry;
import io.localaid.backend.job.handler.ReminderJobHandler;
import io.localaid.backend.notification.NotificationService;
import io.localaid.backend.testutil.MutableClock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.domain.PageRequest;

class ScheduledJobAdminServiceTest {

  private static final Instant NOW = Instant.parse("2026-05-04T08:30:00Z");

  private final InMemoryScheduledJobStore store = new InMemoryScheduledJobStore();
  private final AuditService auditService = mock(AuditService.class);
  private ScheduledJobAdminService service;

  @BeforeEach
  void setUp() {
    var registry =
        new JobHandlerRegistry(List.of(new ReminderJobHandler(mock(NotificationService.class))));
    service = new ScheduledJobAdminService(store, registry, auditService, new MutableClock(NOW));
  }

  @Test
  void create_defaults_run_at_to_now() {
    var response =
        service.createJob(
            new CreateScheduledJobRequest(
                "Call back",
                "reminder",
                Map.of("userId", UUID.randomUUID().toString(), "message", "Ring Ana"),
                null));

    assertThat(response.status()).isEqualTo(ScheduledJobStatus.SCHEDULED);
    assertThat(response.runAt()).isEqualTo(NOW);
    assertThat(response.attempts()).isZero();
    assertThat(store.get(response.id())).isPresent();
  }

  @Test
  void create_rejects_unknown_type() {
    var request = new CreateScheduledJobRequest("Mystery", "does_not_exist", Map.of(), null);

    assertThatThrownBy(() -> service.createJob(request))
        .isInstanceOfSatisfying(
            InvalidStateException.class,
            e -> assertThat(e.getBody().getDetail()).contains("does_not_exist"));
    assertThat(store.countByStatus().get(ScheduledJobStatus.SCHEDULED)).isZero();
  }

  @Test
  void create_rejects_payload_the_handler_cannot_parse() {
    var request =
        new CreateScheduledJobRequest(
            "Broken", "reminder", Map.of("userId", true, "message", "hi"), null);

    assertThatThrownBy(() -> service.createJob(request))
        .isInstanceOfSatisfying(
            InvalidStateException.class,
            e ->
                assertThat(e.getBody().getDetail())
                    .contains("userId must be a string or an integer"));
  }

  @Test
  void retry_moves_failed_job_back_to_scheduled_and_keeps_attempts() {
    var job =
        store.insert(new ScheduledJob("Nightly", "reminder", Map.of(), NOW.minusSeconds(60)));
    job.transitionTo(ScheduledJobStatus.RUNNING, NOW);
    job.apply(new ScheduledJobOutcome.Failed("boom", NOW));

    var response = service.retryJob(job.getId());

    assertThat(response.status()).isEqualTo(ScheduledJobStatus.SCHEDULED);
    assertThat(response.attempts()).isEqualTo(1);
    assertThat(response.lastError()).isEqualTo("boom");
    var captor = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(captor.capture());
    assertThat(captor.getValue().eventType()).isEqualTo("scheduled_job.retried");
  }

  @Test
  void retry_rejects_job_that_has_not_failed() {
    var job = store.insert(new ScheduledJob("Later", "reminder", Map.of(), NOW.plusSeconds(60)));

    assertThatThrownBy(() -> service.retryJob(job.getId()))
        .isInstanceOf(InvalidStateException.class);
    verify(auditService, never()).log(any());
  }

  @Test
  void get_unknown_job_is_not_found() {
    assertThatThrownBy(() -> service.getJob(UUID.randomUUID()))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void list_filters_by_status_and_type() {
    store.insert(new ScheduledJob("a", "reminder", Map.of(), NOW));
    store.put(
        new ScheduledJob("b", "compliance_expiry", Map.of(), NOW),
        ScheduledJobStatus.COMPLETED,
        NOW);

    var page = service.listJobs(ScheduledJobStatus.SCHEDULED, " Reminder ", PageRequest.of(0, 10));

    assertThat(page.getContent()).extracting(ScheduledJobResponse::name).containsExactly("a");
  }

  @Test
  void stats_count_every_status() {
    store.insert(new ScheduledJob("a", "reminder", Map.of(), NOW));
    store.put(new ScheduledJob("b", "reminder", Map.of(), NOW), ScheduledJobStatus.FAILED, NOW);

    var stats = service.getStats();

    assertThat(stats.total()).isEqualTo(2);
    assertThat(stats.byStatus())
        .containsEntry(ScheduledJobStatus.SCHEDULED, 1L)
        .containsEntry(ScheduledJobStatus.FAILED, 1L)
        .containsEntry(ScheduledJobStatus.RUNNING, 0L);
  }
}
