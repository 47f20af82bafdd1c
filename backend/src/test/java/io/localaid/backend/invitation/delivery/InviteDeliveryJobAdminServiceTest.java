package io.localaid.backend.invitation.delivery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.localaid.backend.audit.AuditEventRecord;
import io.localaid.backend.audit.AuditService;
import io.localaid.backend.exception.InvalidStateException;
import io.localaid.backend.exception.ResourceNotFoundException;
import io.localaid.backend.invitation.OrganizationInviteRepository;
import io.localaid.backend.organization.OrganizationRepository;
import io.localaid.backend.testutil.MutableClock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.domain.PageRequest;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class InviteDeliveryJobAdminServiceTest {

  private static final Instant NOW = Instant.parse("2026-06-01T12:00:00Z");

  @Mock private InviteDeliveryQueue queue;
  @Mock private OrganizationInviteRepository inviteRepository;
  @Mock private OrganizationRepository organizationRepository;
  @Mock private AuditService auditService;

  private final InMemoryInviteDeliveryJobStore store = new InMemoryInviteDeliveryJobStore(NOW);

  private InviteDeliveryJobAdminService service;

  @BeforeEach
  void setUp() {
    service =
        new InviteDeliveryJobAdminService(
            store,
            queue,
            inviteRepository,
            organizationRepository,
            auditService,
            new MutableClock(NOW));
    when(inviteRepository.findAllById(anyIterable())).thenReturn(List.of());
    when(organizationRepository.findAllById(anyIterable())).thenReturn(List.of());
  }

  @Test
  void retry_of_missing_job_is_not_found() {
    assertThatThrownBy(() -> service.retryJob(UUID.randomUUID()))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void retry_of_pending_job_is_rejected() {
    var job = store.insert(new InviteDeliveryJob(UUID.randomUUID()));

    assertThatThrownBy(() -> service.retryJob(job.getId()))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void retry_requeues_failed_job_and_attempts_delivery() {
    var job = failedJob(3);

    var response = service.retryJob(job.getId());

    assertThat(response.status()).isEqualTo(InviteDeliveryStatus.PENDING);
    assertThat(response.attempts()).isEqualTo(3);
    assertThat(response.nextAttemptAt()).isNull();
    verify(queue).deliverJob(job.getId());
    var captor = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(captor.capture());
    assertThat(captor.getValue().eventType()).isEqualTo("invite_send_job.retried");
    assertThat(captor.getValue().entityId()).isEqualTo(job.getId());
  }

  @Test
  void retry_survives_failing_delivery_attempt() {
    var job = failedJob(5);
    when(queue.deliverJob(job.getId())).thenThrow(new IllegalStateException("smtp down"));

    var response = service.retryJob(job.getId());

    assertThat(response.id()).isEqualTo(job.getId());
  }

  @Test
  void retry_all_failed_requeues_and_audits_start_and_completion() {
    failedJob(5);
    failedJob(2);
    store.insert(new InviteDeliveryJob(UUID.randomUUID()));

    var result = service.retryAllFailed();

    assertThat(result.requeued()).isEqualTo(2);
    assertThat(store.countByStatus().get(InviteDeliveryStatus.PENDING)).isEqualTo(3L);
    var captor = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService, times(2)).log(captor.capture());
    assertThat(captor.getAllValues())
        .extracting(AuditEventRecord::eventType)
        .containsExactly(
            "invite_send_jobs.requeue_started", "invite_send_jobs.requeue_completed");
    assertThat(captor.getAllValues().get(1).details()).containsEntry("requeued", 2);
    verify(queue).processQueue();
  }

  @Test
  void stats_compute_success_rate_over_terminal_jobs() {
    sentJob();
    sentJob();
    sentJob();
    failedJob(5);
    store.insert(new InviteDeliveryJob(UUID.randomUUID()));

    var stats = service.getStats();

    assertThat(stats.total()).isEqualTo(5);
    assertThat(stats.successRate()).isEqualTo(0.75);
    assertThat(stats.byStatus())
        .containsEntry(InviteDeliveryStatus.SENT, 3L)
        .containsEntry(InviteDeliveryStatus.FAILED, 1L)
        .containsEntry(InviteDeliveryStatus.PENDING, 1L);
    assertThat(stats.avgAttempts()).isEqualTo(8.0 / 5);
  }

  @Test
  void stats_without_terminal_jobs_report_zero_rate() {
    store.insert(new InviteDeliveryJob(UUID.randomUUID()));

    assertThat(service.getStats().successRate()).isZero();
  }

  @Test
  void stats_are_zero_when_store_is_unavailable() {
    store.setUnavailable(true);

    var stats = service.getStats();

    assertThat(stats.total()).isZero();
    assertThat(stats.successRate()).isZero();
    assertThat(stats.avgAttempts()).isZero();
    assertThat(stats.byStatus()).containsEntry(InviteDeliveryStatus.SENT, 0L);
  }

  @Test
  void list_with_uuid_query_matches_invitation_id() {
    var invitationId = UUID.randomUUID();
    var job = store.insert(new InviteDeliveryJob(invitationId));
    store.insert(new InviteDeliveryJob(UUID.randomUUID()));

    var page =
        service.listJobs(null, null, invitationId.toString(), null, null, PageRequest.of(0, 20));

    assertThat(page.getContent())
        .extracting(InviteDeliveryJobResponse::id)
        .containsExactly(job.getId());
    assertThat(page.getContent().get(0).invitation()).isNull();
  }

  private InviteDeliveryJob failedJob(int attempts) {
    var job = store.insert(new InviteDeliveryJob(UUID.randomUUID()));
    for (int i = 1; i < attempts; i++) {
      job.apply(new InviteDeliveryOutcome.Retry("try again", null, NOW));
    }
    job.apply(new InviteDeliveryOutcome.Exhausted("mailbox unavailable", NOW));
    return job;
  }

  private void sentJob() {
    var job = store.insert(new InviteDeliveryJob(UUID.randomUUID()));
    job.apply(new InviteDeliveryOutcome.Sent(NOW));
  }
}
