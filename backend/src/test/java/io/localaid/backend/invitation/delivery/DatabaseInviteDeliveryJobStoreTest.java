package io.localaid.backend.invitation.delivery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.localaid.backend.job.JobStoreUnavailableException;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.InvalidDataAccessResourceUsageException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;

@ExtendWith(MockitoExtension.class)
class DatabaseInviteDeliveryJobStoreTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  @Mock private InviteDeliveryJobRepository repository;
  @InjectMocks private DatabaseInviteDeliveryJobStore store;

  @Test
  void unique_violation_on_insert_is_reported_as_duplicate() {
    var invitationId = UUID.randomUUID();
    var job = new InviteDeliveryJob(invitationId);
    when(repository.saveAndFlush(job))
        .thenThrow(new DataIntegrityViolationException("uq_invite_send_jobs_invitation"));

    assertThatThrownBy(() -> store.insert(job))
        .isInstanceOf(DuplicateInviteDeliveryJobException.class)
        .hasMessageContaining(invitationId.toString())
        .hasCauseInstanceOf(DataIntegrityViolationException.class);
  }

  @Test
  void outcome_after_released_claim_is_dropped() {
    var id = UUID.randomUUID();
    when(repository.findClaimedForUpdate(id, 1)).thenReturn(Optional.empty());

    var recorded =
        store.recordOutcome(
            id, 1, new InviteDeliveryOutcome.Retry("read timed out", NOW.plusSeconds(60), NOW));

    assertThat(recorded).isEmpty();
    verify(repository, never()).save(any());
  }

  @Test
  void missing_table_is_reported_as_unavailable() {
    when(repository.requeueAllFailed(NOW))
        .thenThrow(
            new InvalidDataAccessResourceUsageException(
                "could not prepare statement",
                new SQLException("ERROR: relation \"invite_send_jobs\" does not exist")));

    assertThatThrownBy(() -> store.requeueAllFailed(NOW))
        .isInstanceOf(JobStoreUnavailableException.class)
        .hasMessageContaining("relation \"invite_send_jobs\" does not exist");
  }

  @Test
  void email_term_becomes_lower_case_like_pattern() {
    var pageable = PageRequest.of(0, 20);
    when(repository.findByFilters(
            isNull(), isNull(), isNull(), eq("%ana@example.org%"), isNull(), isNull(), any()))
        .thenReturn(Page.empty(pageable));

    var page =
        store.list(
            new InviteDeliveryJobFilter(null, null, null, "Ana@Example.org", null, null), pageable);

    assertThat(page.getContent()).isEmpty();
    verify(repository)
        .findByFilters(null, null, null, "%ana@example.org%", null, null, pageable);
  }

  @Test
  void average_attempts_of_empty_table_is_zero() {
    when(repository.averageAttempts()).thenReturn(null);

    assertThat(store.averageAttempts()).isZero();
  }
}
