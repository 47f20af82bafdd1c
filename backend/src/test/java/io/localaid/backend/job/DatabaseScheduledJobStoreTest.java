package io.localaid.backend.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.InvalidDataAccessResourceUsageException;
import org.springframework.data.domain.Pageable;

@ExtendWith(MockitoExtension.class)
class DatabaseScheduledJobStoreTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  @Mock private ScheduledJobRepository repository;
  @InjectMocks private DatabaseScheduledJobStore store;

  @Test
  void missing_table_is_reported_as_unavailable() {
    when(repository.findDue(any(), any(), any(Pageable.class)))
        .thenThrow(
            new InvalidDataAccessResourceUsageException(
                "could not prepare statement",
                new SQLException("ERROR: relation \"scheduled_jobs\" does not exist")));

    assertThatThrownBy(() -> store.findDue(NOW, 10))
        .isInstanceOf(JobStoreUnavailableException.class)
        .hasMessageStartingWith("Scheduled job store is unavailable")
        .hasMessageContaining("relation \"scheduled_jobs\" does not exist");
  }

  @Test
  void claim_succeeds_only_when_one_row_changed() {
    var id = UUID.randomUUID();
    when(repository.transition(id, ScheduledJobStatus.SCHEDULED, ScheduledJobStatus.RUNNING, NOW))
        .thenReturn(1, 0);

    assertThat(store.tryClaim(id, ScheduledJobStatus.SCHEDULED, ScheduledJobStatus.RUNNING, NOW))
        .isTrue();
    assertThat(store.tryClaim(id, ScheduledJobStatus.SCHEDULED, ScheduledJobStatus.RUNNING, NOW))
        .isFalse();
  }

  @Test
  void outcome_is_applied_to_the_claimed_job() {
    var job = new ScheduledJob("Digest", "reminder", Map.of(), NOW);
    var id = UUID.randomUUID();
    when(repository.findClaimedForUpdate(id, 0)).thenReturn(Optional.of(job));
    when(repository.save(job)).thenReturn(job);

    var saved =
        store
            .recordOutcome(id, 0, new ScheduledJobOutcome.Failed("x".repeat(2500), NOW))
            .orElseThrow();

    assertThat(saved.getStatus()).isEqualTo(ScheduledJobStatus.FAILED);
    assertThat(saved.getAttempts()).isEqualTo(1);
    assertThat(saved.getLastError()).hasSize(2000);
    assertThat(saved.getLastRunAt()).isEqualTo(NOW);
  }

  @Test
  void outcome_for_a_lost_claim_writes_nothing() {
    var id = UUID.randomUUID();
    when(repository.findClaimedForUpdate(id, 0)).thenReturn(Optional.empty());

    assertThat(store.recordOutcome(id, 0, new ScheduledJobOutcome.Succeeded(NOW))).isEmpty();
    verify(repository, never()).save(any());
  }

  @Test
  void counts_include_statuses_without_rows() {
    when(repository.countByStatus()).thenReturn(List.of(count(ScheduledJobStatus.COMPLETED, 4)));

    assertThat(store.countByStatus())
        .containsEntry(ScheduledJobStatus.COMPLETED, 4L)
        .containsEntry(ScheduledJobStatus.SCHEDULED, 0L)
        .containsEntry(ScheduledJobStatus.RUNNING, 0L)
        .containsEntry(ScheduledJobStatus.FAILED, 0L);
  }

  private static ScheduledJobRepository.StatusCount count(ScheduledJobStatus status, long total) {
    return new ScheduledJobRepository.StatusCount() {
      @Override
      public ScheduledJobStatus getStatus() {
        return status;
      }

      @Override
      public long getTotal() {
        return total;
      }
    };
  }
}
