package io.localaid.backend.job;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

/**
 * Durable storage for {@link ScheduledJob} records. Every method may throw {@link
 * JobStoreUnavailableException} when the backing table does not exist.
 */
public interface ScheduledJobStore {

  ScheduledJob insert(ScheduledJob job);

  /** Jobs in {@code SCHEDULED} with {@code runAt <= now}, oldest first, at most {@code limit}. */
  List<ScheduledJob> findDue(Instant now, int limit);

  /**
   * Atomically moves the job from {@code expected} to {@code next}. Returns {@code false} when the
   * job is missing or no longer in {@code expected}.
   */
  boolean tryClaim(UUID id, ScheduledJobStatus expected, ScheduledJobStatus next, Instant now);

  /**
   * Writes the terminal state of a claimed job and increments its attempt counter. Returns empty,
   * without writing, when the job is no longer {@code RUNNING} with {@code claimedAttempts}.
   */
  Optional<ScheduledJob> recordOutcome(UUID id, int claimedAttempts, ScheduledJobOutcome outcome);

  Optional<ScheduledJob> get(UUID id);

  Page<ScheduledJob> list(ScheduledJobStatus status, String type, Pageable pageable);

  /**
   * Fails {@code RUNNING} jobs not touched since {@code staleBefore}. Returns the number of jobs
   * recovered.
   */
  int recoverAbandoned(Instant staleBefore, Instant now);

  Map<ScheduledJobStatus, Long> countByStatus();
}
