package io.localaid.backend.invitation.delivery;

import io.localaid.backend.job.JobStoreUnavailableException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

/**
 * Durable storage for {@link InviteDeliveryJob} records. Every method may throw {@link
 * JobStoreUnavailableException} when the backing table does not exist.
 */
public interface InviteDeliveryJobStore {

  /**
   * Inserts a new pending job.
   *
   * @throws DuplicateInviteDeliveryJobException if the invitation already has a job
   */
  InviteDeliveryJob insert(InviteDeliveryJob job);

  /** Pending jobs whose retry delay has elapsed, oldest eligible first. */
  List<InviteDeliveryJob> findDue(Instant now, int limit);

  Optional<InviteDeliveryJob> findByInvitationId(UUID invitationId);

  /**
   * Atomically moves the job from {@code expected} to {@code next}, clearing any retry delay.
   * Returns {@code false} when the job is missing or no longer in {@code expected}.
   */
  boolean tryClaim(UUID id, InviteDeliveryStatus expected, InviteDeliveryStatus next, Instant now);

  /**
   * Writes the result of a delivery attempt and increments the attempt counter, provided the job
   * is still {@code PROCESSING} with the attempt count it had when claimed. Returns empty when the
   * claim was lost to stale recovery, leaving the row untouched.
   */
  Optional<InviteDeliveryJob> recordOutcome(
      UUID id, int claimedAttempts, InviteDeliveryOutcome outcome);

  Optional<InviteDeliveryJob> get(UUID id);

  Page<InviteDeliveryJob> list(InviteDeliveryJobFilter filter, Pageable pageable);

  /** Moves every failed job back to pending. Returns the number of jobs requeued. */
  int requeueAllFailed(Instant now);

  /** Returns processing jobs not touched since {@code staleBefore} to pending. */
  int recoverAbandoned(Instant staleBefore, Instant now);

  Map<InviteDeliveryStatus, Long> countByStatus();

  double averageAttempts();
}
