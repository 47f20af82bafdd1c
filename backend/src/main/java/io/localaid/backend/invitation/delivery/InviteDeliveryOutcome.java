package io.localaid.backend.invitation.delivery;

import java.time.Instant;

/** Result of one delivery attempt, written back by {@link InviteDeliveryJobStore}. */
public sealed interface InviteDeliveryOutcome {

  Instant attemptedAt();

  record Sent(Instant attemptedAt) implements InviteDeliveryOutcome {}

  /** Transient failure; the job returns to pending and waits until {@code nextAttemptAt}. */
  record Retry(String error, Instant nextAttemptAt, Instant attemptedAt)
      implements InviteDeliveryOutcome {}

  /** Terminal failure; the job stays failed until an operator requeues it. */
  record Exhausted(String error, Instant attemptedAt) implements InviteDeliveryOutcome {}
}
