package io.localaid.backend.invitation.delivery;

import io.localaid.backend.config.JobProperties;
import io.localaid.backend.integration.email.EmailSender;
import io.localaid.backend.integration.email.SendResult;
import io.localaid.backend.job.JobStoreUnavailableException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Delivers organization invitation emails with bounded retries.
 *
 * <p>Every invitation has exactly one {@link InviteDeliveryJob}. A delivery attempt first claims
 * the job ({@code PENDING -> PROCESSING}), so a poller and an interactive send never mail the same
 * invitation at the same time. Transient failures return the job to {@code PENDING} with an
 * exponential delay; after {@code maxAttempts} the job is {@code FAILED} until an operator requeues
 * it.
 */
@Service
public class InviteDeliveryQueue {

  private static final Logger log = LoggerFactory.getLogger(InviteDeliveryQueue.class);

  private final InviteDeliveryJobStore store;
  private final InviteEmailComposer composer;
  private final EmailSender emailSender;
  private final InviteBackoffPolicy backoffPolicy;
  private final JobProperties.Invites settings;
  private final Clock clock;

  public InviteDeliveryQueue(
      InviteDeliveryJobStore store,
      InviteEmailComposer composer,
      EmailSender emailSender,
      InviteBackoffPolicy backoffPolicy,
      JobProperties properties,
      Clock clock) {
    this.store = store;
    this.composer = composer;
    this.emailSender = emailSender;
    this.backoffPolicy = backoffPolicy;
    this.settings = properties.invites();
    this.clock = clock;
  }

  /**
   * Makes sure the invitation has a pending or finished delivery job. A failed job is moved back to
   * pending with its attempt count kept; pending, processing and sent jobs are left alone.
   *
   * @throws DuplicateInviteDeliveryJobException if a concurrent caller inserted the job first
   */
  public InviteDeliveryJob enqueue(UUID invitationId) {
    var existing = store.findByInvitationId(invitationId);
    if (existing.isEmpty()) {
      var job = store.insert(new InviteDeliveryJob(invitationId));
      log.debug("Queued invite delivery job {} for invitation {}", job.getId(), invitationId);
      return job;
    }
    var job = existing.get();
    if (job.getStatus() == InviteDeliveryStatus.FAILED && requeue(job.getId())) {
      log.info(
          "Re-queued failed invite delivery job {} for invitation {}", job.getId(), invitationId);
      return store.get(job.getId()).orElse(job);
    }
    return job;
  }

  private boolean requeue(UUID jobId) {
    return store.tryClaim(
        jobId, InviteDeliveryStatus.FAILED, InviteDeliveryStatus.PENDING, clock.instant());
  }

  /**
   * One poll tick: release abandoned claims, then attempt every due job. Never throws; a missing
   * store is reported as zero jobs processed.
   *
   * @return number of delivery attempts made
   */
  public int processQueue() {
    Instant now = clock.instant();
    List<InviteDeliveryJob> due;
    try {
      recoverAbandoned(now);
      due = store.findDue(now, settings.batchSize());
    } catch (JobStoreUnavailableException e) {
      log.warn("Skipping invite delivery tick: {}", e.getMessage());
      return 0;
    } catch (RuntimeException e) {
      log.error("Invite delivery tick failed before processing", e);
      return 0;
    }
    log.debug("Found {} due invite delivery jobs", due.size());

    int attempted = 0;
    int sent = 0;
    for (var job : due) {
      try {
        var claimed = claim(job.getId());
        if (claimed.isEmpty()) {
          log.debug("Invite delivery job {} already claimed", job.getId());
          continue;
        }
        var updated = attempt(claimed.get());
        attempted++;
        if (updated.filter(j -> j.getStatus() == InviteDeliveryStatus.SENT).isPresent()) {
          sent++;
        }
      } catch (RuntimeException e) {
        log.error("Failed to process invite delivery job {}", job.getId(), e);
      }
    }
    if (attempted > 0) {
      log.info("Invite delivery tick finished: {} attempted, {} sent", attempted, sent);
    }
    return attempted;
  }

  /**
   * Sends the invitation immediately instead of waiting for the next tick. The job record is
   * created or reset as needed and receives the same outcome a poll would write.
   *
   * @return whether the invitation email has been sent, by this call or earlier
   */
  public boolean sendInviteNow(UUID invitationId) {
    try {
      var job = enqueue(invitationId);
      return deliverJob(job.getId());
    } catch (JobStoreUnavailableException e) {
      log.warn("Immediate invite send skipped for invitation {}: {}", invitationId, e.getMessage());
      return false;
    } catch (RuntimeException e) {
      log.error("Immediate invite send failed for invitation {}", invitationId, e);
      return false;
    }
  }

  /**
   * Claims and attempts a single pending job regardless of its retry delay. If the job cannot be
   * claimed, reports whether it is already sent.
   */
  public boolean deliverJob(UUID jobId) {
    var claimed = claim(jobId);
    if (claimed.isEmpty()) {
      return isSent(jobId);
    }
    var updated = attempt(claimed.get());
    if (updated.isEmpty()) {
      return isSent(jobId);
    }
    return updated.get().getStatus() == InviteDeliveryStatus.SENT;
  }

  private boolean isSent(UUID jobId) {
    return store
        .get(jobId)
        .map(current -> current.getStatus() == InviteDeliveryStatus.SENT)
        .orElse(false);
  }

  /** Claims a pending job and re-reads it, so the attempt count belongs to this claim. */
  private Optional<InviteDeliveryJob> claim(UUID jobId) {
    boolean claimed =
        store.tryClaim(
            jobId, InviteDeliveryStatus.PENDING, InviteDeliveryStatus.PROCESSING, clock.instant());
    if (!claimed) {
      return Optional.empty();
    }
    return store.get(jobId).filter(job -> job.getStatus() == InviteDeliveryStatus.PROCESSING);
  }

  private void recoverAbandoned(Instant now) {
    int recovered = store.recoverAbandoned(now.minus(settings.staleAfter()), now);
    if (recovered > 0) {
      log.warn(
          "Returned {} invite delivery jobs to pending after processing longer than {}",
          recovered,
          settings.staleAfter());
    }
  }

  /**
   * Attempts delivery of a claimed job and records the outcome. Empty when the claim was lost to
   * stale recovery in the meantime; the late outcome is then dropped.
   */
  private Optional<InviteDeliveryJob> attempt(InviteDeliveryJob job) {
    int claimedAttempts = job.getAttempts();
    InviteDeliveryOutcome outcome;
    try {
      var email = composer.compose(job.getInvitationId(), clock.instant());
      SendResult result = send(email);
      if (result.success()) {
        outcome = new InviteDeliveryOutcome.Sent(clock.instant());
      } else {
        outcome = failure(claimedAttempts, result.errorMessage());
      }
    } catch (UndeliverableInvitationException e) {
      outcome = new InviteDeliveryOutcome.Exhausted(e.getMessage(), clock.instant());
    } catch (RuntimeException e) {
      log.warn("Could not prepare invitation email for job {}", job.getId(), e);
      outcome = failure(claimedAttempts, describe(e));
    }

    var recorded = store.recordOutcome(job.getId(), claimedAttempts, outcome);
    if (recorded.isEmpty()) {
      log.warn(
          "Dropped outcome of invite delivery job {}: claim was released before it finished",
          job.getId());
      return recorded;
    }
    var updated = recorded.get();
    if (outcome instanceof InviteDeliveryOutcome.Retry retry) {
      log.warn(
          "Invite delivery job {} failed (attempt {}), retrying at {}: {}",
          job.getId(),
          updated.getAttempts(),
          retry.nextAttemptAt(),
          retry.error());
    } else if (outcome instanceof InviteDeliveryOutcome.Exhausted exhausted) {
      log.error(
          "Invite delivery job {} failed permanently after {} attempts: {}",
          job.getId(),
          updated.getAttempts(),
          exhausted.error());
    } else {
      log.info(
          "Invitation {} delivered (job {}, attempt {})",
          job.getInvitationId(),
          job.getId(),
          updated.getAttempts());
    }
    return recorded;
  }

  private SendResult send(InviteEmail email) {
    try {
      return emailSender.send(email.to(), InviteEmailComposer.TEMPLATE, email.data());
    } catch (RuntimeException e) {
      return SendResult.failure(describe(e));
    }
  }

  private static String describe(RuntimeException e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }

  private InviteDeliveryOutcome failure(int claimedAttempts, String error) {
    Instant now = clock.instant();
    String message = error != null && !error.isBlank() ? error : "email delivery failed";
    int attempts = claimedAttempts + 1;
    if (attempts >= settings.maxAttempts()) {
      return new InviteDeliveryOutcome.Exhausted(message, now);
    }
    Instant nextAttemptAt = now.plus(backoffPolicy.delayFor(attempts));
    return new InviteDeliveryOutcome.Retry(message, nextAttemptAt, now);
  }
}
