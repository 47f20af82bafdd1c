package io.localaid.backend.invitation.delivery;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** Delivery state of the invitation email for exactly one organization invite. */
@Entity
@Table(name = "invite_send_jobs")
public class InviteDeliveryJob {

  private static final int MAX_ERROR_LENGTH = 2000;

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "invitation_id", nullable = false, unique = true, updatable = false)
  private UUID invitationId;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private InviteDeliveryStatus status;

  @Column(name = "attempts", nullable = false)
  private int attempts;

  @Column(name = "next_attempt_at")
  private Instant nextAttemptAt;

  @Column(name = "last_error", columnDefinition = "TEXT")
  private String lastError;

  @Column(name = "last_attempt_at")
  private Instant lastAttemptAt;

  @Column(name = "sent_at")
  private Instant sentAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected InviteDeliveryJob() {}

  public InviteDeliveryJob(UUID invitationId) {
    this.invitationId = invitationId;
    this.status = InviteDeliveryStatus.PENDING;
    this.attempts = 0;
  }

  @PrePersist
  void onCreate() {
    Instant now = Instant.now();
    if (createdAt == null) {
      createdAt = now;
    }
    updatedAt = now;
  }

  @PreUpdate
  void onUpdate() {
    this.updatedAt = Instant.now();
  }

  /** Status change used by claims and operator requeues; the retry delay no longer applies. */
  void transitionTo(InviteDeliveryStatus next, Instant at) {
    this.status = next;
    this.nextAttemptAt = null;
    this.updatedAt = at;
  }

  void apply(InviteDeliveryOutcome outcome) {
    if (outcome instanceof InviteDeliveryOutcome.Retry retry) {
      recordRetry(retry.error(), retry.nextAttemptAt(), retry.attemptedAt());
    } else if (outcome instanceof InviteDeliveryOutcome.Exhausted exhausted) {
      recordExhausted(exhausted.error(), exhausted.attemptedAt());
    } else {
      recordSent(outcome.attemptedAt());
    }
  }

  private void recordSent(Instant at) {
    this.status = InviteDeliveryStatus.SENT;
    this.attempts++;
    this.lastError = null;
    this.nextAttemptAt = null;
    this.lastAttemptAt = at;
    this.sentAt = at;
    this.updatedAt = at;
  }

  private void recordRetry(String error, Instant nextAttemptAt, Instant at) {
    this.status = InviteDeliveryStatus.PENDING;
    this.attempts++;
    this.lastError = truncate(error);
    this.nextAttemptAt = nextAttemptAt;
    this.lastAttemptAt = at;
    this.updatedAt = at;
  }

  private void recordExhausted(String error, Instant at) {
    this.status = InviteDeliveryStatus.FAILED;
    this.attempts++;
    this.lastError = truncate(error);
    this.nextAttemptAt = null;
    this.lastAttemptAt = at;
    this.updatedAt = at;
  }

  private static String truncate(String error) {
    if (error == null) {
      return null;
    }
    return error.length() > MAX_ERROR_LENGTH ? error.substring(0, MAX_ERROR_LENGTH) : error;
  }

  public UUID getId() {
    return id;
  }

  public UUID getInvitationId() {
    return invitationId;
  }

  public InviteDeliveryStatus getStatus() {
    return status;
  }

  public int getAttempts() {
    return attempts;
  }

  public Instant getNextAttemptAt() {
    return nextAttemptAt;
  }

  public String getLastError() {
    return lastError;
  }

  public Instant getLastAttemptAt() {
    return lastAttemptAt;
  }

  public Instant getSentAt() {
    return sentAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
