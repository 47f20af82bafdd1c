package io.localaid.backend.invitation.delivery;

import io.localaid.backend.invitation.InvitationStatus;
import java.time.Instant;
import java.util.UUID;

/** Admin view of a delivery job with a summary of its invitation (null if it was deleted). */
public record InviteDeliveryJobResponse(
    UUID id,
    UUID invitationId,
    InviteDeliveryStatus status,
    int attempts,
    Instant nextAttemptAt,
    String lastError,
    Instant lastAttemptAt,
    Instant sentAt,
    Instant createdAt,
    Instant updatedAt,
    InvitationSummary invitation) {

  public record InvitationSummary(
      UUID id,
      String email,
      UUID organizationId,
      String organizationName,
      InvitationStatus status) {}

  public static InviteDeliveryJobResponse from(
      InviteDeliveryJob job, InvitationSummary invitation) {
    return new InviteDeliveryJobResponse(
        job.getId(),
        job.getInvitationId(),
        job.getStatus(),
        job.getAttempts(),
        job.getNextAttemptAt(),
        job.getLastError(),
        job.getLastAttemptAt(),
        job.getSentAt(),
        job.getCreatedAt(),
        job.getUpdatedAt(),
        invitation);
  }
}
