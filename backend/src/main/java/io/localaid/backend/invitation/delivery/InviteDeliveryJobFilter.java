package io.localaid.backend.invitation.delivery;

import java.time.Instant;
import java.util.UUID;

/**
 * Admin listing filter. All fields are optional.
 *
 * @param idTerm matches the job id or the invitation id
 * @param emailTerm case-insensitive substring of the invitee email
 */
public record InviteDeliveryJobFilter(
    InviteDeliveryStatus status,
    UUID invitationId,
    UUID idTerm,
    String emailTerm,
    Instant from,
    Instant to) {

  public static InviteDeliveryJobFilter none() {
    return new InviteDeliveryJobFilter(null, null, null, null, null, null);
  }
}
