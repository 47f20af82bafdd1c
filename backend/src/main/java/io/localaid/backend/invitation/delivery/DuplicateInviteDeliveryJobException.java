package io.localaid.backend.invitation.delivery;

import java.util.UUID;

/** A second delivery job was inserted for an invitation that already has one. */
public class DuplicateInviteDeliveryJobException extends RuntimeException {

  public DuplicateInviteDeliveryJobException(UUID invitationId, Throwable cause) {
    super("Invite delivery job already exists for invitation " + invitationId, cause);
  }
}
