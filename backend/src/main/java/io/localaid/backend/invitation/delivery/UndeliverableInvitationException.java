package io.localaid.backend.invitation.delivery;

/** The invitation behind a delivery job can no longer be sent; retrying will not help. */
public class UndeliverableInvitationException extends RuntimeException {

  public UndeliverableInvitationException(String message) {
    super(message);
  }
}
