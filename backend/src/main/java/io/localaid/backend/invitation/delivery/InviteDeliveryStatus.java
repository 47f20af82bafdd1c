package io.localaid.backend.invitation.delivery;

public enum InviteDeliveryStatus {
  PENDING,
  PROCESSING,
  SENT,
  FAILED
}
