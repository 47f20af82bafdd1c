package io.localaid.backend.invitation;

/** Lifecycle of an organization invitation, independent of its email delivery. */
public enum InvitationStatus {
  PENDING,
  ACCEPTED,
  REJECTED,
  CANCELLED
}
