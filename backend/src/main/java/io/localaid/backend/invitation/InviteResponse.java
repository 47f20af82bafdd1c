package io.localaid.backend.invitation;

import java.time.Instant;
import java.util.UUID;

/** Created invitation plus whether its email went out on the immediate attempt. */
public record InviteResponse(
    UUID id,
    UUID organizationId,
    String email,
    String role,
    InvitationStatus status,
    Instant expiresAt,
    Instant createdAt,
    boolean emailSent) {

  public static InviteResponse from(OrganizationInvite invite, boolean emailSent) {
    return new InviteResponse(
        invite.getId(),
        invite.getOrganizationId(),
        invite.getEmail(),
        invite.getRole(),
        invite.getStatus(),
        invite.getExpiresAt(),
        invite.getCreatedAt(),
        emailSent);
  }
}
