package io.localaid.backend.invitation.delivery;

import io.localaid.backend.invitation.OrganizationInviteRepository;
import io.localaid.backend.organization.Organization;
import io.localaid.backend.organization.OrganizationRepository;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Locale;
import java.util.UUID;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

/** Resolves an invitation into the recipient address and variables of the invite template. */
@Component
public class InviteEmailComposer {

  public static final String TEMPLATE = "organization-invite";

  private static final DateTimeFormatter EXPIRY_FORMAT =
      DateTimeFormatter.ofPattern("d MMMM yyyy").withZone(ZoneOffset.UTC);

  private final OrganizationInviteRepository inviteRepository;
  private final OrganizationRepository organizationRepository;
  private final String acceptUrl;

  public InviteEmailComposer(
      OrganizationInviteRepository inviteRepository,
      OrganizationRepository organizationRepository,
      @Value("${localaid.invites.accept-url}") String acceptUrl) {
    this.inviteRepository = inviteRepository;
    this.organizationRepository = organizationRepository;
    this.acceptUrl = acceptUrl;
  }

  /**
   * @throws UndeliverableInvitationException if the invitation is gone, no longer pending, or
   *     expired
   */
  public InviteEmail compose(UUID invitationId, Instant now) {
    var invite =
        inviteRepository
            .findById(invitationId)
            .orElseThrow(
                () ->
                    new UndeliverableInvitationException(
                        "invitation " + invitationId + " no longer exists"));
    if (!invite.isDeliverable(now)) {
      String reason =
          now.isBefore(invite.getExpiresAt())
              ? "invitation is " + invite.getStatus().name().toLowerCase(Locale.ROOT)
              : "invitation expired at " + invite.getExpiresAt();
      throw new UndeliverableInvitationException(reason);
    }

    String organizationName =
        organizationRepository
            .findById(invite.getOrganizationId())
            .map(Organization::getName)
            .orElse("LocalAid");

    var data = new HashMap<String, Object>();
    data.put("subject", "You were invited to join " + organizationName);
    data.put("organizationName", organizationName);
    data.put(
        "recipientName", invite.getFirstName() != null ? invite.getFirstName() : invite.getEmail());
    data.put("role", invite.getRole());
    data.put("invitedBy", invite.getInvitedBy());
    data.put("message", invite.getMessage());
    data.put("expiresAt", EXPIRY_FORMAT.format(invite.getExpiresAt()));
    data.put(
        "acceptUrl",
        UriComponentsBuilder.fromUriString(acceptUrl)
            .queryParam("token", invite.getToken())
            .toUriString());
    return new InviteEmail(invite.getEmail(), data);
  }
}
