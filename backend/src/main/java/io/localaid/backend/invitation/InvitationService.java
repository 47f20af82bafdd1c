package io.localaid.backend.invitation;

import io.localaid.backend.audit.AuditEventBuilder;
import io.localaid.backend.audit.AuditService;
import io.localaid.backend.exception.ResourceConflictException;
import io.localaid.backend.exception.ResourceNotFoundException;
import io.localaid.backend.invitation.delivery.InviteDeliveryQueue;
import io.localaid.backend.organization.OrganizationRepository;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Issues organization invitations. The invite row is committed before delivery starts, so the
 * delivery job and its composer always see it.
 */
@Service
public class InvitationService {

  private static final Logger log = LoggerFactory.getLogger(InvitationService.class);

  static final Duration INVITE_VALIDITY = Duration.ofDays(7);
  private static final int TOKEN_BYTES = 32;

  private final OrganizationInviteRepository inviteRepository;
  private final OrganizationRepository organizationRepository;
  private final InviteDeliveryQueue deliveryQueue;
  private final AuditService auditService;
  private final Clock clock;
  private final SecureRandom random = new SecureRandom();

  public InvitationService(
      OrganizationInviteRepository inviteRepository,
      OrganizationRepository organizationRepository,
      InviteDeliveryQueue deliveryQueue,
      AuditService auditService,
      Clock clock) {
    this.inviteRepository = inviteRepository;
    this.organizationRepository = organizationRepository;
    this.deliveryQueue = deliveryQueue;
    this.auditService = auditService;
    this.clock = clock;
  }

  public InviteResponse createInvite(
      UUID organizationId, CreateInviteRequest request, String invitedBy) {
    if (!organizationRepository.existsById(organizationId)) {
      throw new ResourceNotFoundException("Organization", organizationId);
    }
    String email = request.email().trim().toLowerCase(Locale.ROOT);
    if (inviteRepository.existsByOrganizationIdAndEmailIgnoreCaseAndStatus(
        organizationId, email, InvitationStatus.PENDING)) {
      throw new ResourceConflictException(
          "Invitation already pending", "A pending invitation already exists for " + email);
    }

    var invite =
        inviteRepository.save(
            new OrganizationInvite(
                organizationId,
                invitedBy,
                email,
                request.firstName(),
                request.lastName(),
                request.role(),
                generateToken(),
                request.message(),
                clock.instant().plus(INVITE_VALIDITY)));

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("organization_invite.created")
            .entityType("organization_invite")
            .entityId(invite.getId())
            .details(Map.of("organizationId", organizationId, "role", invite.getRole()))
            .build());

    deliveryQueue.enqueue(invite.getId());
    boolean sent = deliveryQueue.sendInviteNow(invite.getId());
    if (!sent) {
      log.info("Invitation {} queued for background delivery", invite.getId());
    }
    return InviteResponse.from(invite, sent);
  }

  private String generateToken() {
    byte[] bytes = new byte[TOKEN_BYTES];
    random.nextBytes(bytes);
    return HexFormat.of().formatHex(bytes);
  }
}
