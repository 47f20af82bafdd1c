package io.localaid.backend.invitation;

import jakarta.validation.Valid;
import java.net.URI;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/organizations/{orgId}/invites")
public class OrganizationInviteController {

  private final InvitationService invitationService;

  public OrganizationInviteController(InvitationService invitationService) {
    this.invitationService = invitationService;
  }

  @PostMapping
  @PreAuthorize("hasAnyRole('ADMIN', 'ORGANIZER')")
  public ResponseEntity<InviteResponse> createInvite(
      @PathVariable UUID orgId,
      @Valid @RequestBody CreateInviteRequest request,
      @AuthenticationPrincipal Jwt jwt) {
    var invite = invitationService.createInvite(orgId, request, jwt.getSubject());
    return ResponseEntity.created(
            URI.create("/api/organizations/" + orgId + "/invites/" + invite.id()))
        .body(invite);
  }
}
