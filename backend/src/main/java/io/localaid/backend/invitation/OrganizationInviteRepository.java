package io.localaid.backend.invitation;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface OrganizationInviteRepository extends JpaRepository<OrganizationInvite, UUID> {

  boolean existsByOrganizationIdAndEmailIgnoreCaseAndStatus(
      UUID organizationId, String email, InvitationStatus status);
}
