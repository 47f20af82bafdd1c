package io.localaid.backend.invitation;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "organization_invites")
public class OrganizationInvite {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "organization_id", nullable = false)
  private UUID organizationId;

  @Column(name = "invited_by", length = 200)
  private String invitedBy;

  @Column(name = "email", nullable = false, length = 320)
  private String email;

  @Column(name = "first_name", length = 100)
  private String firstName;

  @Column(name = "last_name", length = 100)
  private String lastName;

  @Column(name = "role", nullable = false, length = 30)
  private String role;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private InvitationStatus status;

  @Column(name = "token", nullable = false, unique = true, length = 64)
  private String token;

  @Column(name = "message", columnDefinition = "TEXT")
  private String message;

  @Column(name = "expires_at", nullable = false)
  private Instant expiresAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected OrganizationInvite() {}

  public OrganizationInvite(
      UUID organizationId,
      String invitedBy,
      String email,
      String firstName,
      String lastName,
      String role,
      String token,
      String message,
      Instant expiresAt) {
    this.organizationId = organizationId;
    this.invitedBy = invitedBy;
    this.email = email;
    this.firstName = firstName;
    this.lastName = lastName;
    this.role = role;
    this.token = token;
    this.message = message;
    this.expiresAt = expiresAt;
    this.status = InvitationStatus.PENDING;
  }

  @PrePersist
  void onPrePersist() {
    var now = Instant.now();
    this.createdAt = now;
    this.updatedAt = now;
  }

  @PreUpdate
  void onPreUpdate() {
    this.updatedAt = Instant.now();
  }

  /** Whether the invitation can still be accepted, and is therefore worth emailing. */
  public boolean isDeliverable(Instant now) {
    return status == InvitationStatus.PENDING && now.isBefore(expiresAt);
  }

  public void cancel() {
    this.status = InvitationStatus.CANCELLED;
  }

  public UUID getId() {
    return id;
  }

  public UUID getOrganizationId() {
    return organizationId;
  }

  public String getInvitedBy() {
    return invitedBy;
  }

  public String getEmail() {
    return email;
  }

  public String getFirstName() {
    return firstName;
  }

  public String getLastName() {
    return lastName;
  }

  public String getRole() {
    return role;
  }

  public InvitationStatus getStatus() {
    return status;
  }

  public String getToken() {
    return token;
  }

  public String getMessage() {
    return message;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
