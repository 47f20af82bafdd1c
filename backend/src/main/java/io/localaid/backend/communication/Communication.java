package io.localaid.backend.communication;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** An outbound message to an audience, picked up by the communication sender at {@code sendAt}. */
@Entity
@Table(name = "communications")
public class Communication {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "subject", nullable = false, length = 500)
  private String subject;

  @Column(name = "content", columnDefinition = "TEXT")
  private String content;

  @Column(name = "type", nullable = false, length = 30)
  private String type;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private CommunicationStatus status;

  @Column(name = "send_at", nullable = false)
  private Instant sendAt;

  @Column(name = "target_audience", columnDefinition = "TEXT")
  private String targetAudience;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Communication() {}

  public Communication(
      String subject,
      String content,
      String type,
      CommunicationStatus status,
      Instant sendAt,
      String targetAudience) {
    this.subject = subject;
    this.content = content;
    this.type = type;
    this.status = status;
    this.sendAt = sendAt;
    this.targetAudience = targetAudience;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getSubject() {
    return subject;
  }

  public String getContent() {
    return content;
  }

  public String getType() {
    return type;
  }

  public CommunicationStatus getStatus() {
    return status;
  }

  public Instant getSendAt() {
    return sendAt;
  }

  public String getTargetAudience() {
    return targetAudience;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
