package io.localaid.backend.integration.email;

import java.util.Map;
import java.util.Objects;

/**
 * Provider-agnostic email payload. Contains the recipient, subject, body (HTML and plain text), and
 * optional metadata for tracking.
 */
public record EmailMessage(
    String to,
    String subject,
    String htmlBody,
    String plainTextBody,
    String replyTo,
    Map<String, String> metadata) {

  public EmailMessage {
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(subject, "subject");
  }
}
