package io.localaid.backend.integration.email;

/** Port for sending emails via an external provider (SMTP, no-op, ...). */
public interface EmailProvider {

  /** Provider identifier (e.g., "smtp", "noop"). */
  String providerId();

  /**
   * Send an email message. Ordinary delivery problems are reported through an unsuccessful {@link
   * SendResult}; implementations may still throw for programming errors.
   */
  SendResult sendEmail(EmailMessage message);
}
