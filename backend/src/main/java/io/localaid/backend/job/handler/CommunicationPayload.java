package io.localaid.backend.job.handler;

import io.localaid.backend.communication.CommunicationStatus;
import java.time.Instant;

/**
 * A communication to schedule. A {@code null} {@code sendAt} means "when the job runs"; {@code
 * targetAudience} is passed through unchanged to the sender.
 */
public record CommunicationPayload(
    String subject,
    String content,
    String type,
    CommunicationStatus status,
    Instant sendAt,
    String targetAudience)
    implements JobPayload {

  static final String DEFAULT_TYPE = "EMAIL";
}
