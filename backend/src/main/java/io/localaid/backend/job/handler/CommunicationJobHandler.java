package io.localaid.backend.job.handler;

import io.localaid.backend.communication.CommunicationService;
import io.localaid.backend.communication.CommunicationStatus;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Turns a scheduled job into a {@code Communication} row for the communication sender. */
@Component
public class CommunicationJobHandler implements JobHandler<CommunicationPayload> {

  private static final Logger log = LoggerFactory.getLogger(CommunicationJobHandler.class);

  public static final String TYPE = "communication";

  private final CommunicationService communicationService;
  private final Clock clock;

  public CommunicationJobHandler(CommunicationService communicationService, Clock clock) {
    this.communicationService = communicationService;
    this.clock = clock;
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public CommunicationPayload parsePayload(String type, Map<String, Object> raw) {
    String subject = PayloadFields.requiredString(type, raw, "subject");
    String content = PayloadFields.optionalString(type, raw, "content");
    if (content == null) {
      content = PayloadFields.optionalString(type, raw, "message");
    }
    String channel = PayloadFields.optionalString(type, raw, "type");
    channel = channel != null ? channel.trim().toUpperCase(Locale.ROOT) : null;
    String audience = PayloadFields.optionalString(type, raw, "targetAudience");
    if (audience == null) {
      audience = PayloadFields.optionalString(type, raw, "target_audience");
    }
    return new CommunicationPayload(
        subject,
        content != null ? content : "",
        channel != null ? channel : CommunicationPayload.DEFAULT_TYPE,
        parseStatus(type, PayloadFields.optionalString(type, raw, "status")),
        PayloadFields.optionalInstant(type, raw, "sendAt"),
        audience);
  }

  private static CommunicationStatus parseStatus(String type, String value) {
    if (value == null) {
      return CommunicationStatus.SCHEDULED;
    }
    try {
      return CommunicationStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new InvalidJobPayloadException(
          type, "status must be one of " + Arrays.toString(CommunicationStatus.values()));
    }
  }

  @Override
  public void handle(CommunicationPayload payload) {
    Instant sendAt = payload.sendAt() != null ? payload.sendAt() : clock.instant();
    var communication =
        communicationService.createCommunication(
            payload.subject(),
            payload.content(),
            payload.type(),
            payload.status(),
            sendAt,
            payload.targetAudience());
    log.debug("Scheduled communication {} for {}", communication.getId(), sendAt);
  }
}
