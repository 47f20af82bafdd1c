package io.localaid.backend.job.handler;

import io.localaid.backend.notification.NotificationService;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Creates a {@code REMINDER} notification for the user named in the payload. */
@Component
public class ReminderJobHandler implements JobHandler<ReminderPayload> {

  private static final Logger log = LoggerFactory.getLogger(ReminderJobHandler.class);

  public static final String TYPE = "reminder";
  static final String NOTIFICATION_TYPE = "REMINDER";

  private final NotificationService notificationService;

  public ReminderJobHandler(NotificationService notificationService) {
    this.notificationService = notificationService;
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public ReminderPayload parsePayload(String type, Map<String, Object> raw) {
    var userId = PayloadFields.requiredId(type, raw, "userId");
    var message = PayloadFields.requiredString(type, raw, "message");
    var title = PayloadFields.optionalString(type, raw, "title");
    return new ReminderPayload(
        userId, message, title != null ? title : ReminderPayload.DEFAULT_TITLE);
  }

  @Override
  public void handle(ReminderPayload payload) {
    notificationService.createNotification(
        payload.userId(),
        NOTIFICATION_TYPE,
        payload.title(),
        payload.message(),
        null,
        null,
        Map.of("message", payload.message()));
    log.debug("Reminder delivered to user {}", payload.userId());
  }
}
