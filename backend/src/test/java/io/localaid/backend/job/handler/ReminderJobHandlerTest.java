package io.localaid.backend.job.handler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;

import io.localaid.backend.notification.NotificationService;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ReminderJobHandlerTest {

  private static final String USER_ID = UUID.randomUUID().toString();

  @Mock private NotificationService notificationService;

  private ReminderJobHandler handler;

  @BeforeEach
  void setUp() {
    handler = new ReminderJobHandler(notificationService);
  }

  @Test
  void parsePayload_defaults_title() {
    var payload =
        handler.parsePayload("reminder", Map.of("userId", USER_ID, "message", "Hi"));

    assertThat(payload).isEqualTo(new ReminderPayload(USER_ID, "Hi", "Reminder"));
  }

  @Test
  void parsePayload_keeps_custom_title() {
    var payload =
        handler.parsePayload(
            "reminder",
            Map.of("userId", USER_ID, "message", "Bring gloves", "title", "Cleanup"));

    assertThat(payload.title()).isEqualTo("Cleanup");
  }

  @Test
  void parsePayload_rejects_missing_message() {
    assertThatThrownBy(
            () -> handler.parsePayload("reminder", Map.of("userId", USER_ID)))
        .isInstanceOf(InvalidJobPayloadException.class)
        .hasMessage("invalid payload for type reminder: message is required");
  }

  @Test
  void parsePayload_rejects_blank_message() {
    assertThatThrownBy(
            () ->
                handler.parsePayload(
                    "reminder", Map.of("userId", USER_ID, "message", "  ")))
        .isInstanceOf(InvalidJobPayloadException.class)
        .hasMessageContaining("message is required");
  }

  @Test
  void parsePayload_accepts_numeric_user_id() {
    var payload = handler.parsePayload("reminder", Map.of("userId", 7, "message", "Hi"));

    assertThat(payload).isEqualTo(new ReminderPayload("7", "Hi", "Reminder"));
  }

  @Test
  void parsePayload_rejects_user_id_that_is_not_a_scalar() {
    assertThatThrownBy(
            () ->
                handler.parsePayload(
                    "reminder", Map.of("userId", Map.of("id", 7), "message", "Hi")))
        .isInstanceOf(InvalidJobPayloadException.class)
        .hasMessage("invalid payload for type reminder: userId must be a string or an integer");
  }

  @Test
  void handle_creates_reminder_notification() {
    handler.handle(new ReminderPayload(USER_ID, "Hi", "Reminder"));

    verify(notificationService)
        .createNotification(
            USER_ID, "REMINDER", "Reminder", "Hi", null, null, Map.of("message", "Hi"));
  }
}
