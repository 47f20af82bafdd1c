package io.localaid.backend.job.handler;

public record ReminderPayload(String userId, String message, String title) implements JobPayload {

  static final String DEFAULT_TITLE = "Reminder";
}
