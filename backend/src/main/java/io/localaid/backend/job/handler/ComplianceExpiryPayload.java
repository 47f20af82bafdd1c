package io.localaid.backend.job.handler;

/**
 * Sweep parameters: notify owners of documents expiring within {@code withinDays}, optionally only
 * for one {@code docType}.
 */
public record ComplianceExpiryPayload(int withinDays, String docType) implements JobPayload {

  static final int DEFAULT_WITHIN_DAYS = 30;
  static final int MAX_WITHIN_DAYS = 365;
}
