package io.localaid.backend.job.handler;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;

/** Field extraction helpers shared by payload parsers. */
final class PayloadFields {

  private PayloadFields() {}

  static String optionalString(String type, Map<String, Object> raw, String field) {
    Object value = raw.get(field);
    if (value == null) {
      return null;
    }
    if (!(value instanceof String s)) {
      throw new InvalidJobPayloadException(type, field + " must be a string");
    }
    return s.isBlank() ? null : s;
  }

  static String requiredString(String type, Map<String, Object> raw, String field) {
    String value = optionalString(type, raw, field);
    if (value == null) {
      throw new InvalidJobPayloadException(type, field + " is required");
    }
    return value;
  }

  /** Opaque identifier given as a non-blank string or an integer; returned in string form. */
  static String requiredId(String type, Map<String, Object> raw, String field) {
    Object value = raw.get(field);
    if (value instanceof Integer || value instanceof Long || value instanceof Short) {
      return value.toString();
    }
    if (value != null && !(value instanceof String)) {
      throw new InvalidJobPayloadException(type, field + " must be a string or an integer");
    }
    return requiredString(type, raw, field).trim();
  }

  static Integer optionalInt(String type, Map<String, Object> raw, String field) {
    Object value = raw.get(field);
    if (value == null) {
      return null;
    }
    if (value instanceof Integer || value instanceof Long || value instanceof Short) {
      return ((Number) value).intValue();
    }
    if (value instanceof String s) {
      try {
        return Integer.parseInt(s.trim());
      } catch (NumberFormatException e) {
        throw new InvalidJobPayloadException(type, field + " must be an integer");
      }
    }
    throw new InvalidJobPayloadException(type, field + " must be an integer");
  }

  /** ISO-8601 instant such as {@code 2026-05-01T09:00:00Z}. */
  static Instant optionalInstant(String type, Map<String, Object> raw, String field) {
    String value = optionalString(type, raw, field);
    if (value == null) {
      return null;
    }
    try {
      return Instant.parse(value.trim());
    } catch (DateTimeParseException e) {
      throw new InvalidJobPayloadException(type, field + " must be an ISO-8601 instant");
    }
  }
}
