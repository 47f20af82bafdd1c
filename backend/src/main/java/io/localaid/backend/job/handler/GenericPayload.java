package io.localaid.backend.job.handler;

import java.util.Map;

/** Untyped payload for handlers that serve a family of job types (e.g. {@code import:*}). */
public record GenericPayload(String type, Map<String, Object> values) implements JobPayload {

  public GenericPayload {
    values = values != null ? Map.copyOf(values) : Map.of();
  }
}
