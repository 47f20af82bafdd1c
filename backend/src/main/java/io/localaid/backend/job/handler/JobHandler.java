package io.localaid.backend.job.handler;

import java.util.Map;

/**
 * Executes scheduled jobs of one type. Implementations are Spring beans collected by {@link
 * JobHandlerRegistry}.
 *
 * @param <P> payload variant this handler accepts
 */
public interface JobHandler<P extends JobPayload> {

  /** Exact job type served by this handler, matched case-insensitively. */
  String type();

  /**
   * Whether this handler also serves {@code type} although it is not its exact {@link #type()}.
   * Used for families such as {@code import:csv}, {@code import:xlsx}.
   */
  default boolean supports(String type) {
    return false;
  }

  /**
   * Validates the stored payload map.
   *
   * @throws InvalidJobPayloadException if required fields are missing or malformed
   */
  P parsePayload(String type, Map<String, Object> raw);

  /** Performs the side effect. Any exception fails the job. */
  void handle(P payload);
}
