package io.localaid.backend.integration.email;

/** Outcome of a single provider hand-off. */
public record SendResult(boolean success, String providerMessageId, String errorMessage) {

  public static SendResult failure(String errorMessage) {
    return new SendResult(false, null, errorMessage);
  }
}
