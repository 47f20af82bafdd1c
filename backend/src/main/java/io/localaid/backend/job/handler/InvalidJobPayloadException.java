package io.localaid.backend.job.handler;

/** A stored payload that does not match the shape its handler expects. */
public class InvalidJobPayloadException extends RuntimeException {

  private final String type;

  public InvalidJobPayloadException(String type, String reason) {
    super("invalid payload for type " + type + ": " + reason);
    this.type = type;
  }

  public String getType() {
    return type;
  }
}
