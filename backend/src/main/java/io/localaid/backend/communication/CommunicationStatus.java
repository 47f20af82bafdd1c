package io.localaid.backend.communication;

public enum CommunicationStatus {
  DRAFT,
  SCHEDULED,
  SENT
}
