package io.localaid.backend.compliance;

public enum ComplianceDocumentStatus {
  PENDING,
  APPROVED,
  REJECTED,
  EXPIRED
}
