package io.localaid.backend.audit;

/** Records operator actions against the job subsystem. */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is also rolled back.
   */
  void log(AuditEventRecord record);
}
