package io.localaid.backend.job;

public enum ScheduledJobStatus {
  SCHEDULED,
  RUNNING,
  COMPLETED,
  FAILED
}
