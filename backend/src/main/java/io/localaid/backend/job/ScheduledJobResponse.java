package io.localaid.backend.job;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record ScheduledJobResponse(
    UUID id,
    String name,
    String type,
    Map<String, Object> payload,
    Instant runAt,
    ScheduledJobStatus status,
    int attempts,
    String lastError,
    Instant lastRunAt,
    Instant completedAt,
    Instant createdAt,
    Instant updatedAt) {

  public static ScheduledJobResponse from(ScheduledJob job) {
    return new ScheduledJobResponse(
        job.getId(),
        job.getName(),
        job.getType(),
        job.getPayload(),
        job.getRunAt(),
        job.getStatus(),
        job.getAttempts(),
        job.getLastError(),
        job.getLastRunAt(),
        job.getCompletedAt(),
        job.getCreatedAt(),
        job.getUpdatedAt());
  }
}
