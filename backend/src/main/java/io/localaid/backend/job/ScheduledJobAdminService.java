package io.localaid.backend.job;

import io.localaid.backend.audit.AuditEventBuilder;
import io.localaid.backend.audit.AuditService;
import io.localaid.backend.exception.InvalidStateException;
import io.localaid.backend.exception.ResourceConflictException;
import io.localaid.backend.exception.ResourceNotFoundException;
import io.localaid.backend.job.handler.InvalidJobPayloadException;
import io.localaid.backend.job.handler.JobHandlerRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

/** Operator actions on scheduled jobs: listing, scheduling, retrying, and counts. */
@Service
public class ScheduledJobAdminService {

  private static final Logger log = LoggerFactory.getLogger(ScheduledJobAdminService.class);

  private final ScheduledJobStore store;
  private final JobHandlerRegistry handlerRegistry;
  private final AuditService auditService;
  private final Clock clock;

  public ScheduledJobAdminService(
      ScheduledJobStore store,
      JobHandlerRegistry handlerRegistry,
      AuditService auditService,
      Clock clock) {
    this.store = store;
    this.handlerRegistry = handlerRegistry;
    this.auditService = auditService;
    this.clock = clock;
  }

  public Page<ScheduledJobResponse> listJobs(
      ScheduledJobStatus status, String type, Pageable pageable) {
    String normalizedType = type != null && !type.isBlank() ? type.trim() : null;
    return store.list(status, normalizedType, pageable).map(ScheduledJobResponse::from);
  }

  public ScheduledJobResponse getJob(UUID id) {
    return ScheduledJobResponse.from(findOrThrow(id));
  }

  /**
   * Schedules a new job. The type must have a registered handler and the payload must pass that
   * handler's validation, so operators cannot queue jobs that are bound to fail.
   */
  public ScheduledJobResponse createJob(CreateScheduledJobRequest request) {
    var handler =
        handlerRegistry
            .find(request.type())
            .orElseThrow(
                () ->
                    new InvalidStateException(
                        "Unknown job type", "No handler is registered for type " + request.type()));
    Map<String, Object> payload = request.payload() != null ? request.payload() : Map.of();
    try {
      handler.parsePayload(request.type(), payload);
    } catch (InvalidJobPayloadException e) {
      throw new InvalidStateException("Invalid job payload", e.getMessage());
    }
    Instant runAt = request.runAt() != null ? request.runAt() : clock.instant();
    var job = store.insert(new ScheduledJob(request.name(), request.type(), payload, runAt));
    log.info("Scheduled job {} of type {} for {}", job.getId(), job.getType(), runAt);
    return ScheduledJobResponse.from(job);
  }

  /**
   * Moves a failed job back to {@code SCHEDULED}. The attempt counter is kept, and since {@code
   * runAt} is already past the job is picked up by the next tick.
   */
  public ScheduledJobResponse retryJob(UUID id) {
    var job = findOrThrow(id);
    if (job.getStatus() != ScheduledJobStatus.FAILED) {
      throw new InvalidStateException(
          "Job not retryable", "Only failed jobs can be retried; job is " + job.getStatus());
    }
    boolean requeued =
        store.tryClaim(
            id, ScheduledJobStatus.FAILED, ScheduledJobStatus.SCHEDULED, clock.instant());
    if (!requeued) {
      throw new ResourceConflictException(
          "Job changed concurrently", "Scheduled job " + id + " is no longer failed");
    }
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("scheduled_job.retried")
            .entityType("scheduled_job")
            .entityId(id)
            .details(Map.of("type", job.getType(), "attempts", job.getAttempts()))
            .build());
    log.info("Scheduled job {} requeued by operator after {} attempts", id, job.getAttempts());
    return ScheduledJobResponse.from(findOrThrow(id));
  }

  public ScheduledJobStats getStats() {
    var byStatus = store.countByStatus();
    long total = byStatus.values().stream().mapToLong(Long::longValue).sum();
    return new ScheduledJobStats(total, byStatus);
  }

  private ScheduledJob findOrThrow(UUID id) {
    return store.get(id).orElseThrow(() -> new ResourceNotFoundException("ScheduledJob", id));
  }
}
