package io.localaid.backend.job;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Deferred unit of work executed by {@link ScheduledJobRunner}. Rows are kept after completion as
 * an audit trail.
 */
@Entity
@Table(name = "scheduled_jobs")
public class ScheduledJob {

  private static final int MAX_ERROR_LENGTH = 2000;

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "type", nullable = false, length = 100)
  private String type;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "payload", columnDefinition = "jsonb")
  private Map<String, Object> payload;

  @Column(name = "run_at", nullable = false)
  private Instant runAt;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ScheduledJobStatus status;

  @Column(name = "attempts", nullable = false)
  private int attempts;

  @Column(name = "last_error", columnDefinition = "TEXT")
  private String lastError;

  @Column(name = "last_run_at")
  private Instant lastRunAt;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ScheduledJob() {}

  public ScheduledJob(String name, String type, Map<String, Object> payload, Instant runAt) {
    this.name = name;
    this.type = type;
    this.payload = payload != null ? new HashMap<>(payload) : new HashMap<>();
    this.runAt = runAt;
    this.status = ScheduledJobStatus.SCHEDULED;
    this.attempts = 0;
  }

  @PrePersist
  void onCreate() {
    Instant now = Instant.now();
    if (createdAt == null) {
      createdAt = now;
    }
    updatedAt = now;
  }

  @PreUpdate
  void onUpdate() {
    this.updatedAt = Instant.now();
  }

  /** Moves the job to {@code next}; callers are responsible for checking the expected status. */
  void transitionTo(ScheduledJobStatus next, Instant at) {
    this.status = next;
    this.updatedAt = at;
  }

  void apply(ScheduledJobOutcome outcome) {
    if (outcome instanceof ScheduledJobOutcome.Failed failed) {
      recordFailure(failed.error(), failed.finishedAt());
    } else {
      recordSuccess(outcome.finishedAt());
    }
  }

  private void recordSuccess(Instant at) {
    this.status = ScheduledJobStatus.COMPLETED;
    this.attempts++;
    this.lastError = null;
    this.lastRunAt = at;
    this.completedAt = at;
    this.updatedAt = at;
  }

  private void recordFailure(String error, Instant at) {
    this.status = ScheduledJobStatus.FAILED;
    this.attempts++;
    this.lastError = truncate(error);
    this.lastRunAt = at;
    this.completedAt = null;
    this.updatedAt = at;
  }

  private static String truncate(String error) {
    if (error == null) {
      return null;
    }
    return error.length() > MAX_ERROR_LENGTH ? error.substring(0, MAX_ERROR_LENGTH) : error;
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getType() {
    return type;
  }

  public Map<String, Object> getPayload() {
    return payload;
  }

  public Instant getRunAt() {
    return runAt;
  }

  public ScheduledJobStatus getStatus() {
    return status;
  }

  public int getAttempts() {
    return attempts;
  }

  public String getLastError() {
    return lastError;
  }

  public Instant getLastRunAt() {
    return lastRunAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
