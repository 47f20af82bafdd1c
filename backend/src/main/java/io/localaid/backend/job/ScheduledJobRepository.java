package io.localaid.backend.job;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ScheduledJobRepository extends JpaRepository<ScheduledJob, UUID> {

  @Query(
      """
      SELECT j FROM ScheduledJob j
      WHERE j.status = :status AND j.runAt <= :now
      ORDER BY j.runAt ASC, j.createdAt ASC
      """)
  List<ScheduledJob> findDue(
      @Param("status") ScheduledJobStatus status, @Param("now") Instant now, Pageable pageable);

  /** Locks the job if it is still running under the claim that saw {@code attempts}. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query(
      """
      SELECT j FROM ScheduledJob j
      WHERE j.id = :id
        AND j.status = io.localaid.backend.job.ScheduledJobStatus.RUNNING
        AND j.attempts = :attempts
      """)
  Optional<ScheduledJob> findClaimedForUpdate(
      @Param("id") UUID id, @Param("attempts") int attempts);

  Page<ScheduledJob> findByStatus(ScheduledJobStatus status, Pageable pageable);

  Page<ScheduledJob> findByTypeIgnoreCase(String type, Pageable pageable);

  Page<ScheduledJob> findByStatusAndTypeIgnoreCase(
      ScheduledJobStatus status, String type, Pageable pageable);

  /** Conditional status transition; returns 1 when the row was still in {@code expected}. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE ScheduledJob j SET j.status = :next, j.updatedAt = :now
      WHERE j.id = :id AND j.status = :expected
      """)
  int transition(
      @Param("id") UUID id,
      @Param("expected") ScheduledJobStatus expected,
      @Param("next") ScheduledJobStatus next,
      @Param("now") Instant now);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE ScheduledJob j
      SET j.status = io.localaid.backend.job.ScheduledJobStatus.FAILED,
          j.attempts = j.attempts + 1,
          j.lastError = :error,
          j.lastRunAt = j.updatedAt,
          j.updatedAt = :now
      WHERE j.status = io.localaid.backend.job.ScheduledJobStatus.RUNNING
        AND j.updatedAt < :staleBefore
      """)
  int failAbandoned(
      @Param("staleBefore") Instant staleBefore,
      @Param("error") String error,
      @Param("now") Instant now);

  @Query("SELECT j.status AS status, COUNT(j) AS total FROM ScheduledJob j GROUP BY j.status")
  List<StatusCount> countByStatus();

  interface StatusCount {
    ScheduledJobStatus getStatus();

    long getTotal();
  }
}
