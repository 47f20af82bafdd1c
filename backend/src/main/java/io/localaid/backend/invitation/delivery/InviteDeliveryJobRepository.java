package io.localaid.backend.invitation.delivery;

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

public interface InviteDeliveryJobRepository extends JpaRepository<InviteDeliveryJob, UUID> {

  Optional<InviteDeliveryJob> findByInvitationId(UUID invitationId);

  /** Locks the job if it is still processing under the claim that saw {@code attempts}. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query(
      """
      SELECT j FROM InviteDeliveryJob j
      WHERE j.id = :id
        AND j.status = io.localaid.backend.invitation.delivery.InviteDeliveryStatus.PROCESSING
        AND j.attempts = :attempts
      """)
  Optional<InviteDeliveryJob> findClaimedForUpdate(
      @Param("id") UUID id, @Param("attempts") int attempts);

  @Query(
      """
      SELECT j FROM InviteDeliveryJob j
      WHERE j.status = io.localaid.backend.invitation.delivery.InviteDeliveryStatus.PENDING
        AND (j.nextAttemptAt IS NULL OR j.nextAttemptAt <= :now)
      ORDER BY COALESCE(j.nextAttemptAt, j.createdAt) ASC
      """)
  List<InviteDeliveryJob> findDue(@Param("now") Instant now, Pageable pageable);

  /**
   * Admin listing. {@code idTerm} matches either the job id or the invitation id; {@code
   * emailPattern} is a lower-case LIKE pattern on the invitee email.
   */
  @Query(
      value =
          """
          SELECT j FROM InviteDeliveryJob j
          WHERE (:status IS NULL OR j.status = :status)
            AND (:invitationId IS NULL OR j.invitationId = :invitationId)
            AND (:idTerm IS NULL OR j.id = :idTerm OR j.invitationId = :idTerm)
            AND (:emailPattern IS NULL OR j.invitationId IN (
                  SELECT i.id FROM OrganizationInvite i WHERE LOWER(i.email) LIKE :emailPattern))
            AND (:from IS NULL OR j.createdAt >= :from)
            AND (:to IS NULL OR j.createdAt <= :to)
          """)
  Page<InviteDeliveryJob> findByFilters(
      @Param("status") InviteDeliveryStatus status,
      @Param("invitationId") UUID invitationId,
      @Param("idTerm") UUID idTerm,
      @Param("emailPattern") String emailPattern,
      @Param("from") Instant from,
      @Param("to") Instant to,
      Pageable pageable);

  /** Conditional status transition; returns 1 when the row was still in {@code expected}. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE InviteDeliveryJob j
      SET j.status = :next, j.nextAttemptAt = NULL, j.updatedAt = :now
      WHERE j.id = :id AND j.status = :expected
      """)
  int transition(
      @Param("id") UUID id,
      @Param("expected") InviteDeliveryStatus expected,
      @Param("next") InviteDeliveryStatus next,
      @Param("now") Instant now);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE InviteDeliveryJob j
      SET j.status = io.localaid.backend.invitation.delivery.InviteDeliveryStatus.PENDING,
          j.nextAttemptAt = NULL,
          j.updatedAt = :now
      WHERE j.status = io.localaid.backend.invitation.delivery.InviteDeliveryStatus.FAILED
      """)
  int requeueAllFailed(@Param("now") Instant now);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE InviteDeliveryJob j
      SET j.status = io.localaid.backend.invitation.delivery.InviteDeliveryStatus.PENDING,
          j.attempts = j.attempts + 1,
          j.lastError = :error,
          j.lastAttemptAt = j.updatedAt,
          j.nextAttemptAt = NULL,
          j.updatedAt = :now
      WHERE j.status = io.localaid.backend.invitation.delivery.InviteDeliveryStatus.PROCESSING
        AND j.updatedAt < :staleBefore
      """)
  int releaseAbandoned(
      @Param("staleBefore") Instant staleBefore,
      @Param("error") String error,
      @Param("now") Instant now);

  @Query("SELECT j.status AS status, COUNT(j) AS total FROM InviteDeliveryJob j GROUP BY j.status")
  List<StatusCount> countByStatus();

  @Query("SELECT AVG(j.attempts) FROM InviteDeliveryJob j")
  Double averageAttempts();

  interface StatusCount {
    InviteDeliveryStatus getStatus();

    long getTotal();
  }
}
