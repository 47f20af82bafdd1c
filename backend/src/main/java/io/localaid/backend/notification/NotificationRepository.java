package io.localaid.backend.notification;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface NotificationRepository extends JpaRepository<Notification, UUID> {

  List<Notification> findByRecipientUserIdOrderByCreatedAtDesc(String recipientUserId);

  @Query(
      """
      SELECT COUNT(n) > 0 FROM Notification n
      WHERE n.type = :type
        AND n.referenceEntityId = :entityId
        AND n.createdAt >= :since
      """)
  boolean existsByTypeAndReferenceEntityIdSince(
      @Param("type") String type,
      @Param("entityId") UUID entityId,
      @Param("since") Instant since);
}
