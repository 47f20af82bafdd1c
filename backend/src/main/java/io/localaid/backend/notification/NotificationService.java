package io.localaid.backend.notification;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
public class NotificationService {

  private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

  private final NotificationRepository notificationRepository;

  public NotificationService(NotificationRepository notificationRepository) {
    this.notificationRepository = notificationRepository;
  }

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public Notification createNotification(
      String recipientUserId,
      String type,
      String title,
      String body,
      String refEntityType,
      UUID refEntityId,
      Map<String, Object> payload) {
    var notification =
        new Notification(
            recipientUserId, type, title, body, refEntityType, refEntityId, payload);
    var saved = notificationRepository.save(notification);
    log.debug("Created {} notification {} for user {}", type, saved.getId(), recipientUserId);
    return saved;
  }

  /** Whether a notification of this type about the entity was created at or after {@code since}. */
  @Transactional(readOnly = true)
  public boolean wasNotifiedSince(String type, UUID refEntityId, Instant since) {
    return notificationRepository.existsByTypeAndReferenceEntityIdSince(type, refEntityId, since);
  }
}
