package io.localaid.backend.job.handler;

import io.localaid.backend.compliance.ComplianceDocument;
import io.localaid.backend.compliance.ComplianceDocumentRepository;
import io.localaid.backend.compliance.ComplianceDocumentStatus;
import io.localaid.backend.notification.NotificationService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sweeps compliance documents that expire soon and notifies their owners. A document is notified
 * at most once per 24 hours, so overlapping sweeps do not spam users.
 */
@Component
public class ComplianceExpiryJobHandler implements JobHandler<ComplianceExpiryPayload> {

  private static final Logger log = LoggerFactory.getLogger(ComplianceExpiryJobHandler.class);

  public static final String TYPE = "compliance_expiry";
  static final String NOTIFICATION_TYPE = "COMPLIANCE_EXPIRING";
  static final String REFERENCE_ENTITY_TYPE = "COMPLIANCE_DOCUMENT";
  static final Duration RENOTIFY_AFTER = Duration.ofHours(24);

  private static final EnumSet<ComplianceDocumentStatus> EXCLUDED_STATUSES =
      EnumSet.of(ComplianceDocumentStatus.EXPIRED, ComplianceDocumentStatus.REJECTED);
  private static final DateTimeFormatter EXPIRY_FORMAT =
      DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);

  private final ComplianceDocumentRepository documentRepository;
  private final NotificationService notificationService;
  private final Clock clock;

  public ComplianceExpiryJobHandler(
      ComplianceDocumentRepository documentRepository,
      NotificationService notificationService,
      Clock clock) {
    this.documentRepository = documentRepository;
    this.notificationService = notificationService;
    this.clock = clock;
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public ComplianceExpiryPayload parsePayload(String type, Map<String, Object> raw) {
    Integer withinDays = PayloadFields.optionalInt(type, raw, "withinDays");
    int days = withinDays != null ? withinDays : ComplianceExpiryPayload.DEFAULT_WITHIN_DAYS;
    if (days < 1 || days > ComplianceExpiryPayload.MAX_WITHIN_DAYS) {
      throw new InvalidJobPayloadException(
          type, "withinDays must be between 1 and " + ComplianceExpiryPayload.MAX_WITHIN_DAYS);
    }
    return new ComplianceExpiryPayload(days, PayloadFields.optionalString(type, raw, "docType"));
  }

  @Override
  public void handle(ComplianceExpiryPayload payload) {
    Instant now = clock.instant();
    Instant until = now.plus(Duration.ofDays(payload.withinDays()));
    List<ComplianceDocument> expiring =
        payload.docType() != null
            ? documentRepository.findExpiringBetweenForType(
                now, until, EXCLUDED_STATUSES, payload.docType())
            : documentRepository.findExpiringBetween(now, until, EXCLUDED_STATUSES);

    int notified = 0;
    Instant renotifyCutoff = now.minus(RENOTIFY_AFTER);
    for (var document : expiring) {
      if (notificationService.wasNotifiedSince(
          NOTIFICATION_TYPE, document.getId(), renotifyCutoff)) {
        continue;
      }
      notificationService.createNotification(
          document.getUserId(),
          NOTIFICATION_TYPE,
          "Compliance document expiring",
          "Your "
              + document.getDocType()
              + " document expires on "
              + EXPIRY_FORMAT.format(document.getExpiresAt())
              + ".",
          REFERENCE_ENTITY_TYPE,
          document.getId(),
          Map.of(
              "docType", document.getDocType(),
              "expiresAt", document.getExpiresAt().toString()));
      notified++;
    }
    log.info(
        "Compliance expiry sweep: {} documents expiring within {} days, {} notified",
        expiring.size(),
        payload.withinDays(),
        notified);
  }
}
