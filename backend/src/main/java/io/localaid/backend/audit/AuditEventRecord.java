package io.localaid.backend.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}. Constructed by {@link
 * AuditEventBuilder} which auto-populates actor and source.
 *
 * @param eventType free-form event type following {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited (e.g., "scheduled_job")
 * @param entityId the audited entity, or {@code null} for bulk operations
 * @param actor subject of the authenticated principal, or {@code null} for system actions
 * @param actorType "USER" or "SYSTEM"
 * @param source "API" or "INTERNAL"
 * @param details free-form structured context
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    String actor,
    String actorType,
    String source,
    Map<String, Object> details) {}
