package io.localaid.backend.invitation.delivery;

import io.localaid.backend.audit.AuditEventBuilder;
import io.localaid.backend.audit.AuditService;
import io.localaid.backend.exception.InvalidStateException;
import io.localaid.backend.exception.ResourceConflictException;
import io.localaid.backend.exception.ResourceNotFoundException;
import io.localaid.backend.invitation.OrganizationInvite;
import io.localaid.backend.invitation.OrganizationInviteRepository;
import io.localaid.backend.job.JobStoreUnavailableException;
import io.localaid.backend.organization.Organization;
import io.localaid.backend.organization.OrganizationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

/**
 * Operator actions on invite delivery jobs: filtered listing with invitation summaries, single and
 * bulk requeue, and delivery statistics.
 */
@Service
public class InviteDeliveryJobAdminService {

  private static final Logger log = LoggerFactory.getLogger(InviteDeliveryJobAdminService.class);

  private final InviteDeliveryJobStore store;
  private final InviteDeliveryQueue queue;
  private final OrganizationInviteRepository inviteRepository;
  private final OrganizationRepository organizationRepository;
  private final AuditService auditService;
  private final Clock clock;

  public InviteDeliveryJobAdminService(
      InviteDeliveryJobStore store,
      InviteDeliveryQueue queue,
      OrganizationInviteRepository inviteRepository,
      OrganizationRepository organizationRepository,
      AuditService auditService,
      Clock clock) {
    this.store = store;
    this.queue = queue;
    this.inviteRepository = inviteRepository;
    this.organizationRepository = organizationRepository;
    this.auditService = auditService;
    this.clock = clock;
  }

  /**
   * Lists jobs matching the filters. A {@code query} that parses as a UUID matches the job id or
   * the invitation id; any other text matches the invitee email.
   */
  public Page<InviteDeliveryJobResponse> listJobs(
      InviteDeliveryStatus status,
      UUID invitationId,
      String query,
      Instant from,
      Instant to,
      Pageable pageable) {
    UUID idTerm = null;
    String emailTerm = null;
    if (query != null && !query.isBlank()) {
      String trimmed = query.trim();
      idTerm = parseUuid(trimmed);
      if (idTerm == null) {
        emailTerm = trimmed;
      }
    }
    var filter = new InviteDeliveryJobFilter(status, invitationId, idTerm, emailTerm, from, to);
    var page = store.list(filter, pageable);
    var summaries =
        summarize(page.getContent().stream().map(InviteDeliveryJob::getInvitationId).toList());
    var content =
        page.getContent().stream()
            .map(job -> InviteDeliveryJobResponse.from(job, summaries.get(job.getInvitationId())))
            .toList();
    return new PageImpl<>(content, pageable, page.getTotalElements());
  }

  public InviteDeliveryJobResponse getJob(UUID id) {
    return toResponse(findOrThrow(id));
  }

  /**
   * Moves a failed job back to pending with its retry delay cleared, then makes one immediate
   * delivery attempt. The attempt is best effort; its result is visible on the returned job.
   */
  public InviteDeliveryJobResponse retryJob(UUID id) {
    var job = findOrThrow(id);
    if (job.getStatus() != InviteDeliveryStatus.FAILED) {
      throw new InvalidStateException(
          "Job not retryable", "Only failed jobs can be retried; job is " + job.getStatus());
    }
    boolean requeued =
        store.tryClaim(
            id, InviteDeliveryStatus.FAILED, InviteDeliveryStatus.PENDING, clock.instant());
    if (!requeued) {
      throw new ResourceConflictException(
          "Job changed concurrently", "Invite delivery job " + id + " is no longer failed");
    }
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("invite_send_job.retried")
            .entityType("invite_send_job")
            .entityId(id)
            .details(
                Map.of("invitationId", job.getInvitationId(), "attempts", job.getAttempts()))
            .build());
    log.info("Invite delivery job {} requeued by operator", id);

    try {
      queue.deliverJob(id);
    } catch (RuntimeException e) {
      log.warn("Immediate delivery after retry of job {} failed: {}", id, e.getMessage());
    }
    return toResponse(findOrThrow(id));
  }

  /** Requeues every failed job and runs one queue tick. */
  public RequeueResult retryAllFailed() {
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("invite_send_jobs.requeue_started")
            .entityType("invite_send_job")
            .details(Map.of())
            .build());
    int requeued = store.requeueAllFailed(clock.instant());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("invite_send_jobs.requeue_completed")
            .entityType("invite_send_job")
            .details(Map.of("requeued", requeued))
            .build());
    log.info("Requeued {} failed invite delivery jobs", requeued);
    if (requeued > 0) {
      queue.processQueue();
    }
    return new RequeueResult(requeued);
  }

  /** Delivery statistics; all zeros while the job table is not provisioned. */
  public InviteDeliveryStats getStats() {
    try {
      var byStatus = store.countByStatus();
      long total = byStatus.values().stream().mapToLong(Long::longValue).sum();
      long sent = byStatus.getOrDefault(InviteDeliveryStatus.SENT, 0L);
      long failed = byStatus.getOrDefault(InviteDeliveryStatus.FAILED, 0L);
      double successRate = sent + failed == 0 ? 0.0 : (double) sent / (sent + failed);
      return new InviteDeliveryStats(total, successRate, byStatus, store.averageAttempts());
    } catch (JobStoreUnavailableException e) {
      log.warn("Invite delivery stats unavailable: {}", e.getMessage());
      var byStatus = new EnumMap<InviteDeliveryStatus, Long>(InviteDeliveryStatus.class);
      for (var status : InviteDeliveryStatus.values()) {
        byStatus.put(status, 0L);
      }
      return new InviteDeliveryStats(0, 0.0, byStatus, 0.0);
    }
  }

  private InviteDeliveryJob findOrThrow(UUID id) {
    return store.get(id).orElseThrow(() -> new ResourceNotFoundException("InviteSendJob", id));
  }

  private InviteDeliveryJobResponse toResponse(InviteDeliveryJob job) {
    var summaries = summarize(List.of(job.getInvitationId()));
    return InviteDeliveryJobResponse.from(job, summaries.get(job.getInvitationId()));
  }

  private Map<UUID, InviteDeliveryJobResponse.InvitationSummary> summarize(
      Collection<UUID> invitationIds) {
    if (invitationIds.isEmpty()) {
      return Map.of();
    }
    List<OrganizationInvite> invites = inviteRepository.findAllById(invitationIds);
    Map<UUID, String> organizationNames =
        organizationRepository
            .findAllById(invites.stream().map(OrganizationInvite::getOrganizationId).toList())
            .stream()
            .collect(Collectors.toMap(Organization::getId, Organization::getName));
    return invites.stream()
        .map(
            invite ->
                new InviteDeliveryJobResponse.InvitationSummary(
                    invite.getId(),
                    invite.getEmail(),
                    invite.getOrganizationId(),
                    organizationNames.get(invite.getOrganizationId()),
                    invite.getStatus()))
        .collect(
            Collectors.toMap(InviteDeliveryJobResponse.InvitationSummary::id, Function.identity()));
  }

  private static UUID parseUuid(String value) {
    try {
      return UUID.fromString(value);
    } catch (IllegalArgumentException e) {
      return null;
    }
  }
}
