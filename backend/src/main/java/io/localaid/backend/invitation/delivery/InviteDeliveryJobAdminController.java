package io.localaid.backend.invitation.delivery;

import java.time.Instant;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Admin endpoints for monitoring and requeueing invitation email delivery. */
@RestController
@RequestMapping("/admin/invite-send-jobs")
@PreAuthorize("hasRole('ADMIN')")
public class InviteDeliveryJobAdminController {

  private final InviteDeliveryJobAdminService adminService;

  public InviteDeliveryJobAdminController(InviteDeliveryJobAdminService adminService) {
    this.adminService = adminService;
  }

  @GetMapping
  public ResponseEntity<Page<InviteDeliveryJobResponse>> listJobs(
      @RequestParam(required = false) InviteDeliveryStatus status,
      @RequestParam(required = false) UUID invitationId,
      @RequestParam(name = "q", required = false) String query,
      @RequestParam(required = false) Instant from,
      @RequestParam(required = false) Instant to,
      @PageableDefault(size = 20, sort = "createdAt", direction = Sort.Direction.DESC)
          Pageable pageable) {
    return ResponseEntity.ok(
        adminService.listJobs(status, invitationId, query, from, to, pageable));
  }

  @GetMapping("/stats")
  public ResponseEntity<InviteDeliveryStats> getStats() {
    return ResponseEntity.ok(adminService.getStats());
  }

  @GetMapping("/{id}")
  public ResponseEntity<InviteDeliveryJobResponse> getJob(@PathVariable UUID id) {
    return ResponseEntity.ok(adminService.getJob(id));
  }

  @PostMapping("/{id}/retry")
  public ResponseEntity<InviteDeliveryJobResponse> retryJob(@PathVariable UUID id) {
    return ResponseEntity.ok(adminService.retryJob(id));
  }

  @PostMapping("/retry-failed")
  public ResponseEntity<RequeueResult> retryAllFailed() {
    return ResponseEntity.ok(adminService.retryAllFailed());
  }
}
