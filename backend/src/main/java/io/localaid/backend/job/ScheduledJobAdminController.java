package io.localaid.backend.job;

import jakarta.validation.Valid;
import java.net.URI;
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
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Admin endpoints for inspecting, scheduling and retrying scheduled jobs. */
@RestController
@RequestMapping("/admin/scheduled-jobs")
@PreAuthorize("hasRole('ADMIN')")
public class ScheduledJobAdminController {

  private final ScheduledJobAdminService adminService;

  public ScheduledJobAdminController(ScheduledJobAdminService adminService) {
    this.adminService = adminService;
  }

  @GetMapping
  public ResponseEntity<Page<ScheduledJobResponse>> listJobs(
      @RequestParam(required = false) ScheduledJobStatus status,
      @RequestParam(required = false) String type,
      @PageableDefault(size = 20, sort = "runAt", direction = Sort.Direction.DESC)
          Pageable pageable) {
    return ResponseEntity.ok(adminService.listJobs(status, type, pageable));
  }

  @GetMapping("/stats")
  public ResponseEntity<ScheduledJobStats> getStats() {
    return ResponseEntity.ok(adminService.getStats());
  }

  @GetMapping("/{id}")
  public ResponseEntity<ScheduledJobResponse> getJob(@PathVariable UUID id) {
    return ResponseEntity.ok(adminService.getJob(id));
  }

  @PostMapping
  public ResponseEntity<ScheduledJobResponse> createJob(
      @Valid @RequestBody CreateScheduledJobRequest request) {
    var job = adminService.createJob(request);
    return ResponseEntity.created(URI.create("/admin/scheduled-jobs/" + job.id())).body(job);
  }

  @PostMapping("/{id}/retry")
  public ResponseEntity<ScheduledJobResponse> retryJob(@PathVariable UUID id) {
    return ResponseEntity.ok(adminService.retryJob(id));
  }
}
