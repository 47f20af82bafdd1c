package io.localaid.backend.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.is;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.localaid.backend.TestcontainersConfiguration;
import io.localaid.backend.communication.CommunicationRepository;
import io.localaid.backend.communication.CommunicationStatus;
import io.localaid.backend.notification.NotificationRepository;
import io.localaid.backend.security.Roles;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class ScheduledJobAdminControllerIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private ScheduledJobRunner runner;
  @Autowired private ScheduledJobStore store;
  @Autowired private NotificationRepository notificationRepository;
  @Autowired private CommunicationRepository communicationRepository;

  @Test
  void unauthenticated_request_is_rejected() throws Exception {
    mockMvc.perform(get("/admin/scheduled-jobs")).andExpect(status().isUnauthorized());
  }

  @Test
  void volunteer_cannot_list_jobs() throws Exception {
    mockMvc
        .perform(get("/admin/scheduled-jobs").with(volunteerJwt()))
        .andExpect(status().isForbidden());
  }

  @Test
  void reminder_created_through_api_runs_and_notifies_user() throws Exception {
    var userId = UUID.randomUUID().toString();
    var result =
        mockMvc
            .perform(
                post("/admin/scheduled-jobs")
                    .with(adminJwt())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {
                          "name": "Shift reminder",
                          "type": "reminder",
                          "payload": {"userId": "%s", "message": "Shift starts at 9"},
                          "runAt": "%s"
                        }
                        """
                            .formatted(userId, Instant.now().minus(1, ChronoUnit.MINUTES))))
            .andExpect(status().isCreated())
            .andExpect(header().exists("Location"))
            .andExpect(jsonPath("$.status").value("SCHEDULED"))
            .andExpect(jsonPath("$.attempts").value(0))
            .andReturn();
    String jobId = JsonPath.read(result.getResponse().getContentAsString(), "$.id");

    assertThat(runner.runDueJobs()).isGreaterThanOrEqualTo(1);

    mockMvc
        .perform(get("/admin/scheduled-jobs/" + jobId).with(adminJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("COMPLETED"))
        .andExpect(jsonPath("$.attempts").value(1))
        .andExpect(jsonPath("$.completedAt").isNotEmpty());
    var notifications = notificationRepository.findByRecipientUserIdOrderByCreatedAtDesc(userId);
    assertThat(notifications).hasSize(1);
    assertThat(notifications.get(0).getType()).isEqualTo("REMINDER");
    assertThat(notifications.get(0).getBody()).isEqualTo("Shift starts at 9");
  }

  @Test
  void communication_job_creates_scheduled_communication() throws Exception {
    var subject = "Roster update " + UUID.randomUUID();
    var result =
        mockMvc
            .perform(
                post("/admin/scheduled-jobs")
                    .with(adminJwt())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {
                          "name": "Weekly roster",
                          "type": "communication",
                          "payload": {
                            "subject": "%s",
                            "content": "New shifts are up",
                            "sendAt": "2030-01-06T08:00:00Z",
                            "targetAudience": "all"
                          },
                          "runAt": "%s"
                        }
                        """
                            .formatted(subject, Instant.now().minus(1, ChronoUnit.MINUTES))))
            .andExpect(status().isCreated())
            .andReturn();
    String jobId = JsonPath.read(result.getResponse().getContentAsString(), "$.id");

    runner.runDueJobs();

    mockMvc
        .perform(get("/admin/scheduled-jobs/" + jobId).with(adminJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("COMPLETED"));
    var communications = communicationRepository.findBySubjectOrderByCreatedAtDesc(subject);
    assertThat(communications).hasSize(1);
    assertThat(communications.get(0).getStatus()).isEqualTo(CommunicationStatus.SCHEDULED);
    assertThat(communications.get(0).getType()).isEqualTo("EMAIL");
    assertThat(communications.get(0).getSendAt()).isEqualTo(Instant.parse("2030-01-06T08:00:00Z"));
    assertThat(communications.get(0).getTargetAudience()).isEqualTo("all");
  }

  @Test
  void unknown_job_type_is_rejected() throws Exception {
    mockMvc
        .perform(
            post("/admin/scheduled-jobs")
                .with(adminJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Mystery", "type": "teleport", "payload": {}}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Unknown job type"));
  }

  @Test
  void missing_name_fails_validation() throws Exception {
    mockMvc
        .perform(
            post("/admin/scheduled-jobs")
                .with(adminJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"type": "reminder", "payload": {}}
                    """))
        .andExpect(status().isBadRequest());
  }

  @Test
  void failed_job_can_be_retried_once() throws Exception {
    var job =
        store.insert(
            new ScheduledJob(
                "Broken reminder", "reminder", Map.of("message", "no user"), Instant.now()));
    runner.runDueJobs();

    mockMvc
        .perform(get("/admin/scheduled-jobs/" + job.getId()).with(adminJwt()))
        .andExpect(jsonPath("$.status").value("FAILED"))
        .andExpect(
            jsonPath("$.lastError").value("invalid payload for type reminder: userId is required"));

    mockMvc
        .perform(post("/admin/scheduled-jobs/" + job.getId() + "/retry").with(adminJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("SCHEDULED"))
        .andExpect(jsonPath("$.attempts").value(1));

    mockMvc
        .perform(post("/admin/scheduled-jobs/" + job.getId() + "/retry").with(adminJwt()))
        .andExpect(status().isBadRequest());
  }

  @Test
  void unknown_job_is_not_found() throws Exception {
    mockMvc
        .perform(get("/admin/scheduled-jobs/" + UUID.randomUUID()).with(adminJwt()))
        .andExpect(status().isNotFound());
  }

  @Test
  void list_filters_by_status_and_type() throws Exception {
    var tomorrow = Instant.now().plus(1, ChronoUnit.DAYS);
    store.insert(new ScheduledJob("Future digest", "compliance_expiry", Map.of(), tomorrow));

    mockMvc
        .perform(
            get("/admin/scheduled-jobs")
                .param("status", "SCHEDULED")
                .param("type", "COMPLIANCE_EXPIRY")
                .with(adminJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.content.length()", greaterThanOrEqualTo(1)))
        .andExpect(jsonPath("$.content[*].status", everyItem(is("SCHEDULED"))))
        .andExpect(jsonPath("$.content[*].type", everyItem(is("compliance_expiry"))));
  }

  @Test
  void stats_report_every_status() throws Exception {
    mockMvc
        .perform(get("/admin/scheduled-jobs/stats").with(adminJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").isNumber())
        .andExpect(jsonPath("$.byStatus.SCHEDULED").isNumber())
        .andExpect(jsonPath("$.byStatus.RUNNING").isNumber())
        .andExpect(jsonPath("$.byStatus.COMPLETED").isNumber())
        .andExpect(jsonPath("$.byStatus.FAILED").isNumber());
  }

  private JwtRequestPostProcessor adminJwt() {
    return jwt()
        .jwt(j -> j.subject("admin-user"))
        .authorities(new SimpleGrantedAuthority(Roles.AUTHORITY_ADMIN));
  }

  private JwtRequestPostProcessor volunteerJwt() {
    return jwt()
        .jwt(j -> j.subject("volunteer-user"))
        .authorities(new SimpleGrantedAuthority(Roles.AUTHORITY_VOLUNTEER));
  }
}
