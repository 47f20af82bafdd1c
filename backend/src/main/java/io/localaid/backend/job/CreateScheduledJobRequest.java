package io.localaid.backend.job;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.Map;

public record CreateScheduledJobRequest(
    @NotBlank @Size(max = 200) String name,
    @NotBlank @Size(max = 100) String type,
    Map<String, Object> payload,
    Instant runAt) {}
