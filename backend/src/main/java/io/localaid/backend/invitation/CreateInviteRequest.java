package io.localaid.backend.invitation;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CreateInviteRequest(
    @NotBlank @Email @Size(max = 320) String email,
    @Size(max = 100) String firstName,
    @Size(max = 100) String lastName,
    @NotBlank @Pattern(regexp = "admin|organizer|volunteer") String role,
    @Size(max = 2000) String message) {}
