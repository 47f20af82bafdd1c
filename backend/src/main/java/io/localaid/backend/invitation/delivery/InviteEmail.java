package io.localaid.backend.invitation.delivery;

import java.util.Map;

/** Recipient and template variables for one invitation email. */
public record InviteEmail(String to, Map<String, Object> data) {}
