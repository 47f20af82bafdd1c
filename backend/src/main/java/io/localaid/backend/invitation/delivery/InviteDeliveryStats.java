package io.localaid.backend.invitation.delivery;

import java.util.Map;

/**
 * Delivery statistics. {@code successRate} is {@code sent / (sent + failed)} in {@code [0, 1]},
 * zero while no job is terminal.
 */
public record InviteDeliveryStats(
    long total, double successRate, Map<InviteDeliveryStatus, Long> byStatus, double avgAttempts) {}
