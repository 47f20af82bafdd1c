package io.localaid.backend.job.handler;

/**
 * Typed payload of a scheduled job. Each {@link JobHandler} parses the stored JSON map into its own
 * variant before running.
 */
public sealed interface JobPayload
    permits ReminderPayload, ComplianceExpiryPayload, CommunicationPayload, GenericPayload {}
