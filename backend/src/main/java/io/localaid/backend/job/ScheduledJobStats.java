package io.localaid.backend.job;

import java.util.Map;

/** Job counts for the admin dashboard. */
public record ScheduledJobStats(long total, Map<ScheduledJobStatus, Long> byStatus) {}
