package io.localaid.backend.job;

import java.time.Instant;

/** Result of one dispatch of a {@link ScheduledJob}, written back by {@link ScheduledJobStore}. */
public sealed interface ScheduledJobOutcome {

  Instant finishedAt();

  record Succeeded(Instant finishedAt) implements ScheduledJobOutcome {}

  record Failed(String error, Instant finishedAt) implements ScheduledJobOutcome {}
}
