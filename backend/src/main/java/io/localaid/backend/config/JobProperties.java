package io.localaid.backend.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tunables for the two background pollers. Bound from {@code localaid.jobs.*}.
 *
 * @param pollingEnabled whether the pollers start with the application context
 * @param scheduler settings for the generic scheduled-job runner
 * @param invites settings for the invite delivery queue
 */
@ConfigurationProperties("localaid.jobs")
public record JobProperties(
    @DefaultValue("true") boolean pollingEnabled,
    @DefaultValue Scheduler scheduler,
    @DefaultValue Invites invites) {

  public record Scheduler(
      @DefaultValue("60s") Duration pollInterval,
      @DefaultValue("25") int batchSize,
      @DefaultValue("4") int workerCount,
      @DefaultValue("30s") Duration handlerTimeout,
      @DefaultValue("15m") Duration staleAfter) {}

  public record Invites(
      @DefaultValue("60s") Duration pollInterval,
      @DefaultValue("10") int batchSize,
      @DefaultValue("5") int maxAttempts,
      @DefaultValue("1m") Duration backoffBase,
      @DefaultValue("60m") Duration backoffMax,
      @DefaultValue("15m") Duration staleAfter) {}
}
