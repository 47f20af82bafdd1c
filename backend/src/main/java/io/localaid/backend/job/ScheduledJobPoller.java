package io.localaid.backend.job;

import io.localaid.backend.config.JobProperties;
import io.localaid.backend.scheduling.PollingWorker;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

@Component
public class ScheduledJobPoller extends PollingWorker {

  private final ScheduledJobRunner runner;

  public ScheduledJobPoller(
      ScheduledJobRunner runner,
      @Qualifier("jobPollingScheduler") TaskScheduler scheduler,
      JobProperties properties) {
    super(
        "scheduled-job",
        scheduler,
        properties.scheduler().pollInterval(),
        properties.pollingEnabled());
    this.runner = runner;
  }

  @Override
  protected void poll() {
    runner.runDueJobs();
  }
}
