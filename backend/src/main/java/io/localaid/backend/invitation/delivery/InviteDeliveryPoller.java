package io.localaid.backend.invitation.delivery;

import io.localaid.backend.config.JobProperties;
import io.localaid.backend.scheduling.PollingWorker;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

@Component
public class InviteDeliveryPoller extends PollingWorker {

  private final InviteDeliveryQueue queue;

  public InviteDeliveryPoller(
      InviteDeliveryQueue queue,
      @Qualifier("jobPollingScheduler") TaskScheduler scheduler,
      JobProperties properties) {
    super(
        "invite-delivery",
        scheduler,
        properties.invites().pollInterval(),
        properties.pollingEnabled());
    this.queue = queue;
  }

  @Override
  protected void poll() {
    queue.processQueue();
  }
}
