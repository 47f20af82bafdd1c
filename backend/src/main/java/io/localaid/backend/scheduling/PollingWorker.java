package io.localaid.backend.scheduling;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;

/**
 * Base class for background pollers. Owns a fixed-delay timer on the shared polling scheduler and
 * exposes start/stop through {@link SmartLifecycle}, so pollers start after the context is ready
 * and stop before it closes.
 *
 * <p>A tick that throws is logged and the timer keeps running.
 */
public abstract class PollingWorker implements SmartLifecycle {

  private final Logger log = LoggerFactory.getLogger(getClass());

  private final String name;
  private final TaskScheduler scheduler;
  private final Duration interval;
  private final boolean autoStartup;

  private volatile ScheduledFuture<?> timer;

  protected PollingWorker(
      String name, TaskScheduler scheduler, Duration interval, boolean autoStartup) {
    this.name = name;
    this.scheduler = scheduler;
    this.interval = interval;
    this.autoStartup = autoStartup;
  }

  /** One polling pass. */
  protected abstract void poll();

  @Override
  public synchronized void start() {
    if (timer != null) {
      return;
    }
    timer = scheduler.scheduleWithFixedDelay(this::pollSafely, interval);
    log.info("Started {} poller, interval={}", name, interval);
  }

  @Override
  public synchronized void stop() {
    if (timer == null) {
      return;
    }
    timer.cancel(false);
    timer = null;
    log.info("Stopped {} poller", name);
  }

  @Override
  public boolean isRunning() {
    return timer != null;
  }

  @Override
  public boolean isAutoStartup() {
    return autoStartup;
  }

  /** Runs one pass immediately on the caller's thread. */
  public void pollNow() {
    pollSafely();
  }

  private void pollSafely() {
    try {
      poll();
    } catch (RuntimeException e) {
      log.error("{} poll failed", name, e);
    }
  }
}
