package io.localaid.backend.job;

import io.localaid.backend.config.JobProperties;
import io.localaid.backend.job.handler.JobHandler;
import io.localaid.backend.job.handler.JobHandlerRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Executes due {@link ScheduledJob}s. Each call to {@link #runDueJobs()} is one poll tick: recover
 * abandoned claims, fetch a batch of due jobs, claim them in chunks of the worker count, run their
 * handlers in parallel under a shared deadline, and record each outcome.
 *
 * <p>Jobs are never retried automatically. A failed job stays {@code FAILED} until an operator
 * retries it.
 */
@Service
public class ScheduledJobRunner {

  private static final Logger log = LoggerFactory.getLogger(ScheduledJobRunner.class);

  private final ScheduledJobStore store;
  private final JobHandlerRegistry handlerRegistry;
  private final AsyncTaskExecutor handlerExecutor;
  private final JobProperties.Scheduler settings;
  private final Clock clock;

  public ScheduledJobRunner(
      ScheduledJobStore store,
      JobHandlerRegistry handlerRegistry,
      @Qualifier("jobHandlerExecutor") AsyncTaskExecutor handlerExecutor,
      JobProperties properties,
      Clock clock) {
    this.store = store;
    this.handlerRegistry = handlerRegistry;
    this.handlerExecutor = handlerExecutor;
    this.settings = properties.scheduler();
    this.clock = clock;
  }

  /**
   * Runs one poll tick.
   *
   * @return number of jobs whose outcome was recorded
   */
  public int runDueJobs() {
    Instant now = clock.instant();
    List<ScheduledJob> due;
    try {
      recoverAbandoned(now);
      due = store.findDue(now, settings.batchSize());
    } catch (JobStoreUnavailableException e) {
      log.warn("Skipping scheduled job tick: {}", e.getMessage());
      return 0;
    }
    log.debug("Found {} due scheduled jobs", due.size());
    if (due.isEmpty()) {
      return 0;
    }

    int chunkSize = Math.max(1, settings.workerCount());
    int processed = 0;
    for (int from = 0; from < due.size(); from += chunkSize) {
      var chunk = due.subList(from, Math.min(from + chunkSize, due.size()));
      processed += runChunk(chunk);
    }
    log.info("Scheduled job tick finished: {} due, {} processed", due.size(), processed);
    return processed;
  }

  private void recoverAbandoned(Instant now) {
    int recovered = store.recoverAbandoned(now.minus(settings.staleAfter()), now);
    if (recovered > 0) {
      log.warn(
          "Marked {} scheduled jobs as failed after running longer than {}",
          recovered,
          settings.staleAfter());
    }
  }

  private int runChunk(List<ScheduledJob> chunk) {
    Map<ScheduledJob, Future<?>> inFlight = new LinkedHashMap<>();
    List<ScheduledJob> claimedWithoutHandler = new ArrayList<>();

    for (var candidate : chunk) {
      try {
        var claimed = claim(candidate.getId());
        if (claimed.isEmpty()) {
          log.debug("Scheduled job {} already claimed by another worker", candidate.getId());
          continue;
        }
        var job = claimed.get();
        var handler = handlerRegistry.find(job.getType());
        if (handler.isEmpty()) {
          claimedWithoutHandler.add(job);
          continue;
        }
        inFlight.put(job, submit(handler.get(), job));
      } catch (TaskRejectedException e) {
        log.warn("No free handler worker for scheduled job {}, releasing claim", candidate.getId());
        release(candidate);
      } catch (RuntimeException e) {
        log.error(
            "Failed to start scheduled job {} (type={})",
            candidate.getId(),
            candidate.getType(),
            e);
      }
    }

    int processed = 0;
    for (var job : claimedWithoutHandler) {
      var outcome =
          new ScheduledJobOutcome.Failed("no handler for type " + job.getType(), clock.instant());
      processed += record(job, outcome);
    }

    long deadline = System.nanoTime() + settings.handlerTimeout().toNanos();
    for (var entry : inFlight.entrySet()) {
      processed += record(entry.getKey(), await(entry.getKey(), entry.getValue(), deadline));
    }
    return processed;
  }

  /** Claims a scheduled job and re-reads it, so the attempt count belongs to this claim. */
  private Optional<ScheduledJob> claim(UUID jobId) {
    boolean claimed =
        store.tryClaim(
            jobId, ScheduledJobStatus.SCHEDULED, ScheduledJobStatus.RUNNING, clock.instant());
    if (!claimed) {
      return Optional.empty();
    }
    return store.get(jobId).filter(job -> job.getStatus() == ScheduledJobStatus.RUNNING);
  }

  private Future<?> submit(JobHandler<?> handler, ScheduledJob job) {
    return handlerExecutor.submit(
        () -> handlerRegistry.execute(handler, job.getType(), job.getPayload()));
  }

  private ScheduledJobOutcome await(ScheduledJob job, Future<?> future, long deadlineNanos) {
    try {
      long remaining = Math.max(0, deadlineNanos - System.nanoTime());
      future.get(remaining, TimeUnit.NANOSECONDS);
      return new ScheduledJobOutcome.Succeeded(clock.instant());
    } catch (TimeoutException e) {
      Duration timeout = settings.handlerTimeout();
      return new ScheduledJobOutcome.Failed("handler timed out after " + timeout, clock.instant());
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      log.debug("Handler for scheduled job {} threw", job.getId(), cause);
      return new ScheduledJobOutcome.Failed(describe(cause), clock.instant());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return new ScheduledJobOutcome.Failed(
          "interrupted while waiting for handler", clock.instant());
    }
  }

  private int record(ScheduledJob job, ScheduledJobOutcome outcome) {
    try {
      if (store.recordOutcome(job.getId(), job.getAttempts(), outcome).isEmpty()) {
        log.warn(
            "Dropped outcome of scheduled job {}: claim was released before it finished",
            job.getId());
        return 0;
      }
      if (outcome instanceof ScheduledJobOutcome.Failed failed) {
        log.warn(
            "Scheduled job {} (type={}) failed: {}", job.getId(), job.getType(), failed.error());
      }
      return 1;
    } catch (RuntimeException e) {
      log.error("Could not record outcome of scheduled job {}", job.getId(), e);
      return 0;
    }
  }

  private void release(ScheduledJob job) {
    try {
      store.tryClaim(
          job.getId(), ScheduledJobStatus.RUNNING, ScheduledJobStatus.SCHEDULED, clock.instant());
    } catch (RuntimeException e) {
      log.error("Could not release claim on scheduled job {}", job.getId(), e);
    }
  }

  static String describe(Throwable error) {
    String message = error.getMessage();
    return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
  }
}
