package io.localaid.backend.job;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import org.springframework.dao.InvalidDataAccessResourceUsageException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class DatabaseScheduledJobStore implements ScheduledJobStore {

  static final String ABANDONED_ERROR = "abandoned while running";

  private final ScheduledJobRepository repository;

  public DatabaseScheduledJobStore(ScheduledJobRepository repository) {
    this.repository = repository;
  }

  @Override
  @Transactional
  public ScheduledJob insert(ScheduledJob job) {
    return guarded(() -> repository.save(job));
  }

  @Override
  @Transactional(readOnly = true)
  public List<ScheduledJob> findDue(Instant now, int limit) {
    return guarded(
        () -> repository.findDue(ScheduledJobStatus.SCHEDULED, now, PageRequest.of(0, limit)));
  }

  @Override
  @Transactional
  public boolean tryClaim(
      UUID id, ScheduledJobStatus expected, ScheduledJobStatus next, Instant now) {
    return guarded(() -> repository.transition(id, expected, next, now) == 1);
  }

  @Override
  @Transactional
  public Optional<ScheduledJob> recordOutcome(
      UUID id, int claimedAttempts, ScheduledJobOutcome outcome) {
    return guarded(
        () ->
            repository
                .findClaimedForUpdate(id, claimedAttempts)
                .map(
                    job -> {
                      job.apply(outcome);
                      return repository.save(job);
                    }));
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<ScheduledJob> get(UUID id) {
    return guarded(() -> repository.findById(id));
  }

  @Override
  @Transactional(readOnly = true)
  public Page<ScheduledJob> list(ScheduledJobStatus status, String type, Pageable pageable) {
    return guarded(
        () -> {
          if (status != null && type != null) {
            return repository.findByStatusAndTypeIgnoreCase(status, type, pageable);
          }
          if (status != null) {
            return repository.findByStatus(status, pageable);
          }
          if (type != null) {
            return repository.findByTypeIgnoreCase(type, pageable);
          }
          return repository.findAll(pageable);
        });
  }

  @Override
  @Transactional
  public int recoverAbandoned(Instant staleBefore, Instant now) {
    return guarded(() -> repository.failAbandoned(staleBefore, ABANDONED_ERROR, now));
  }

  @Override
  @Transactional(readOnly = true)
  public Map<ScheduledJobStatus, Long> countByStatus() {
    return guarded(
        () -> {
          var counts = new EnumMap<ScheduledJobStatus, Long>(ScheduledJobStatus.class);
          for (var status : ScheduledJobStatus.values()) {
            counts.put(status, 0L);
          }
          repository.countByStatus().forEach(c -> counts.put(c.getStatus(), c.getTotal()));
          return counts;
        });
  }

  private static <T> T guarded(Supplier<T> operation) {
    try {
      return operation.get();
    } catch (InvalidDataAccessResourceUsageException e) {
      throw new JobStoreUnavailableException("Scheduled job store", e);
    }
  }
}
