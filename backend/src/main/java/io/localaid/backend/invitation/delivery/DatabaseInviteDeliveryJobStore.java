package io.localaid.backend.invitation.delivery;

import io.localaid.backend.job.JobStoreUnavailableException;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.InvalidDataAccessResourceUsageException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class DatabaseInviteDeliveryJobStore implements InviteDeliveryJobStore {

  static final String ABANDONED_ERROR = "abandoned while processing";

  private final InviteDeliveryJobRepository repository;

  public DatabaseInviteDeliveryJobStore(InviteDeliveryJobRepository repository) {
    this.repository = repository;
  }

  @Override
  @Transactional
  public InviteDeliveryJob insert(InviteDeliveryJob job) {
    return guarded(
        () -> {
          try {
            return repository.saveAndFlush(job);
          } catch (DataIntegrityViolationException e) {
            throw new DuplicateInviteDeliveryJobException(job.getInvitationId(), e);
          }
        });
  }

  @Override
  @Transactional(readOnly = true)
  public List<InviteDeliveryJob> findDue(Instant now, int limit) {
    return guarded(() -> repository.findDue(now, PageRequest.of(0, limit)));
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<InviteDeliveryJob> findByInvitationId(UUID invitationId) {
    return guarded(() -> repository.findByInvitationId(invitationId));
  }

  @Override
  @Transactional
  public boolean tryClaim(
      UUID id, InviteDeliveryStatus expected, InviteDeliveryStatus next, Instant now) {
    return guarded(() -> repository.transition(id, expected, next, now) == 1);
  }

  @Override
  @Transactional
  public Optional<InviteDeliveryJob> recordOutcome(
      UUID id, int claimedAttempts, InviteDeliveryOutcome outcome) {
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
  public Optional<InviteDeliveryJob> get(UUID id) {
    return guarded(() -> repository.findById(id));
  }

  @Override
  @Transactional(readOnly = true)
  public Page<InviteDeliveryJob> list(InviteDeliveryJobFilter filter, Pageable pageable) {
    String emailPattern =
        filter.emailTerm() != null
            ? "%" + filter.emailTerm().toLowerCase(Locale.ROOT) + "%"
            : null;
    return guarded(
        () ->
            repository.findByFilters(
                filter.status(),
                filter.invitationId(),
                filter.idTerm(),
                emailPattern,
                filter.from(),
                filter.to(),
                pageable));
  }

  @Override
  @Transactional
  public int requeueAllFailed(Instant now) {
    return guarded(() -> repository.requeueAllFailed(now));
  }

  @Override
  @Transactional
  public int recoverAbandoned(Instant staleBefore, Instant now) {
    return guarded(() -> repository.releaseAbandoned(staleBefore, ABANDONED_ERROR, now));
  }

  @Override
  @Transactional(readOnly = true)
  public Map<InviteDeliveryStatus, Long> countByStatus() {
    return guarded(
        () -> {
          var counts = new EnumMap<InviteDeliveryStatus, Long>(InviteDeliveryStatus.class);
          for (var status : InviteDeliveryStatus.values()) {
            counts.put(status, 0L);
          }
          repository.countByStatus().forEach(c -> counts.put(c.getStatus(), c.getTotal()));
          return counts;
        });
  }

  @Override
  @Transactional(readOnly = true)
  public double averageAttempts() {
    return guarded(
        () -> {
          Double average = repository.averageAttempts();
          return average != null ? average : 0.0;
        });
  }

  private static <T> T guarded(Supplier<T> operation) {
    try {
      return operation.get();
    } catch (InvalidDataAccessResourceUsageException e) {
      throw new JobStoreUnavailableException("Invite delivery job store", e);
    }
  }
}
