package io.localaid.backend.job.handler;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Resolves the {@link JobHandler} for a job type: exact type first, then family handlers. */
@Component
public class JobHandlerRegistry {

  private static final Logger log = LoggerFactory.getLogger(JobHandlerRegistry.class);

  private final Map<String, JobHandler<?>> handlersByType = new HashMap<>();
  private final List<JobHandler<?>> handlers;

  public JobHandlerRegistry(List<JobHandler<?>> handlers) {
    this.handlers = new ArrayList<>(handlers);
    for (var handler : handlers) {
      String key = normalize(handler.type());
      var existing = handlersByType.putIfAbsent(key, handler);
      if (existing != null) {
        throw new IllegalStateException(
            "Duplicate job handler for type '"
                + key
                + "': "
                + existing.getClass().getName()
                + " and "
                + handler.getClass().getName());
      }
    }
    log.info("Registered job handlers for types {}", handlersByType.keySet());
  }

  public Optional<JobHandler<?>> find(String type) {
    if (type == null || type.isBlank()) {
      return Optional.empty();
    }
    String key = normalize(type);
    var exact = handlersByType.get(key);
    if (exact != null) {
      return Optional.of(exact);
    }
    return handlers.stream().filter(h -> h.supports(key)).findFirst();
  }

  /** Parses the payload with the handler's own validation and runs it. */
  public void execute(JobHandler<?> handler, String type, Map<String, Object> rawPayload) {
    invoke(handler, normalize(type), rawPayload != null ? rawPayload : Map.of());
  }

  private static <P extends JobPayload> void invoke(
      JobHandler<P> handler, String type, Map<String, Object> rawPayload) {
    P payload = handler.parsePayload(type, rawPayload);
    handler.handle(payload);
  }

  static String normalize(String type) {
    return type.trim().toLowerCase(Locale.ROOT);
  }
}
