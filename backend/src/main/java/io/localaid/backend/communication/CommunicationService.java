package io.localaid.backend.communication;

import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class CommunicationService {

  private static final Logger log = LoggerFactory.getLogger(CommunicationService.class);

  private final CommunicationRepository communicationRepository;

  public CommunicationService(CommunicationRepository communicationRepository) {
    this.communicationRepository = communicationRepository;
  }

  @Transactional
  public Communication createCommunication(
      String subject,
      String content,
      String type,
      CommunicationStatus status,
      Instant sendAt,
      String targetAudience) {
    var saved =
        communicationRepository.save(
            new Communication(subject, content, type, status, sendAt, targetAudience));
    log.debug("Created {} communication {} ({}) for {}", type, saved.getId(), status, sendAt);
    return saved;
  }
}
