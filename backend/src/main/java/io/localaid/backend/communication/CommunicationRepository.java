package io.localaid.backend.communication;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CommunicationRepository extends JpaRepository<Communication, UUID> {

  List<Communication> findBySubjectOrderByCreatedAtDesc(String subject);
}
