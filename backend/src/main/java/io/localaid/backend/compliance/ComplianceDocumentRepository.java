package io.localaid.backend.compliance;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ComplianceDocumentRepository extends JpaRepository<ComplianceDocument, UUID> {

  @Query(
      """
      SELECT d FROM ComplianceDocument d
      WHERE d.expiresAt >= :from
        AND d.expiresAt <= :to
        AND d.status NOT IN :excluded
      ORDER BY d.expiresAt ASC
      """)
  List<ComplianceDocument> findExpiringBetween(
      @Param("from") Instant from,
      @Param("to") Instant to,
      @Param("excluded") Collection<ComplianceDocumentStatus> excluded);

  @Query(
      """
      SELECT d FROM ComplianceDocument d
      WHERE d.expiresAt >= :from
        AND d.expiresAt <= :to
        AND d.status NOT IN :excluded
        AND d.docType = :docType
      ORDER BY d.expiresAt ASC
      """)
  List<ComplianceDocument> findExpiringBetweenForType(
      @Param("from") Instant from,
      @Param("to") Instant to,
      @Param("excluded") Collection<ComplianceDocumentStatus> excluded,
      @Param("docType") String docType);
}
