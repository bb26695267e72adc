package io.b2mash.compliance.audit;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

  @Query(
      """
      SELECT e FROM AuditEvent e
      WHERE e.organizationId = :organizationId AND e.entityId = :entityId
      ORDER BY e.occurredAt DESC
      """)
  List<AuditEvent> findForEntity(
      @Param("organizationId") String organizationId, @Param("entityId") UUID entityId);
}
