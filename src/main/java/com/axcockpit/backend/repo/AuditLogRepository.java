package com.axcockpit.backend.repo;

import com.axcockpit.backend.audit.AuditEntityType;
import com.axcockpit.backend.domain.AuditLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {

    List<AuditLog> findAllByEntityTypeAndEntityIdOrderByIdAsc(AuditEntityType entityType, String entityId);

    List<AuditLog> findAllByEntityTypeOrderByIdAsc(AuditEntityType entityType);

    List<AuditLog> findTop100ByOrderByIdDesc();
}
